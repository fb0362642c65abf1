package com.issuequeue.models;

import java.util.List;

/**
 * An issue together with every blocker that is still unresolved.
 */
public class BlockedIssue {

    private final Issue issue;
    private final List<Issue> blockers;

    public BlockedIssue(Issue issue, List<Issue> blockers) {
        this.issue = issue;
        this.blockers = List.copyOf(blockers);
    }

    public Issue getIssue() {
        return issue;
    }

    public List<Issue> getBlockers() {
        return blockers;
    }
}

package com.issuequeue;

import com.issuequeue.models.BlockedIssue;
import com.issuequeue.models.Issue;
import com.issuequeue.models.IssueStatus;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Pure graph queries over an {@link IssueIndex}.
 *
 * Every dependency type counts as a blocking edge here, not only "blocks".
 */
public final class IssueAlgorithms {

    /**
     * Scheduling order: priority ascending, then creation time. Ties keep
     * storage order, which is creation order; callers rely on a stable sort.
     */
    public static final Comparator<Issue> SCHEDULING_ORDER = Comparator
        .comparingInt(Issue::getPriority)
        .thenComparingLong(Issue::getCreatedAt);

    private IssueAlgorithms() {
    }

    /**
     * Whether adding {@code fromId -> toId} would close a cycle, i.e. whether
     * {@code toId} can already reach {@code fromId} through existing edges.
     */
    public static boolean detectCycle(IssueIndex index, String fromId, String toId) {
        if (fromId.equals(toId)) {
            return true;
        }
        Deque<String> pending = new ArrayDeque<>();
        Set<String> visited = new HashSet<>();
        pending.push(toId);
        while (!pending.isEmpty()) {
            String current = pending.pop();
            if (current.equals(fromId)) {
                return true;
            }
            if (!visited.add(current)) {
                continue;
            }
            for (String next : index.getBlockers(current)) {
                if (!visited.contains(next)) {
                    pending.push(next);
                }
            }
        }
        return false;
    }

    /**
     * Open issues with no unresolved blocker, in scheduling order. {@code limit}
     * only truncates the ordered result; null means no limit.
     */
    public static List<Issue> getReadyIssues(IssueIndex index, Integer limit) {
        List<Issue> ready = new ArrayList<>();
        for (Issue issue : index.getAllIssues()) {
            if (issue.getStatus() == IssueStatus.OPEN && unresolvedBlockers(index, issue.getId()).isEmpty()) {
                ready.add(issue);
            }
        }
        ready.sort(SCHEDULING_ORDER);
        if (limit != null && limit < ready.size()) {
            return new ArrayList<>(ready.subList(0, Math.max(0, limit)));
        }
        return ready;
    }

    /**
     * Every issue with at least one unresolved blocker, whatever its own status,
     * paired with all of those blockers.
     */
    public static List<BlockedIssue> getBlockedIssues(IssueIndex index) {
        List<Issue> blockedIssues = new ArrayList<>();
        for (Issue issue : index.getAllIssues()) {
            if (!unresolvedBlockers(index, issue.getId()).isEmpty()) {
                blockedIssues.add(issue);
            }
        }
        blockedIssues.sort(SCHEDULING_ORDER);

        List<BlockedIssue> results = new ArrayList<>(blockedIssues.size());
        for (Issue issue : blockedIssues) {
            results.add(new BlockedIssue(issue, unresolvedBlockers(index, issue.getId())));
        }
        return results;
    }

    /**
     * Blockers of {@code issueId} whose status is neither closed nor completed.
     * Edges pointing at ids missing from the index are ignored.
     */
    public static List<Issue> unresolvedBlockers(IssueIndex index, String issueId) {
        List<Issue> unresolved = new ArrayList<>();
        for (String blockerId : index.getBlockers(issueId)) {
            Optional<Issue> blocker = index.getIssue(blockerId);
            if (blocker.isPresent() && !blocker.get().getStatus().isResolved()) {
                unresolved.add(blocker.get());
            }
        }
        unresolved.sort(SCHEDULING_ORDER);
        return unresolved;
    }
}

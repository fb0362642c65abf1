package com.issuequeue.models;

/**
 * Conjunctive listing filter. Unset fields match every issue.
 */
public class IssueFilter {

    private IssueStatus status;
    private Integer priority;
    private IssueType issueType;
    private String assignee;

    public static IssueFilter all() {
        return new IssueFilter();
    }

    public IssueFilter status(IssueStatus status) {
        this.status = status;
        return this;
    }

    public IssueFilter status(String status) {
        this.status = status != null ? IssueStatus.fromValue(status) : null;
        return this;
    }

    public IssueFilter priority(Integer priority) {
        this.priority = priority;
        return this;
    }

    public IssueFilter issueType(IssueType issueType) {
        this.issueType = issueType;
        return this;
    }

    public IssueFilter issueType(String issueType) {
        this.issueType = issueType != null ? IssueType.fromValue(issueType) : null;
        return this;
    }

    public IssueFilter assignee(String assignee) {
        this.assignee = assignee;
        return this;
    }

    public IssueStatus getStatus() {
        return status;
    }

    public Integer getPriority() {
        return priority;
    }

    public IssueType getIssueType() {
        return issueType;
    }

    public String getAssignee() {
        return assignee;
    }

    public boolean matches(Issue issue) {
        if (status != null && issue.getStatus() != status) {
            return false;
        }
        if (priority != null && issue.getPriority() != priority) {
            return false;
        }
        if (issueType != null && issue.getIssueType() != issueType) {
            return false;
        }
        return assignee == null || assignee.equals(issue.getAssignee());
    }
}

package com.issuequeue;

public class IssueNotFoundException extends IssueException {

    public IssueNotFoundException(String message) {
        super(message);
    }

    public static IssueNotFoundException issue(String issueId) {
        return new IssueNotFoundException("Issue not found: " + issueId);
    }

    public static IssueNotFoundException dependency(String fromId, String toId) {
        return new IssueNotFoundException("Dependency not found: " + fromId + " -> " + toId);
    }

    @Override
    public String getCode() {
        return "not-found";
    }
}

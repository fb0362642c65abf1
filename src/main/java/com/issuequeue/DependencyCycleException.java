package com.issuequeue;

public class DependencyCycleException extends IssueException {

    private final String fromId;
    private final String toId;

    public DependencyCycleException(String fromId, String toId) {
        super("Dependency would create a cycle: " + fromId + " -> " + toId);
        this.fromId = fromId;
        this.toId = toId;
    }

    public String getFromId() {
        return fromId;
    }

    public String getToId() {
        return toId;
    }

    @Override
    public String getCode() {
        return "cycle";
    }
}

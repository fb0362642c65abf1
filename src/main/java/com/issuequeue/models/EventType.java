package com.issuequeue.models;

/**
 * Event types written by the manager. The log may also hold types written by
 * other tools; those are kept as plain strings on {@link IssueEvent}.
 */
public enum EventType {
    CREATED("created"),
    UPDATED("updated"),
    CLOSED("closed"),
    DEPENDENCY_ADDED("dependency_added"),
    DEPENDENCY_REMOVED("dependency_removed"),
    SESSION_ENDED("session_ended");

    private final String value;

    EventType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static EventType find(String raw) {
        if (raw == null) {
            return null;
        }
        for (EventType type : values()) {
            if (type.value.equals(raw)) {
                return type;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return value;
    }
}

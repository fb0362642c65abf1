package com.issuequeue.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.issuequeue.IssueValidationException;

import java.util.Arrays;
import java.util.Map;
import java.util.stream.Collectors;

public enum IssueStatus {
    OPEN("open"),
    IN_PROGRESS("in_progress"),
    BLOCKED("blocked"),
    CLOSED("closed"),
    COMPLETED("completed"),
    PENDING_USER_INPUT("pending_user_input");

    // Legacy values written by older tooling.
    private static final Map<String, IssueStatus> ALIASES = Map.of(
        "done", COMPLETED,
        "waiting", PENDING_USER_INPUT
    );

    private final String value;

    IssueStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * True for statuses that no longer block dependents.
     */
    public boolean isResolved() {
        return this == CLOSED || this == COMPLETED;
    }

    @JsonCreator
    public static IssueStatus fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IssueValidationException("Status is required");
        }
        String key = raw.trim();
        IssueStatus alias = ALIASES.get(key);
        if (alias != null) {
            return alias;
        }
        for (IssueStatus status : values()) {
            if (status.value.equals(key)) {
                return status;
            }
        }
        throw new IssueValidationException("Invalid status. Must be one of: " + validValues());
    }

    public static String validValues() {
        return Arrays.stream(values()).map(IssueStatus::getValue).collect(Collectors.joining(", "));
    }

    @Override
    public String toString() {
        return value;
    }
}

package com.issuequeue.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.issuequeue.IssueValidationException;

public enum IssueType {
    BUG("bug"),
    FEATURE("feature"),
    TASK("task"),
    EPIC("epic"),
    CHORE("chore");

    private final String value;

    IssueType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static IssueType fromValue(String raw) {
        if (raw != null) {
            String key = raw.trim();
            for (IssueType type : values()) {
                if (type.value.equals(key)) {
                    return type;
                }
            }
        }
        throw new IssueValidationException("Invalid issue_type: " + raw);
    }

    @Override
    public String toString() {
        return value;
    }
}

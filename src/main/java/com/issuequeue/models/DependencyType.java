package com.issuequeue.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.issuequeue.IssueValidationException;

/**
 * Kind of edge between two issues. Every kind takes part in cycle detection
 * and in ready/blocked derivation.
 */
public enum DependencyType {
    BLOCKS("blocks"),
    RELATED("related"),
    PARENT_CHILD("parent-child"),
    DISCOVERED_FROM("discovered-from");

    private final String value;

    DependencyType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static DependencyType fromValue(String raw) {
        if (raw != null) {
            String key = raw.trim();
            for (DependencyType type : values()) {
                if (type.value.equals(key)) {
                    return type;
                }
            }
        }
        throw new IssueValidationException("Invalid dep_type: " + raw);
    }

    @Override
    public String toString() {
        return value;
    }
}

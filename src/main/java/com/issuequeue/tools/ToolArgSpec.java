package com.issuequeue.tools;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.Set;

public class ToolArgSpec {
    public enum Type {
        STRING,
        INT,
        BOOLEAN,
        OBJECT,
        // integer 0-4 or a priority word such as "high"
        PRIORITY
    }

    private final String name;
    private final Type type;
    private final boolean required;
    private final Set<String> allowedValues;

    public ToolArgSpec(String name, Type type, boolean required) {
        this(name, type, required, null);
    }

    public ToolArgSpec(String name, Type type, boolean required, Set<String> allowedValues) {
        this.name = name;
        this.type = type;
        this.required = required;
        this.allowedValues = allowedValues;
    }

    public String getName() {
        return name;
    }

    public Type getType() {
        return type;
    }

    public boolean isRequired() {
        return required;
    }

    public Set<String> getAllowedValues() {
        return allowedValues == null ? Set.of() : Collections.unmodifiableSet(allowedValues);
    }

    public String validate(JsonNode node) {
        if (node == null || node.isNull()) {
            return required ? "missing-required:" + name : null;
        }
        switch (type) {
            case STRING:
                if (!node.isTextual()) {
                    return "invalid-type:" + name;
                }
                if (required && node.asText().isBlank()) {
                    return "missing-required:" + name;
                }
                if (allowedValues != null && !allowedValues.isEmpty() && !allowedValues.contains(node.asText())) {
                    return "invalid-enum:" + name;
                }
                return null;
            case INT:
                return node.isInt() ? null : "invalid-type:" + name;
            case BOOLEAN:
                return node.isBoolean() ? null : "invalid-type:" + name;
            case OBJECT:
                return node.isObject() ? null : "invalid-type:" + name;
            case PRIORITY:
                return node.isInt() || node.isTextual() ? null : "invalid-type:" + name;
            default:
                return "invalid-type:" + name;
        }
    }
}

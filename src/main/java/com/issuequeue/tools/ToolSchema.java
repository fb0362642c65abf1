package com.issuequeue.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Declared params of one tool operation.
 */
public class ToolSchema {
    private final String operation;
    private final Map<String, ToolArgSpec> args = new HashMap<>();
    // Alias -> canonical arg name
    private final Map<String, String> argAliases = new HashMap<>();

    public ToolSchema(String operation) {
        this.operation = operation;
    }

    public ToolSchema arg(String name, ToolArgSpec.Type type, boolean required) {
        args.put(name, new ToolArgSpec(name, type, required));
        return this;
    }

    public ToolSchema arg(String name, ToolArgSpec.Type type, boolean required, Set<String> allowedValues) {
        args.put(name, new ToolArgSpec(name, type, required, allowedValues));
        return this;
    }

    public ToolSchema alias(String alias, String canonical) {
        if (alias == null || alias.isBlank() || canonical == null || canonical.isBlank()) {
            return this;
        }
        argAliases.put(normalizeArgKey(alias), canonical);
        return this;
    }

    public String getOperation() {
        return operation;
    }

    public Set<String> getArgNames() {
        return args.keySet();
    }

    public Map<String, ToolArgSpec> getArgSpecs() {
        return Collections.unmodifiableMap(args);
    }

    /**
     * Copy of {@code argsNode} with keys trimmed and mapped onto canonical names
     * ("Issue-ID" and "id" both become "issue_id" when declared).
     */
    public JsonNode normalizeArgsNode(JsonNode argsNode) {
        if (argsNode == null || !argsNode.isObject()) {
            return argsNode;
        }
        ObjectNode obj = ((ObjectNode) argsNode).deepCopy();

        List<String> keys = new ArrayList<>();
        Iterator<String> it = obj.fieldNames();
        while (it.hasNext()) {
            keys.add(it.next());
        }
        for (String key : keys) {
            if (args.containsKey(key)) continue;

            String norm = normalizeArgKey(key);
            String canonical;
            if (args.containsKey(norm)) {
                canonical = norm;
            } else {
                canonical = argAliases.get(norm);
            }
            if (canonical == null || canonical.isBlank()) {
                continue;
            }
            if (!obj.has(canonical)) {
                obj.set(canonical, obj.get(key));
            }
            obj.remove(key);
        }
        return obj;
    }

    private String normalizeArgKey(String key) {
        if (key == null) return "";
        String k = key.trim().toLowerCase();
        if (k.isEmpty()) return "";
        // Unify common separators.
        k = k.replace('-', '_').replace(' ', '_');
        return k;
    }

    /**
     * Returns an error code for the first problem found, or null when the args are valid.
     */
    public String validate(JsonNode argsNode) {
        JsonNode normalized = normalizeArgsNode(argsNode);
        if (normalized == null || !normalized.isObject()) {
            return "args-not-object";
        }
        for (ToolArgSpec spec : args.values()) {
            String error = spec.validate(normalized.get(spec.getName()));
            if (error != null) {
                return error;
            }
        }
        Iterator<String> fields = normalized.fieldNames();
        while (fields.hasNext()) {
            String field = fields.next();
            if (!args.containsKey(field)) {
                return "unknown-arg:" + field;
            }
        }
        return null;
    }
}

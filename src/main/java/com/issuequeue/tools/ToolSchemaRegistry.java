package com.issuequeue.tools;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

public class ToolSchemaRegistry {
    private final Map<String, ToolSchema> schemas = new LinkedHashMap<>();

    public ToolSchemaRegistry register(ToolSchema schema) {
        if (schema != null && schema.getOperation() != null) {
            schemas.put(schema.getOperation(), schema);
        }
        return this;
    }

    public boolean hasOperation(String operation) {
        return operation != null && schemas.containsKey(operation);
    }

    public ToolSchema getSchema(String operation) {
        return operation != null ? schemas.get(operation) : null;
    }

    public Set<String> getOperations() {
        return Collections.unmodifiableSet(schemas.keySet());
    }
}

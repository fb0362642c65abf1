package com.issuequeue.tools;

import com.fasterxml.jackson.databind.JsonNode;

public class ToolExecutionResult {
    private final JsonNode output;
    private final boolean ok;
    private final String error;
    private final String message;

    public ToolExecutionResult(JsonNode output, boolean ok, String error, String message) {
        this.output = output;
        this.ok = ok;
        this.error = error;
        this.message = message;
    }

    public static ToolExecutionResult ok(JsonNode output) {
        return new ToolExecutionResult(output, true, null, null);
    }

    public static ToolExecutionResult error(String error, String message) {
        return new ToolExecutionResult(null, false, error, message);
    }

    public JsonNode getOutput() {
        return output;
    }

    public boolean isOk() {
        return ok;
    }

    public String getError() {
        return error;
    }

    public String getMessage() {
        return message;
    }
}

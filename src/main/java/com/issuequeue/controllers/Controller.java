package com.issuequeue.controllers;

import com.issuequeue.IssueException;
import io.javalin.Javalin;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An HTTP route group. Failures are thrown from handlers and rendered by the
 * app's exception mappers through {@link #errorBody(Exception)}.
 */
public interface Controller {

    void registerRoutes(Javalin app);

    /**
     * {@code {"error": message, "code": kind}}. Engine failures carry their own kind;
     * anything else is reported as "internal".
     */
    static Map<String, Object> errorBody(Exception e) {
        String message = e.getMessage();
        if (message == null || message.isBlank()) {
            message = e.getClass().getSimpleName();
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        body.put("code", e instanceof IssueException ? ((IssueException) e).getCode() : "internal");
        return body;
    }
}

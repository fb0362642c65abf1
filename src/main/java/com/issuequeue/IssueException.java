package com.issuequeue;

/**
 * Base type for every failure the issue engine reports to its caller.
 */
public class IssueException extends RuntimeException {

    public IssueException(String message) {
        super(message);
    }

    public IssueException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Stable machine-readable kind, shared by the tool adapter and the HTTP error body.
     */
    public String getCode() {
        return "error";
    }
}

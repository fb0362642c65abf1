package com.issuequeue;

/**
 * The data directory lock could not be taken. Callers may retry.
 */
public class IssueLockException extends IssueException {

    public IssueLockException(String message) {
        super(message);
    }

    public IssueLockException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getCode() {
        return "lock-timeout";
    }
}

package com.issuequeue;

/**
 * Persisted state could not be read or written. Corrupt records end up here too.
 */
public class IssueStorageException extends IssueException {

    public IssueStorageException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getCode() {
        return "storage";
    }
}

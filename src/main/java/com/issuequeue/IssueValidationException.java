package com.issuequeue;

/**
 * Input was rejected before any lock was taken or state was touched.
 */
public class IssueValidationException extends IssueException {

    public IssueValidationException(String message) {
        super(message);
    }

    @Override
    public String getCode() {
        return "validation";
    }
}

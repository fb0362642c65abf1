package com.issuequeue.models;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Optional field changes for an update. Only fields that were set are applied,
 * and each applied field is recorded in the "updated" event.
 */
public class IssueUpdate {

    private String title;
    private String description;
    private String status;
    private Integer priority;
    private String assignee;
    private String blockingNotes;
    private Map<String, Object> metadata;

    public IssueUpdate title(String title) {
        this.title = title;
        return this;
    }

    public IssueUpdate description(String description) {
        this.description = description;
        return this;
    }

    public IssueUpdate status(String status) {
        this.status = status;
        return this;
    }

    public IssueUpdate status(IssueStatus status) {
        this.status = status != null ? status.getValue() : null;
        return this;
    }

    public IssueUpdate priority(Integer priority) {
        this.priority = priority;
        return this;
    }

    public IssueUpdate assignee(String assignee) {
        this.assignee = assignee;
        return this;
    }

    public IssueUpdate blockingNotes(String blockingNotes) {
        this.blockingNotes = blockingNotes;
        return this;
    }

    public IssueUpdate metadata(Map<String, Object> metadata) {
        this.metadata = metadata != null ? new LinkedHashMap<>(metadata) : null;
        return this;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public String getStatus() {
        return status;
    }

    public Integer getPriority() {
        return priority;
    }

    public String getAssignee() {
        return assignee;
    }

    public String getBlockingNotes() {
        return blockingNotes;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }
}

package com.issuequeue.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
public class Issue {

    private String id;
    private String title;
    private String description = "";
    private IssueStatus status = IssueStatus.OPEN;
    private int priority = 2;
    private IssueType issueType = IssueType.TASK;
    private String assignee;
    private long createdAt;
    private long updatedAt;
    private Long closedAt;
    private String parentId;
    private String discoveredFrom;
    private String blockingNotes;
    private Map<String, Object> metadata = new LinkedHashMap<>();

    public Issue() {
    }

    public Issue(String id, String title, String description, IssueStatus status, int priority,
                 IssueType issueType, String assignee, long createdAt, long updatedAt) {
        this.id = id;
        this.title = title;
        this.description = description != null ? description : "";
        this.status = status;
        this.priority = priority;
        this.issueType = issueType;
        this.assignee = assignee;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    public Issue(Issue other) {
        this(other.id, other.title, other.description, other.status, other.priority,
            other.issueType, other.assignee, other.createdAt, other.updatedAt);
        this.closedAt = other.closedAt;
        this.parentId = other.parentId;
        this.discoveredFrom = other.discoveredFrom;
        this.blockingNotes = other.blockingNotes;
        setMetadata(other.metadata);
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description != null ? description : "";
    }

    public IssueStatus getStatus() {
        return status;
    }

    public void setStatus(IssueStatus status) {
        this.status = status;
    }

    public int getPriority() {
        return priority;
    }

    public void setPriority(int priority) {
        this.priority = priority;
    }

    public IssueType getIssueType() {
        return issueType;
    }

    public void setIssueType(IssueType issueType) {
        this.issueType = issueType;
    }

    public String getAssignee() {
        return assignee;
    }

    public void setAssignee(String assignee) {
        this.assignee = assignee;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(long createdAt) {
        this.createdAt = createdAt;
    }

    public long getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(long updatedAt) {
        this.updatedAt = updatedAt;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public Long getClosedAt() {
        return closedAt;
    }

    public void setClosedAt(Long closedAt) {
        this.closedAt = closedAt;
    }

    public String getParentId() {
        return parentId;
    }

    public void setParentId(String parentId) {
        this.parentId = parentId;
    }

    public String getDiscoveredFrom() {
        return discoveredFrom;
    }

    public void setDiscoveredFrom(String discoveredFrom) {
        this.discoveredFrom = discoveredFrom;
    }

    public String getBlockingNotes() {
        return blockingNotes;
    }

    public void setBlockingNotes(String blockingNotes) {
        this.blockingNotes = blockingNotes;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public void setMetadata(Map<String, Object> metadata) {
        this.metadata = metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>();
    }

    @Override
    public String toString() {
        return "Issue{" +
            "id='" + id + '\'' +
            ", title='" + title + '\'' +
            ", status=" + status +
            ", priority=" + priority +
            ", issueType=" + issueType +
            ", assignee='" + assignee + '\'' +
            ", createdAt=" + createdAt +
            ", updatedAt=" + updatedAt +
            '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Issue issue = (Issue) o;
        return Objects.equals(id, issue.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }
}

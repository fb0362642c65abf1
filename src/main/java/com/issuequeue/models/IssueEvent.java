package com.issuequeue.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.issuequeue.storage.JsonStorage;

/**
 * Immutable audit record appended to the event log. The setters exist for
 * Jackson only; {@code changes} is decoded once both it and the event type are known.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class IssueEvent {

    private String id;
    private String issueId;
    private String eventType;
    private String actor;
    private EventChanges changes;
    private long timestamp;
    private String sessionId;

    private JsonNode pendingChanges;

    public IssueEvent() {
    }

    public IssueEvent(String id, String issueId, EventType eventType, String actor, EventChanges changes,
                      long timestamp, String sessionId) {
        this.id = id;
        this.issueId = issueId;
        this.eventType = eventType.getValue();
        this.actor = actor;
        this.changes = changes;
        this.timestamp = timestamp;
        this.sessionId = sessionId;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getIssueId() {
        return issueId;
    }

    public void setIssueId(String issueId) {
        this.issueId = issueId;
    }

    public String getEventType() {
        return eventType;
    }

    public void setEventType(String eventType) {
        this.eventType = eventType;
        decodePendingChanges();
    }

    public String getActor() {
        return actor;
    }

    public void setActor(String actor) {
        this.actor = actor;
    }

    public EventChanges getChanges() {
        return changes;
    }

    @JsonSetter("changes")
    public void setChangesNode(JsonNode node) {
        this.pendingChanges = node;
        decodePendingChanges();
    }

    public long getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(long timestamp) {
        this.timestamp = timestamp;
    }

    public String getSessionId() {
        return sessionId;
    }

    public void setSessionId(String sessionId) {
        this.sessionId = sessionId;
    }

    private void decodePendingChanges() {
        if (pendingChanges == null || eventType == null) {
            return;
        }
        try {
            this.changes = EventChanges.fromJson(eventType, pendingChanges, JsonStorage.mapper());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed changes for " + eventType + " event: " + e.getOriginalMessage(), e);
        }
        this.pendingChanges = null;
    }

    @Override
    public String toString() {
        return "IssueEvent{" +
            "id='" + id + '\'' +
            ", issueId='" + issueId + '\'' +
            ", eventType='" + eventType + '\'' +
            ", actor='" + actor + '\'' +
            ", timestamp=" + timestamp +
            ", sessionId='" + sessionId + '\'' +
            '}';
    }
}

package com.issuequeue.models;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Payload of an {@link IssueEvent}, one variant per event type. Every variant
 * serializes to the plain JSON object stored under {@code changes} in the event log.
 */
public interface EventChanges {

    TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    /**
     * Decode a stored {@code changes} object using the sibling {@code event_type}.
     * Types this engine does not write are kept as {@link Generic}.
     */
    static EventChanges fromJson(String eventType, JsonNode node, ObjectMapper mapper) throws JsonProcessingException {
        JsonNode source = node != null && !node.isNull() ? node : mapper.createObjectNode();
        EventType type = EventType.find(eventType);
        if (type == null) {
            return new Generic(mapper.convertValue(source, MAP_TYPE));
        }
        switch (type) {
            case CREATED:
                JsonNode issueNode = source.get("issue");
                return new Created(issueNode != null ? mapper.treeToValue(issueNode, Issue.class) : null);
            case UPDATED:
                Updated updated = new Updated();
                Iterator<Map.Entry<String, JsonNode>> fields = source.fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> field = fields.next();
                    if ("metadata".equals(field.getKey())) {
                        updated.setMetadata(mapper.convertValue(field.getValue(), MAP_TYPE));
                    } else {
                        updated.put(field.getKey(),
                            plainValue(field.getValue().get("old"), mapper),
                            plainValue(field.getValue().get("new"), mapper));
                    }
                }
                return updated;
            case CLOSED:
                return new Closed(source.path("reason").asText(null));
            case DEPENDENCY_ADDED:
            case DEPENDENCY_REMOVED:
                String depType = source.path("dep_type").asText(null);
                return new DependencyChange(
                    source.path("from_id").asText(null),
                    source.path("to_id").asText(null),
                    depType != null ? DependencyType.fromValue(depType) : null);
            case SESSION_ENDED:
                return new SessionEnded(source.path("reason").asText(null));
            default:
                return new Generic(mapper.convertValue(source, MAP_TYPE));
        }
    }

    private static Object plainValue(JsonNode node, ObjectMapper mapper) throws JsonProcessingException {
        if (node == null || node.isNull()) {
            return null;
        }
        return mapper.treeToValue(node, Object.class);
    }

    final class Created implements EventChanges {
        private final Issue issue;

        public Created(Issue issue) {
            this.issue = issue;
        }

        public Issue getIssue() {
            return issue;
        }
    }

    /**
     * Field name to {old, new}; metadata is recorded as the merged-in map.
     */
    final class Updated implements EventChanges {
        private final Map<String, FieldChange> fields = new LinkedHashMap<>();
        private Map<String, Object> metadata;

        public void put(String field, Object oldValue, Object newValue) {
            fields.put(field, new FieldChange(oldValue, newValue));
        }

        @JsonIgnore
        public Map<String, FieldChange> getFields() {
            return fields;
        }

        public FieldChange get(String field) {
            return fields.get(field);
        }

        @JsonIgnore
        public Map<String, Object> getMetadata() {
            return metadata;
        }

        public void setMetadata(Map<String, Object> metadata) {
            this.metadata = metadata;
        }

        @JsonAnyGetter
        public Map<String, Object> asMap() {
            Map<String, Object> out = new LinkedHashMap<>(fields);
            if (metadata != null) {
                out.put("metadata", metadata);
            }
            return out;
        }
    }

    final class FieldChange {
        private final Object oldValue;
        private final Object newValue;

        public FieldChange(Object oldValue, Object newValue) {
            this.oldValue = oldValue;
            this.newValue = newValue;
        }

        @JsonProperty("old")
        public Object getOldValue() {
            return oldValue;
        }

        @JsonProperty("new")
        public Object getNewValue() {
            return newValue;
        }
    }

    final class Closed implements EventChanges {
        private final String reason;

        public Closed(String reason) {
            this.reason = reason;
        }

        public String getReason() {
            return reason;
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    final class DependencyChange implements EventChanges {
        private final String fromId;
        private final String toId;
        private final DependencyType depType;

        public DependencyChange(String fromId, String toId, DependencyType depType) {
            this.fromId = fromId;
            this.toId = toId;
            this.depType = depType;
        }

        public String getFromId() {
            return fromId;
        }

        public String getToId() {
            return toId;
        }

        public DependencyType getDepType() {
            return depType;
        }
    }

    final class SessionEnded implements EventChanges {
        private final String reason;

        public SessionEnded(String reason) {
            this.reason = reason;
        }

        public String getReason() {
            return reason;
        }
    }

    final class Generic implements EventChanges {
        private final Map<String, Object> values;

        public Generic(Map<String, Object> values) {
            this.values = values != null ? values : new LinkedHashMap<>();
        }

        @JsonAnyGetter
        public Map<String, Object> values() {
            return values;
        }
    }
}

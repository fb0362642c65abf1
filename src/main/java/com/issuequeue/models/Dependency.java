package com.issuequeue.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Objects;

/**
 * Directed edge {@code fromId -> toId}: the "from" issue is blocked by the "to" issue.
 * Edges are never edited in place; change the type by removing and re-adding.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Dependency {

    private String fromId;
    private String toId;
    private DependencyType depType = DependencyType.BLOCKS;
    private long createdAt;

    public Dependency() {
    }

    public Dependency(String fromId, String toId, DependencyType depType, long createdAt) {
        this.fromId = fromId;
        this.toId = toId;
        this.depType = depType;
        this.createdAt = createdAt;
    }

    public String getFromId() {
        return fromId;
    }

    public void setFromId(String fromId) {
        this.fromId = fromId;
    }

    public String getToId() {
        return toId;
    }

    public void setToId(String toId) {
        this.toId = toId;
    }

    public DependencyType getDepType() {
        return depType;
    }

    public void setDepType(DependencyType depType) {
        this.depType = depType;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(long createdAt) {
        this.createdAt = createdAt;
    }

    @Override
    public String toString() {
        return "Dependency{" + fromId + " -> " + toId + ", depType=" + depType + ", createdAt=" + createdAt + '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Dependency that = (Dependency) o;
        return Objects.equals(fromId, that.fromId) && Objects.equals(toId, that.toId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fromId, toId);
    }
}

package com.issuequeue;

import com.issuequeue.models.Dependency;
import com.issuequeue.models.Issue;
import com.issuequeue.models.IssueFilter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Transient graph view of one data directory. Built from storage at the start
 * of a manager operation and dropped at its end; never shared.
 */
public class IssueIndex {

    private final Map<String, Issue> issues = new LinkedHashMap<>();
    private final Map<EdgeKey, Dependency> dependencies = new LinkedHashMap<>();
    // issue id -> ids of the issues blocking it
    private final Map<String, Set<String>> blockers = new HashMap<>();
    // issue id -> ids of the issues it blocks
    private final Map<String, Set<String>> dependents = new HashMap<>();

    public static IssueIndex of(Collection<Issue> issues, Collection<Dependency> dependencies) {
        IssueIndex index = new IssueIndex();
        for (Issue issue : issues) {
            index.addIssue(issue);
        }
        for (Dependency dependency : dependencies) {
            index.addDependency(dependency);
        }
        return index;
    }

    public void addIssue(Issue issue) {
        issues.put(issue.getId(), issue);
    }

    /**
     * Adds an edge. A second edge for the same (from, to) pair replaces the first.
     */
    public void addDependency(Dependency dependency) {
        EdgeKey key = new EdgeKey(dependency.getFromId(), dependency.getToId());
        dependencies.put(key, dependency);
        blockers.computeIfAbsent(dependency.getFromId(), id -> new LinkedHashSet<>()).add(dependency.getToId());
        dependents.computeIfAbsent(dependency.getToId(), id -> new LinkedHashSet<>()).add(dependency.getFromId());
    }

    public boolean removeDependency(String fromId, String toId) {
        Dependency removed = dependencies.remove(new EdgeKey(fromId, toId));
        if (removed == null) {
            return false;
        }
        removeAdjacent(blockers, fromId, toId);
        removeAdjacent(dependents, toId, fromId);
        return true;
    }

    public boolean hasDependency(String fromId, String toId) {
        return dependencies.containsKey(new EdgeKey(fromId, toId));
    }

    public Optional<Dependency> getDependency(String fromId, String toId) {
        return Optional.ofNullable(dependencies.get(new EdgeKey(fromId, toId)));
    }

    public Optional<Issue> getIssue(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(issues.get(id));
    }

    public boolean containsIssue(String id) {
        return id != null && issues.containsKey(id);
    }

    public Collection<Issue> getAllIssues() {
        return Collections.unmodifiableCollection(issues.values());
    }

    public List<Issue> listIssues(IssueFilter filter) {
        IssueFilter effective = filter != null ? filter : IssueFilter.all();
        List<Issue> results = new ArrayList<>();
        for (Issue issue : issues.values()) {
            if (effective.matches(issue)) {
                results.add(issue);
            }
        }
        return results;
    }

    public Set<String> getBlockers(String id) {
        Set<String> ids = blockers.get(id);
        return ids != null ? Collections.unmodifiableSet(ids) : Set.of();
    }

    public Set<String> getDependents(String id) {
        Set<String> ids = dependents.get(id);
        return ids != null ? Collections.unmodifiableSet(ids) : Set.of();
    }

    public List<Dependency> getAllDependencies() {
        return new ArrayList<>(dependencies.values());
    }

    public int issueCount() {
        return issues.size();
    }

    public int dependencyCount() {
        return dependencies.size();
    }

    private static void removeAdjacent(Map<String, Set<String>> adjacency, String key, String value) {
        Set<String> ids = adjacency.get(key);
        if (ids == null) {
            return;
        }
        ids.remove(value);
        if (ids.isEmpty()) {
            adjacency.remove(key);
        }
    }

    private record EdgeKey(String fromId, String toId) {}
}

package com.issuequeue.storage;

import com.issuequeue.AppLogger;
import com.issuequeue.IssueManager;
import com.issuequeue.IssueStorageException;
import com.issuequeue.models.Dependency;
import com.issuequeue.models.Issue;
import com.issuequeue.models.IssueEvent;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Durable state of one data directory.
 *
 * Layout:
 *   {dataDir}/
 *   ├── issues.jsonl        full snapshot, rewritten on every issue mutation
 *   ├── dependencies.jsonl  full snapshot, rewritten on every dependency mutation
 *   └── events.jsonl        append-only audit log
 *
 * Nothing is cached between calls. Writers are serialized by the caller's lock.
 */
public class IssueStorage {

    public static final String ISSUES_FILE = "issues.jsonl";
    public static final String DEPENDENCIES_FILE = "dependencies.jsonl";
    public static final String EVENTS_FILE = "events.jsonl";

    private final Path dataDir;
    private final Path issuesPath;
    private final Path dependenciesPath;
    private final Path eventsPath;

    public IssueStorage(Path dataDir) {
        this.dataDir = dataDir;
        this.issuesPath = dataDir.resolve(ISSUES_FILE);
        this.dependenciesPath = dataDir.resolve(DEPENDENCIES_FILE);
        this.eventsPath = dataDir.resolve(EVENTS_FILE);
    }

    public Path getDataDir() {
        return dataDir;
    }

    public List<Issue> loadIssues() {
        try {
            Set<String> seenIds = new HashSet<>();
            return JsonStorage.readJsonLines(issuesPath, Issue.class, issue -> checkIssue(issue, seenIds));
        } catch (IOException e) {
            throw new IssueStorageException("Failed to load issues from " + issuesPath + ": " + e.getMessage(), e);
        }
    }

    public void saveIssues(Collection<Issue> issues) {
        try {
            JsonStorage.writeJsonLinesAtomic(issuesPath, issues);
        } catch (IOException e) {
            throw new IssueStorageException("Failed to save issues to " + issuesPath + ": " + e.getMessage(), e);
        }
    }

    public List<Dependency> loadDependencies() {
        try {
            return JsonStorage.readJsonLines(dependenciesPath, Dependency.class, IssueStorage::checkDependency);
        } catch (IOException e) {
            throw new IssueStorageException("Failed to load dependencies from " + dependenciesPath + ": " + e.getMessage(), e);
        }
    }

    public void saveDependencies(Collection<Dependency> dependencies) {
        try {
            JsonStorage.writeJsonLinesAtomic(dependenciesPath, dependencies);
        } catch (IOException e) {
            throw new IssueStorageException("Failed to save dependencies to " + dependenciesPath + ": " + e.getMessage(), e);
        }
    }

    public void appendEvent(IssueEvent event) {
        try {
            JsonStorage.appendJsonLine(eventsPath, event);
        } catch (IOException e) {
            throw new IssueStorageException("Failed to append event to " + eventsPath + ": " + e.getMessage(), e);
        }
    }

    public List<IssueEvent> loadEvents() {
        try {
            List<IssueEvent> events = JsonStorage.readJsonLines(eventsPath, IssueEvent.class);
            log("Loaded " + events.size() + " event(s) from " + eventsPath.getFileName());
            return events;
        } catch (IOException e) {
            throw new IssueStorageException("Failed to load events from " + eventsPath + ": " + e.getMessage(), e);
        }
    }

    static String checkIssue(Issue issue, Set<String> seenIds) {
        if (isBlank(issue.getId())) {
            return "missing id";
        }
        if (issue.getStatus() == null) {
            return "missing status for issue " + issue.getId();
        }
        if (issue.getIssueType() == null) {
            return "missing issue_type for issue " + issue.getId();
        }
        if (issue.getPriority() < IssueManager.MIN_PRIORITY || issue.getPriority() > IssueManager.MAX_PRIORITY) {
            return "priority " + issue.getPriority() + " out of range for issue " + issue.getId();
        }
        if (!seenIds.add(issue.getId())) {
            return "duplicate id " + issue.getId();
        }
        return null;
    }

    static String checkDependency(Dependency dependency) {
        if (isBlank(dependency.getFromId())) {
            return "missing from_id";
        }
        if (isBlank(dependency.getToId())) {
            return "missing to_id";
        }
        if (dependency.getDepType() == null) {
            return "missing dep_type";
        }
        return null;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private void log(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.debug("[IssueStorage] " + message);
        }
    }
}

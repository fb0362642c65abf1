package com.issuequeue;

import com.issuequeue.models.BlockedIssue;
import com.issuequeue.models.Dependency;
import com.issuequeue.models.DependencyType;
import com.issuequeue.models.EventChanges;
import com.issuequeue.models.EventType;
import com.issuequeue.models.Issue;
import com.issuequeue.models.IssueEvent;
import com.issuequeue.models.IssueFilter;
import com.issuequeue.models.IssueSessions;
import com.issuequeue.models.IssueStatus;
import com.issuequeue.models.IssueType;
import com.issuequeue.models.IssueUpdate;
import com.issuequeue.storage.IssueStorage;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.function.Function;

/**
 * Entry point for every issue operation.
 *
 * Each call is a self-contained transaction: take the directory lock, rebuild
 * a fresh {@link IssueIndex} from storage, apply the change, write the
 * affected snapshot back, release the lock. Mutations then append their audit
 * event outside the lock. No state survives between calls, so any number of
 * processes can share one data directory.
 */
public class IssueManager {

    public static final Duration DEFAULT_LOCK_TIMEOUT = Duration.ofSeconds(10);
    public static final String LOCK_FILE = ".issues.lock";
    public static final String DEFAULT_ACTOR = "system";
    public static final String DEFAULT_CLOSE_REASON = "Completed";
    public static final String SESSION_ENDED_REASON = "session terminated";
    public static final int MIN_PRIORITY = 0;
    public static final int MAX_PRIORITY = 4;
    public static final int DEFAULT_PRIORITY = 2;

    private enum Persist { NONE, ISSUES, DEPENDENCIES }

    private final IssueStorage storage;
    private final Path lockPath;
    private final String actor;
    private final String sessionId;
    private final Duration lockTimeout;

    public IssueManager(Path dataDir) {
        this(dataDir, DEFAULT_ACTOR, null, DEFAULT_LOCK_TIMEOUT);
    }

    public IssueManager(Path dataDir, String actor, String sessionId) {
        this(dataDir, actor, sessionId, DEFAULT_LOCK_TIMEOUT);
    }

    public IssueManager(Path dataDir, String actor, String sessionId, Duration lockTimeout) {
        this.storage = new IssueStorage(dataDir);
        this.lockPath = dataDir.resolve(LOCK_FILE);
        this.actor = actor != null && !actor.isBlank() ? actor : DEFAULT_ACTOR;
        this.sessionId = sessionId != null && !sessionId.isBlank() ? sessionId : null;
        this.lockTimeout = lockTimeout != null ? lockTimeout : DEFAULT_LOCK_TIMEOUT;
    }

    public static IssueManager fromConfig(AppConfig config) {
        return new IssueManager(config.getDataDir(), config.getActor(), config.getSessionId(), config.getLockTimeout());
    }

    public Path getDataDir() {
        return storage.getDataDir();
    }

    public String getActor() {
        return actor;
    }

    public String getSessionId() {
        return sessionId;
    }

    // --- issues ---

    public Issue create(String title) {
        return create(title, "", DEFAULT_PRIORITY, IssueType.TASK.getValue(), null, null, null, null);
    }

    public Issue create(String title, String description, int priority, String issueType, String assignee,
                        String parentId, String discoveredFrom, Map<String, Object> metadata) {
        requireText(title, "title");
        validatePriority(priority);
        IssueType type = IssueType.fromValue(issueType != null ? issueType : IssueType.TASK.getValue());

        long now = System.currentTimeMillis();
        Issue issue = new Issue(UUID.randomUUID().toString(), title, description, IssueStatus.OPEN,
            priority, type, assignee, now, now);
        issue.setParentId(parentId);
        issue.setDiscoveredFrom(discoveredFrom);
        issue.setMetadata(metadata);

        Issue created = inTransaction(Persist.ISSUES, index -> {
            index.addIssue(issue);
            return issue;
        });
        log("Issue created: " + created.getId() + " - " + created.getTitle());
        emitEvent(created.getId(), EventType.CREATED, new EventChanges.Created(new Issue(created)));
        return created;
    }

    public Optional<Issue> get(String issueId) {
        requireText(issueId, "issue_id");
        return inTransaction(Persist.NONE, index -> index.getIssue(issueId));
    }

    public Issue update(String issueId, IssueUpdate update) {
        requireText(issueId, "issue_id");
        IssueUpdate fields = update != null ? update : new IssueUpdate();
        IssueStatus status = fields.getStatus() != null ? IssueStatus.fromValue(fields.getStatus()) : null;
        if (fields.getPriority() != null) {
            validatePriority(fields.getPriority());
        }

        EventChanges.Updated changes = new EventChanges.Updated();
        Issue updated = inTransaction(Persist.ISSUES, index -> {
            Issue issue = index.getIssue(issueId).orElseThrow(() -> IssueNotFoundException.issue(issueId));
            if (fields.getTitle() != null) {
                changes.put("title", issue.getTitle(), fields.getTitle());
                issue.setTitle(fields.getTitle());
            }
            if (fields.getDescription() != null) {
                changes.put("description", issue.getDescription(), fields.getDescription());
                issue.setDescription(fields.getDescription());
            }
            if (status != null) {
                changes.put("status", issue.getStatus().getValue(), status.getValue());
                issue.setStatus(status);
            }
            if (fields.getPriority() != null) {
                changes.put("priority", issue.getPriority(), fields.getPriority());
                issue.setPriority(fields.getPriority());
            }
            if (fields.getAssignee() != null) {
                changes.put("assignee", issue.getAssignee(), fields.getAssignee());
                issue.setAssignee(fields.getAssignee());
            }
            if (fields.getBlockingNotes() != null) {
                changes.put("blocking_notes", issue.getBlockingNotes(), fields.getBlockingNotes());
                issue.setBlockingNotes(fields.getBlockingNotes());
            }
            if (fields.getMetadata() != null) {
                issue.getMetadata().putAll(fields.getMetadata());
                changes.setMetadata(new LinkedHashMap<>(fields.getMetadata()));
            }
            issue.setUpdatedAt(System.currentTimeMillis());
            return issue;
        });
        emitEvent(issueId, EventType.UPDATED, changes);
        return updated;
    }

    public Issue close(String issueId) {
        return close(issueId, DEFAULT_CLOSE_REASON);
    }

    public Issue close(String issueId, String reason) {
        requireText(issueId, "issue_id");
        String closeReason = reason != null && !reason.isBlank() ? reason : DEFAULT_CLOSE_REASON;
        Issue closed = inTransaction(Persist.ISSUES, index -> {
            Issue issue = index.getIssue(issueId).orElseThrow(() -> IssueNotFoundException.issue(issueId));
            long now = System.currentTimeMillis();
            issue.setStatus(IssueStatus.CLOSED);
            issue.setClosedAt(now);
            issue.setUpdatedAt(now);
            return issue;
        });
        log("Issue closed: " + issueId + " (" + closeReason + ")");
        emitEvent(issueId, EventType.CLOSED, new EventChanges.Closed(closeReason));
        return closed;
    }

    public List<Issue> list() {
        return list(IssueFilter.all());
    }

    public List<Issue> list(IssueFilter filter) {
        return inTransaction(Persist.NONE, index -> index.listIssues(filter));
    }

    // --- dependencies ---

    public Dependency addDependency(String fromId, String toId) {
        return addDependency(fromId, toId, DependencyType.BLOCKS);
    }

    public Dependency addDependency(String fromId, String toId, String depType) {
        return addDependency(fromId, toId,
            DependencyType.fromValue(depType != null ? depType : DependencyType.BLOCKS.getValue()));
    }

    public Dependency addDependency(String fromId, String toId, DependencyType depType) {
        requireText(fromId, "from_id");
        requireText(toId, "to_id");
        if (depType == null) {
            throw new IssueValidationException("dep_type is required");
        }

        Dependency added = inTransaction(Persist.DEPENDENCIES, index -> {
            if (!index.containsIssue(fromId)) {
                throw IssueNotFoundException.issue(fromId);
            }
            if (!index.containsIssue(toId)) {
                throw IssueNotFoundException.issue(toId);
            }
            if (index.hasDependency(fromId, toId)) {
                throw new IssueValidationException("Dependency already exists: " + fromId + " -> " + toId
                    + "; remove it first to change its type");
            }
            if (IssueAlgorithms.detectCycle(index, fromId, toId)) {
                throw new DependencyCycleException(fromId, toId);
            }
            Dependency dependency = new Dependency(fromId, toId, depType, System.currentTimeMillis());
            index.addDependency(dependency);
            return dependency;
        });
        log("Dependency added: " + fromId + " -> " + toId + " (" + depType + ")");
        emitEvent(fromId, EventType.DEPENDENCY_ADDED, new EventChanges.DependencyChange(fromId, toId, depType));
        return added;
    }

    public void removeDependency(String fromId, String toId) {
        requireText(fromId, "from_id");
        requireText(toId, "to_id");
        inTransaction(Persist.DEPENDENCIES, index -> {
            if (!index.removeDependency(fromId, toId)) {
                throw IssueNotFoundException.dependency(fromId, toId);
            }
            return null;
        });
        log("Dependency removed: " + fromId + " -> " + toId);
        emitEvent(fromId, EventType.DEPENDENCY_REMOVED, new EventChanges.DependencyChange(fromId, toId, null));
    }

    /**
     * Issues blocking {@code issueId}. Ids that no longer resolve are skipped.
     */
    public List<Issue> getDependencies(String issueId) {
        requireText(issueId, "issue_id");
        return inTransaction(Persist.NONE, index -> resolve(index, index.getBlockers(issueId)));
    }

    /**
     * Issues blocked by {@code issueId}. Ids that no longer resolve are skipped.
     */
    public List<Issue> getDependents(String issueId) {
        requireText(issueId, "issue_id");
        return inTransaction(Persist.NONE, index -> resolve(index, index.getDependents(issueId)));
    }

    public List<Dependency> listDependencies() {
        return inTransaction(Persist.NONE, IssueIndex::getAllDependencies);
    }

    // --- scheduling ---

    public List<Issue> getReadyIssues() {
        return getReadyIssues(null);
    }

    public List<Issue> getReadyIssues(Integer limit) {
        if (limit != null && limit < 0) {
            throw new IssueValidationException("limit must be >= 0");
        }
        return inTransaction(Persist.NONE, index -> IssueAlgorithms.getReadyIssues(index, limit));
    }

    public List<BlockedIssue> getBlockedIssues() {
        return inTransaction(Persist.NONE, IssueAlgorithms::getBlockedIssues);
    }

    // --- events and sessions ---

    /**
     * Events for one issue in log order. Reads the log without the lock, so
     * appends from other processes that just released it may not be visible yet.
     */
    public List<IssueEvent> getIssueEvents(String issueId) {
        requireText(issueId, "issue_id");
        List<IssueEvent> matching = new ArrayList<>();
        for (IssueEvent event : storage.loadEvents()) {
            if (issueId.equals(event.getIssueId())) {
                matching.add(event);
            }
        }
        return matching;
    }

    public IssueSessions getIssueSessions(String issueId) {
        requireText(issueId, "issue_id");
        inTransaction(Persist.NONE, index -> index.getIssue(issueId)
            .orElseThrow(() -> IssueNotFoundException.issue(issueId)));

        Map<String, List<String>> bySession = new TreeMap<>();
        for (IssueEvent event : getIssueEvents(issueId)) {
            if (event.getSessionId() != null) {
                bySession.computeIfAbsent(event.getSessionId(), id -> new ArrayList<>()).add(event.getEventType());
            }
        }
        return new IssueSessions(issueId, new ArrayList<>(bySession.keySet()), bySession);
    }

    /**
     * Records that this manager's session ended while touching the issue.
     * Best effort: unknown ids and any failure are ignored.
     */
    public void emitSessionEnded(String issueId) {
        if (issueId == null || issueId.isBlank()) {
            return;
        }
        try {
            boolean exists = inTransaction(Persist.NONE, index -> index.containsIssue(issueId));
            if (!exists) {
                return;
            }
            storage.appendEvent(newEvent(issueId, EventType.SESSION_ENDED,
                new EventChanges.SessionEnded(SESSION_ENDED_REASON)));
        } catch (IssueException e) {
            logWarning("Could not record session end for " + issueId + ": " + e.getMessage());
        }
    }

    // --- internals ---

    private <T> T inTransaction(Persist persist, Function<IssueIndex, T> operation) {
        try (IssueLock lock = IssueLock.acquire(lockPath, lockTimeout)) {
            IssueIndex index = loadFresh();
            T result = operation.apply(index);
            if (persist == Persist.ISSUES) {
                storage.saveIssues(index.getAllIssues());
            } else if (persist == Persist.DEPENDENCIES) {
                storage.saveDependencies(index.getAllDependencies());
            }
            return result;
        }
    }

    private IssueIndex loadFresh() {
        return IssueIndex.of(storage.loadIssues(), storage.loadDependencies());
    }

    /**
     * The mutation is already durable here, so a failed append is reported but not rethrown.
     */
    private void emitEvent(String issueId, EventType type, EventChanges changes) {
        try {
            storage.appendEvent(newEvent(issueId, type, changes));
        } catch (IssueStorageException e) {
            logWarning("Event " + type + " for " + issueId + " was not recorded: " + e.getMessage());
        }
    }

    private IssueEvent newEvent(String issueId, EventType type, EventChanges changes) {
        return new IssueEvent(UUID.randomUUID().toString(), issueId, type, actor, changes,
            System.currentTimeMillis(), sessionId);
    }

    private static List<Issue> resolve(IssueIndex index, Iterable<String> ids) {
        List<Issue> result = new ArrayList<>();
        for (String id : ids) {
            index.getIssue(id).ifPresent(result::add);
        }
        return result;
    }

    private static void validatePriority(int priority) {
        if (priority < MIN_PRIORITY || priority > MAX_PRIORITY) {
            throw new IssueValidationException("Priority must be " + MIN_PRIORITY + "-" + MAX_PRIORITY);
        }
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IssueValidationException(name + " is required");
        }
    }

    private void log(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.info("[IssueManager] " + message);
        }
    }

    private void logWarning(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.warn("[IssueManager] " + message);
        }
    }
}

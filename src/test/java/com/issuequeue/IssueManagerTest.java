package com.issuequeue;

import com.issuequeue.models.BlockedIssue;
import com.issuequeue.models.Dependency;
import com.issuequeue.models.DependencyType;
import com.issuequeue.models.EventChanges;
import com.issuequeue.models.Issue;
import com.issuequeue.models.IssueEvent;
import com.issuequeue.models.IssueFilter;
import com.issuequeue.models.IssueSessions;
import com.issuequeue.models.IssueStatus;
import com.issuequeue.models.IssueType;
import com.issuequeue.models.IssueUpdate;
import com.issuequeue.storage.IssueStorage;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class IssueManagerTest {

    @TempDir
    Path dataDir;

    private IssueManager manager() {
        return new IssueManager(dataDir);
    }

    private Issue create(IssueManager manager, String title, int priority) {
        return manager.create(title, "", priority, "task", null, null, null, null);
    }

    private static List<String> titles(List<Issue> issues) {
        return issues.stream().map(Issue::getTitle).collect(Collectors.toList());
    }

    @Test
    void createAppliesDefaults() {
        Issue issue = manager().create("Write docs");

        assertNotNull(issue.getId());
        assertEquals("Write docs", issue.getTitle());
        assertEquals("", issue.getDescription());
        assertEquals(IssueStatus.OPEN, issue.getStatus());
        assertEquals(2, issue.getPriority());
        assertEquals(IssueType.TASK, issue.getIssueType());
        assertTrue(issue.getMetadata().isEmpty());
        assertNull(issue.getClosedAt());
        assertEquals(issue.getCreatedAt(), issue.getUpdatedAt());
    }

    @Test
    void createRejectsOutOfRangePriority() {
        IssueManager manager = manager();
        assertThrows(IssueValidationException.class, () -> create(manager, "low", 5));
        assertThrows(IssueValidationException.class, () -> create(manager, "neg", -1));
        assertTrue(manager.list().isEmpty());

        assertEquals(0, create(manager, "edge0", 0).getPriority());
        assertEquals(4, create(manager, "edge4", 4).getPriority());
    }

    @Test
    void updateEnforcesPriorityRange() {
        IssueManager manager = manager();
        Issue issue = create(manager, "ranged", 2);
        long updatedAt = manager.get(issue.getId()).orElseThrow().getUpdatedAt();

        assertThrows(IssueValidationException.class,
            () -> manager.update(issue.getId(), new IssueUpdate().priority(5)));
        assertThrows(IssueValidationException.class,
            () -> manager.update(issue.getId(), new IssueUpdate().priority(-1)));

        Issue stored = manager.get(issue.getId()).orElseThrow();
        assertEquals(2, stored.getPriority());
        assertEquals(updatedAt, stored.getUpdatedAt());
        assertEquals(1, manager.getIssueEvents(issue.getId()).size());

        assertEquals(0, manager.update(issue.getId(), new IssueUpdate().priority(0)).getPriority());
        assertEquals(4, manager.update(issue.getId(), new IssueUpdate().priority(4)).getPriority());
        assertEquals(4, manager.get(issue.getId()).orElseThrow().getPriority());
        assertEquals(3, manager.getIssueEvents(issue.getId()).size());
    }

    @Test
    void corruptStoreFailsReadsInsteadOfDroppingRecords() throws Exception {
        IssueManager manager = manager();
        Issue issue = create(manager, "kept", 2);
        Files.writeString(dataDir.resolve(IssueStorage.ISSUES_FILE),
            "{\"id\":\"bad\",\"title\":\"t\",\"status\":null,\"created_at\":1,\"updated_at\":1}\n",
            StandardOpenOption.APPEND);

        assertThrows(IssueStorageException.class, manager::list);
        assertThrows(IssueStorageException.class, () -> manager.getReadyIssues(null));
        assertThrows(IssueStorageException.class,
            () -> manager.update(issue.getId(), new IssueUpdate().title("lost?")));
        assertTrue(Files.readString(dataDir.resolve(IssueStorage.ISSUES_FILE)).contains("\"id\":\"bad\""));
    }

    @Test
    void createRejectsBlankTitleAndUnknownType() {
        IssueManager manager = manager();
        assertThrows(IssueValidationException.class, () -> manager.create("  "));
        assertThrows(IssueValidationException.class,
            () -> manager.create("x", "", 2, "story", null, null, null, null));
    }

    @Test
    void issuesRoundTripThroughStorage() {
        Issue created = manager().create("Persisted", "body", 1, "bug", "alice", null, null,
            Map.of("component", "parser"));

        IssueManager other = new IssueManager(dataDir);
        Issue loaded = other.get(created.getId()).orElseThrow();
        assertEquals("Persisted", loaded.getTitle());
        assertEquals("body", loaded.getDescription());
        assertEquals(1, loaded.getPriority());
        assertEquals(IssueType.BUG, loaded.getIssueType());
        assertEquals("alice", loaded.getAssignee());
        assertEquals("parser", loaded.getMetadata().get("component"));
        assertEquals(created.getCreatedAt(), loaded.getCreatedAt());
    }

    @Test
    void getUnknownIssueIsEmpty() {
        assertTrue(manager().get("missing").isEmpty());
    }

    @Test
    void updateRecordsOldAndNewValues() {
        IssueManager manager = manager();
        Issue issue = create(manager, "Original", 2);

        Issue updated = manager.update(issue.getId(), new IssueUpdate()
            .title("Renamed")
            .status("in_progress")
            .priority(1)
            .metadata(Map.of("sprint", 3)));

        assertEquals("Renamed", updated.getTitle());
        assertEquals(IssueStatus.IN_PROGRESS, updated.getStatus());
        assertEquals(1, updated.getPriority());
        assertEquals(3, updated.getMetadata().get("sprint"));
        assertTrue(updated.getUpdatedAt() >= issue.getUpdatedAt());

        List<IssueEvent> events = manager.getIssueEvents(issue.getId());
        assertEquals(2, events.size());
        IssueEvent event = events.get(1);
        assertEquals("updated", event.getEventType());
        EventChanges.Updated changes = assertInstanceOf(EventChanges.Updated.class, event.getChanges());
        assertEquals("Original", changes.get("title").getOldValue());
        assertEquals("Renamed", changes.get("title").getNewValue());
        assertEquals("open", changes.get("status").getOldValue());
        assertEquals("in_progress", changes.get("status").getNewValue());
        assertEquals(2, changes.get("priority").getOldValue());
        assertNull(changes.get("assignee"));
    }

    @Test
    void updateAcceptsStatusAliases() {
        IssueManager manager = manager();
        Issue issue = create(manager, "Alias", 2);

        assertEquals(IssueStatus.COMPLETED,
            manager.update(issue.getId(), new IssueUpdate().status("done")).getStatus());
        assertEquals(IssueStatus.PENDING_USER_INPUT,
            manager.update(issue.getId(), new IssueUpdate().status("waiting")).getStatus());
        assertThrows(IssueValidationException.class,
            () -> manager.update(issue.getId(), new IssueUpdate().status("paused")));
    }

    @Test
    void updateUnknownIssueFails() {
        assertThrows(IssueNotFoundException.class,
            () -> manager().update("nope", new IssueUpdate().title("x")));
    }

    @Test
    void closeSetsClosedAtAndReason() {
        IssueManager manager = manager();
        Issue issue = create(manager, "Finish", 2);

        Issue closed = manager.close(issue.getId());
        assertEquals(IssueStatus.CLOSED, closed.getStatus());
        assertNotNull(closed.getClosedAt());

        IssueEvent last = manager.getIssueEvents(issue.getId()).get(1);
        assertEquals("closed", last.getEventType());
        EventChanges.Closed changes = assertInstanceOf(EventChanges.Closed.class, last.getChanges());
        assertEquals(IssueManager.DEFAULT_CLOSE_REASON, changes.getReason());

        assertThrows(IssueNotFoundException.class, () -> manager.close("missing", "gone"));
    }

    @Test
    void listFiltersConjunctively() {
        IssueManager manager = manager();
        manager.create("a", "", 1, "bug", "alice", null, null, null);
        manager.create("b", "", 1, "task", "alice", null, null, null);
        manager.create("c", "", 3, "bug", "bob", null, null, null);

        assertEquals(3, manager.list().size());
        assertEquals(List.of("a"), titles(manager.list(IssueFilter.all().priority(1).issueType("bug"))));
        assertEquals(2, manager.list(IssueFilter.all().assignee("alice")).size());
        assertTrue(manager.list(IssueFilter.all().status(IssueStatus.CLOSED)).isEmpty());
    }

    @Test
    void reverseDependencyIsRejectedAsCycle() {
        IssueManager manager = manager();
        Issue a = create(manager, "A", 2);
        Issue b = create(manager, "B", 2);

        manager.addDependency(a.getId(), b.getId());
        DependencyCycleException error = assertThrows(DependencyCycleException.class,
            () -> manager.addDependency(b.getId(), a.getId()));
        assertEquals(b.getId(), error.getFromId());
        assertEquals(1, manager.listDependencies().size());
    }

    @Test
    void transitiveCycleIsRejected() {
        IssueManager manager = manager();
        Issue a = create(manager, "A", 2);
        Issue b = create(manager, "B", 2);
        Issue c = create(manager, "C", 2);

        manager.addDependency(a.getId(), b.getId());
        manager.addDependency(b.getId(), c.getId());
        assertThrows(DependencyCycleException.class, () -> manager.addDependency(c.getId(), a.getId()));
        assertThrows(DependencyCycleException.class, () -> manager.addDependency(a.getId(), a.getId()));
        assertEquals(2, manager.listDependencies().size());
    }

    @Test
    void addDependencyValidatesEndpointsAndDuplicates() {
        IssueManager manager = manager();
        Issue a = create(manager, "A", 2);
        Issue b = create(manager, "B", 2);

        assertThrows(IssueNotFoundException.class, () -> manager.addDependency(a.getId(), "ghost"));
        assertThrows(IssueNotFoundException.class, () -> manager.addDependency("ghost", a.getId()));
        assertThrows(IssueValidationException.class, () -> manager.addDependency(a.getId(), b.getId(), "depends"));

        Dependency dep = manager.addDependency(a.getId(), b.getId(), "related");
        assertEquals(DependencyType.RELATED, dep.getDepType());
        assertThrows(IssueValidationException.class, () -> manager.addDependency(a.getId(), b.getId()));
    }

    @Test
    void dependencyQueriesAndRemoval() {
        IssueManager manager = manager();
        Issue a = create(manager, "A", 2);
        Issue b = create(manager, "B", 2);
        manager.addDependency(a.getId(), b.getId());

        assertEquals(List.of("B"), titles(manager.getDependencies(a.getId())));
        assertEquals(List.of("A"), titles(manager.getDependents(b.getId())));

        manager.removeDependency(a.getId(), b.getId());
        assertTrue(manager.getDependencies(a.getId()).isEmpty());
        assertThrows(IssueNotFoundException.class, () -> manager.removeDependency(a.getId(), b.getId()));

        List<String> types = manager.getIssueEvents(a.getId()).stream()
            .map(IssueEvent::getEventType).collect(Collectors.toList());
        assertEquals(List.of("created", "dependency_added", "dependency_removed"), types);
    }

    @Test
    void readyIssuesOrderedByPriorityThenAge() throws Exception {
        IssueManager manager = manager();
        create(manager, "first-p2", 2);
        Thread.sleep(5);
        create(manager, "p0", 0);
        Thread.sleep(5);
        create(manager, "second-p2", 2);
        Issue closed = create(manager, "closed", 0);
        manager.close(closed.getId());
        Issue working = create(manager, "working", 0);
        manager.update(working.getId(), new IssueUpdate().status(IssueStatus.IN_PROGRESS));

        assertEquals(List.of("p0", "first-p2", "second-p2"), titles(manager.getReadyIssues()));
        assertEquals(List.of("p0"), titles(manager.getReadyIssues(1)));
        assertTrue(manager.getReadyIssues(0).isEmpty());
        assertThrows(IssueValidationException.class, () -> manager.getReadyIssues(-1));
    }

    @Test
    void closingBlockerMakesDependentReady() {
        IssueManager manager = manager();
        Issue task = create(manager, "task", 1);
        Issue blocker = create(manager, "blocker", 2);
        manager.addDependency(task.getId(), blocker.getId());

        assertEquals(List.of("blocker"), titles(manager.getReadyIssues()));

        List<BlockedIssue> blocked = manager.getBlockedIssues();
        assertEquals(1, blocked.size());
        assertEquals("task", blocked.get(0).getIssue().getTitle());
        assertEquals(List.of("blocker"), titles(blocked.get(0).getBlockers()));

        manager.close(blocker.getId());
        assertEquals(List.of("task"), titles(manager.getReadyIssues()));
        assertTrue(manager.getBlockedIssues().isEmpty());
    }

    @Test
    void completedBlockerCountsAsResolved() {
        IssueManager manager = manager();
        Issue task = create(manager, "task", 1);
        Issue blocker = create(manager, "blocker", 2);
        manager.addDependency(task.getId(), blocker.getId());

        manager.update(blocker.getId(), new IssueUpdate().status("completed"));
        assertEquals(List.of("task"), titles(manager.getReadyIssues()));
    }

    @Test
    void blockedReportsInProgressIssuesToo() {
        IssueManager manager = manager();
        Issue task = create(manager, "task", 1);
        Issue blocker = create(manager, "blocker", 2);
        manager.addDependency(task.getId(), blocker.getId());
        manager.update(task.getId(), new IssueUpdate().status("in_progress"));

        List<BlockedIssue> blocked = manager.getBlockedIssues();
        assertEquals(1, blocked.size());
        assertEquals(IssueStatus.IN_PROGRESS, blocked.get(0).getIssue().getStatus());
    }

    @Test
    void concurrentCreatesFromSeparateManagersAreAllKept() throws Exception {
        int writers = 8;
        int perWriter = 5;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int w = 0; w < writers; w++) {
            int writer = w;
            futures.add(pool.submit(() -> {
                IssueManager own = new IssueManager(dataDir, "writer-" + writer, null, Duration.ofSeconds(30));
                start.await();
                for (int i = 0; i < perWriter; i++) {
                    own.create("w" + writer + "-" + i);
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(60, TimeUnit.SECONDS);
        }
        pool.shutdown();

        List<Issue> all = manager().list();
        assertEquals(writers * perWriter, all.size());
        Set<String> ids = new HashSet<>();
        all.forEach(issue -> ids.add(issue.getId()));
        assertEquals(writers * perWriter, ids.size());
    }

    @Test
    void lockTimeoutSurfacesAsLockException() throws Exception {
        IssueManager impatient = new IssueManager(dataDir, "impatient", null, Duration.ofMillis(200));
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Thread holder = new Thread(() -> {
            try (IssueLock lock = IssueLock.acquire(dataDir.resolve(IssueManager.LOCK_FILE), Duration.ofSeconds(5))) {
                held.countDown();
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        holder.start();
        try {
            assertTrue(held.await(5, TimeUnit.SECONDS));
            assertThrows(IssueLockException.class, () -> impatient.create("blocked by lock"));
        } finally {
            release.countDown();
            holder.join(5000);
        }
        assertEquals("after", impatient.create("after").getTitle());
    }

    @Test
    void eventsCarryActorAndSession() {
        IssueManager manager = new IssueManager(dataDir, "agent-7", "session-a");
        Issue issue = manager.create("Tracked");

        IssueEvent created = manager.getIssueEvents(issue.getId()).get(0);
        assertEquals("created", created.getEventType());
        assertEquals("agent-7", created.getActor());
        assertEquals("session-a", created.getSessionId());
        EventChanges.Created changes = assertInstanceOf(EventChanges.Created.class, created.getChanges());
        assertEquals("Tracked", changes.getIssue().getTitle());
    }

    @Test
    void sessionsGroupEventsBySessionId() {
        IssueManager s1 = new IssueManager(dataDir, "agent", "s1");
        IssueManager s2 = new IssueManager(dataDir, "agent", "s2");
        IssueManager anonymous = new IssueManager(dataDir);

        Issue issue = s1.create("Shared");
        s2.update(issue.getId(), new IssueUpdate().status("in_progress"));
        anonymous.update(issue.getId(), new IssueUpdate().assignee("carol"));
        s1.close(issue.getId());

        IssueSessions sessions = anonymous.getIssueSessions(issue.getId());
        assertEquals(List.of("s1", "s2"), sessions.getLinkedSessions());
        assertEquals(2, sessions.getSessionCount());
        assertEquals(List.of("created", "closed"), sessions.getEventsBySession().get("s1"));
        assertEquals(List.of("updated"), sessions.getEventsBySession().get("s2"));
        assertEquals(IssueSessions.RESUME_HINT, sessions.getHint());

        assertThrows(IssueNotFoundException.class, () -> anonymous.getIssueSessions("missing"));
    }

    @Test
    void sessionEndedIsBestEffort() throws Exception {
        IssueManager manager = new IssueManager(dataDir, "agent", "s9");
        Issue issue = manager.create("Interrupted");

        manager.emitSessionEnded("unknown-id");
        manager.emitSessionEnded(null);
        manager.emitSessionEnded(issue.getId());

        List<IssueEvent> events = manager.getIssueEvents(issue.getId());
        assertEquals(2, events.size());
        IssueEvent ended = events.get(1);
        assertEquals("session_ended", ended.getEventType());
        assertEquals("s9", ended.getSessionId());
        assertEquals(IssueManager.SESSION_ENDED_REASON,
            assertInstanceOf(EventChanges.SessionEnded.class, ended.getChanges()).getReason());

        long lines = Files.readAllLines(dataDir.resolve("events.jsonl")).stream()
            .filter(line -> !line.isBlank()).count();
        assertEquals(2, lines);
    }
}

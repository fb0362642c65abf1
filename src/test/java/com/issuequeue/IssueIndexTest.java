package com.issuequeue;

import com.issuequeue.models.Dependency;
import com.issuequeue.models.DependencyType;
import com.issuequeue.models.Issue;
import com.issuequeue.models.IssueFilter;
import com.issuequeue.models.IssueStatus;
import com.issuequeue.models.IssueType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class IssueIndexTest {

    private static Issue issue(String id, IssueStatus status) {
        return new Issue(id, id, "", status, 2, IssueType.TASK, null, 1L, 1L);
    }

    @Test
    void tracksBothDirectionsOfAnEdge() {
        IssueIndex index = IssueIndex.of(List.of(issue("a", IssueStatus.OPEN), issue("b", IssueStatus.OPEN)),
            List.of(new Dependency("a", "b", DependencyType.BLOCKS, 5L)));

        assertEquals(Set.of("b"), index.getBlockers("a"));
        assertEquals(Set.of("a"), index.getDependents("b"));
        assertTrue(index.getBlockers("b").isEmpty());
        assertTrue(index.hasDependency("a", "b"));
        assertFalse(index.hasDependency("b", "a"));
        assertEquals(1, index.dependencyCount());
    }

    @Test
    void removeDropsAdjacency() {
        IssueIndex index = IssueIndex.of(List.of(), List.of(new Dependency("a", "b", DependencyType.BLOCKS, 5L)));

        assertTrue(index.removeDependency("a", "b"));
        assertFalse(index.removeDependency("a", "b"));
        assertTrue(index.getBlockers("a").isEmpty());
        assertTrue(index.getDependents("b").isEmpty());
        assertTrue(index.getAllDependencies().isEmpty());
    }

    @Test
    void samePairReplacesEarlierEdge() {
        IssueIndex index = new IssueIndex();
        index.addDependency(new Dependency("a", "b", DependencyType.BLOCKS, 1L));
        index.addDependency(new Dependency("a", "b", DependencyType.RELATED, 2L));

        assertEquals(1, index.dependencyCount());
        assertEquals(DependencyType.RELATED, index.getDependency("a", "b").orElseThrow().getDepType());
    }

    @Test
    void edgesMayReferenceUnknownIssues() {
        IssueIndex index = IssueIndex.of(List.of(issue("a", IssueStatus.OPEN)),
            List.of(new Dependency("a", "ghost", DependencyType.BLOCKS, 1L)));

        assertEquals(Set.of("ghost"), index.getBlockers("a"));
        assertFalse(index.containsIssue("ghost"));
        assertTrue(index.getIssue("ghost").isEmpty());
    }

    @Test
    void listIssuesKeepsInsertionOrder() {
        IssueIndex index = IssueIndex.of(List.of(
            issue("c", IssueStatus.OPEN), issue("a", IssueStatus.CLOSED), issue("b", IssueStatus.OPEN)), List.of());

        List<Issue> open = index.listIssues(IssueFilter.all().status(IssueStatus.OPEN));
        assertEquals(2, open.size());
        assertEquals("c", open.get(0).getId());
        assertEquals("b", open.get(1).getId());
        assertEquals(3, index.listIssues(null).size());
        assertThrows(UnsupportedOperationException.class, () -> index.getAllIssues().clear());
    }
}

package com.issuequeue.hooks;

import com.issuequeue.IssueManager;
import com.issuequeue.models.Issue;
import com.issuequeue.models.IssueEvent;
import com.issuequeue.models.IssueUpdate;
import com.issuequeue.tools.IssueTool;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SessionHooksTest {

    @TempDir
    Path dataDir;

    private Issue create(IssueManager manager, String title, int priority) {
        return manager.create(title, "", priority, "task", null, null, null, null);
    }

    @Test
    void reminderIsEmptyWithoutActiveIssues() {
        IssueManager manager = new IssueManager(dataDir);
        SessionStartHook hook = new SessionStartHook(manager);
        assertEquals("", hook.onSessionStart());

        Issue done = create(manager, "Done", 2);
        manager.close(done.getId());
        assertEquals("", hook.onSessionStart());
    }

    @Test
    void reminderGroupsByStatusWithMarkers() {
        IssueManager manager = new IssueManager(dataDir);
        Issue urgent = create(manager, "Fix crash", 0);
        create(manager, "Refactor", 3);
        Issue working = create(manager, "Write tests", 1);
        manager.update(working.getId(), new IssueUpdate().status("in_progress"));
        Issue stuck = create(manager, "Needs design", 2);
        manager.update(stuck.getId(), new IssueUpdate().status("blocked"));

        String reminder = new SessionStartHook(manager).onSessionStart();

        assertTrue(reminder.contains("In Progress (1):"));
        assertTrue(reminder.contains("Open (2):"));
        assertTrue(reminder.contains("Blocked (1):"));
        assertTrue(reminder.contains("[CRITICAL] Fix crash (" + urgent.getId().substring(0, 8) + ")"));
        assertTrue(reminder.contains("[HIGH] Write tests"));
        assertTrue(reminder.contains("[low] Refactor"));
        assertTrue(reminder.contains("  - Needs design"));
        assertTrue(reminder.indexOf("In Progress") < reminder.indexOf("Open ("));
    }

    @Test
    void reminderTruncatesLongGroups() {
        IssueManager manager = new IssueManager(dataDir);
        for (int i = 0; i < 7; i++) {
            create(manager, "Open " + i, 2);
        }

        String reminder = new SessionStartHook(manager).onSessionStart();
        assertTrue(reminder.contains("Open (7):"));
        assertTrue(reminder.contains("... and 2 more"));
        assertFalse(reminder.contains("Open 6"));
    }

    @Test
    void nudgeEveryIntervalUnlessToolUsedRecently() {
        IssueManager manager = new IssueManager(dataDir);
        create(manager, "Pending", 2);
        SessionStartHook hook = new SessionStartHook(manager, true, 3);

        assertEquals("", hook.onProviderRequest());
        assertEquals("", hook.onProviderRequest());
        assertTrue(hook.onProviderRequest().contains("1 open or in-progress"));

        hook.onToolUsed(IssueTool.NAME);
        hook.onProviderRequest();
        hook.onProviderRequest();
        assertEquals("", hook.onProviderRequest());

        for (int i = 0; i < SessionStartHook.RECENT_TOOL_WINDOW; i++) {
            hook.onToolUsed("read_file");
        }
        hook.onProviderRequest();
        hook.onProviderRequest();
        assertFalse(hook.onProviderRequest().isEmpty());
        assertEquals(9, hook.getRequestCount());
    }

    @Test
    void disabledHooksDoNothing() {
        IssueManager manager = new IssueManager(dataDir, "agent", "s1");
        Issue issue = create(manager, "Anything", 2);
        manager.update(issue.getId(), new IssueUpdate().status("in_progress"));

        SessionStartHook start = new SessionStartHook(manager, false, 1);
        assertEquals("", start.onSessionStart());
        assertEquals("", start.onProviderRequest());
        assertEquals(0, new SessionEndHook(manager, false).onSessionEnd("s1"));
    }

    @Test
    void sessionEndMarksOnlyTouchedInProgressIssues() {
        IssueManager s1 = new IssueManager(dataDir, "agent", "s1");
        IssueManager s2 = new IssueManager(dataDir, "agent", "s2");

        Issue mine = create(s1, "Mine", 2);
        s1.update(mine.getId(), new IssueUpdate().status("in_progress"));
        Issue theirs = create(s2, "Theirs", 2);
        s2.update(theirs.getId(), new IssueUpdate().status("in_progress"));
        create(s1, "Still open", 2);

        int marked = new SessionEndHook(s1).onSessionEnd("s1");
        assertEquals(1, marked);

        List<IssueEvent> events = s1.getIssueEvents(mine.getId());
        assertEquals("session_ended", events.get(events.size() - 1).getEventType());
        List<IssueEvent> other = s1.getIssueEvents(theirs.getId());
        assertEquals("updated", other.get(other.size() - 1).getEventType());

        assertEquals(0, new SessionEndHook(s1).onSessionEnd("unknown"));
        assertEquals(0, new SessionEndHook(s1).onSessionEnd(null));
    }
}

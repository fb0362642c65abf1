package com.issuequeue.hooks;

import com.issuequeue.AppLogger;
import com.issuequeue.IssueManager;
import com.issuequeue.models.Issue;
import com.issuequeue.models.IssueEvent;
import com.issuequeue.models.IssueFilter;
import com.issuequeue.models.IssueStatus;

import java.util.List;

/**
 * Marks in-progress issues touched by a session when that session ends, so a
 * later reader can see the work was interrupted.
 */
public class SessionEndHook {

    private final IssueManager manager;
    private final boolean enabled;

    public SessionEndHook(IssueManager manager) {
        this(manager, true);
    }

    public SessionEndHook(IssueManager manager, boolean enabled) {
        this.manager = manager;
        this.enabled = enabled;
    }

    /**
     * Returns the number of issues marked. Never throws.
     */
    public int onSessionEnd(String sessionId) {
        if (!enabled || sessionId == null || sessionId.isBlank()) {
            return 0;
        }
        int marked = 0;
        try {
            List<Issue> inProgress = manager.list(IssueFilter.all().status(IssueStatus.IN_PROGRESS));
            for (Issue issue : inProgress) {
                if (touchedBy(issue.getId(), sessionId)) {
                    manager.emitSessionEnded(issue.getId());
                    marked++;
                }
            }
        } catch (RuntimeException e) {
            logWarning("Session end handling failed for " + sessionId + ": " + e.getMessage());
        }
        if (marked > 0) {
            AppLogger logger = AppLogger.get();
            if (logger != null) {
                logger.info("[SessionEndHook] Marked " + marked + " in-progress issue(s) for session " + sessionId);
            }
        }
        return marked;
    }

    private boolean touchedBy(String issueId, String sessionId) {
        for (IssueEvent event : manager.getIssueEvents(issueId)) {
            if (sessionId.equals(event.getSessionId())) {
                return true;
            }
        }
        return false;
    }

    private static void logWarning(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.warn("[SessionEndHook] " + message);
        }
    }
}

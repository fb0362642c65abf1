package com.issuequeue.hooks;

import com.issuequeue.AppLogger;
import com.issuequeue.IssueManager;
import com.issuequeue.models.Issue;
import com.issuequeue.models.IssueFilter;
import com.issuequeue.models.IssueStatus;
import com.issuequeue.tools.IssueTool;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Surfaces open work to an agent at session start, and nudges it back towards
 * the issue tool when many requests go by without touching it.
 */
public class SessionStartHook {
    public static final int DEFAULT_NUDGE_INTERVAL = 10;
    static final int MAX_PER_GROUP = 5;
    static final int RECENT_TOOL_WINDOW = 5;

    private static final Map<Integer, String> PRIORITY_MARKERS = Map.of(
        0, "[CRITICAL] ",
        1, "[HIGH] ",
        3, "[low] ",
        4, "[deferred] "
    );

    private final IssueManager manager;
    private final boolean enabled;
    private final int nudgeInterval;
    private final Deque<String> recentTools = new ArrayDeque<>();
    private int requestCount;

    public SessionStartHook(IssueManager manager) {
        this(manager, true, DEFAULT_NUDGE_INTERVAL);
    }

    public SessionStartHook(IssueManager manager, boolean enabled, int nudgeInterval) {
        this.manager = manager;
        this.enabled = enabled;
        this.nudgeInterval = nudgeInterval > 0 ? nudgeInterval : DEFAULT_NUDGE_INTERVAL;
    }

    /**
     * Reminder listing in-progress, open and blocked issues, or an empty string
     * when there is nothing to report.
     */
    public String onSessionStart() {
        if (!enabled) {
            return "";
        }
        try {
            List<Issue> inProgress = manager.list(IssueFilter.all().status(IssueStatus.IN_PROGRESS));
            List<Issue> open = manager.list(IssueFilter.all().status(IssueStatus.OPEN));
            List<Issue> blocked = manager.list(IssueFilter.all().status(IssueStatus.BLOCKED));
            if (inProgress.isEmpty() && open.isEmpty() && blocked.isEmpty()) {
                return "";
            }

            StringBuilder sb = new StringBuilder();
            sb.append("<issue-reminder>\n");
            sb.append("Tracked issues for this project. Use the ").append(IssueTool.NAME)
                .append(" tool to update status as you work.\n");
            appendGroup(sb, "In Progress", inProgress);
            appendGroup(sb, "Open", open);
            appendGroup(sb, "Blocked", blocked);
            sb.append("</issue-reminder>");
            return sb.toString();
        } catch (RuntimeException e) {
            logWarning("Could not build session reminder: " + e.getMessage());
            return "";
        }
    }

    public void onToolUsed(String toolName) {
        if (!enabled || toolName == null) {
            return;
        }
        recentTools.addLast(toolName);
        while (recentTools.size() > RECENT_TOOL_WINDOW) {
            recentTools.removeFirst();
        }
    }

    /**
     * Counts a provider request. Every {@code nudgeInterval} requests returns a
     * nudge if issues exist and the issue tool was not among the recent tools;
     * otherwise returns an empty string.
     */
    public String onProviderRequest() {
        if (!enabled) {
            return "";
        }
        requestCount++;
        if (requestCount % nudgeInterval != 0 || recentTools.contains(IssueTool.NAME)) {
            return "";
        }
        try {
            int active = manager.list(IssueFilter.all().status(IssueStatus.IN_PROGRESS)).size()
                + manager.list(IssueFilter.all().status(IssueStatus.OPEN)).size();
            if (active == 0) {
                return "";
            }
            return "<issue-reminder>\nThere are " + active + " open or in-progress issues. "
                + "Use the " + IssueTool.NAME + " tool to record progress or close finished work.\n"
                + "</issue-reminder>";
        } catch (RuntimeException e) {
            logWarning("Could not build nudge: " + e.getMessage());
            return "";
        }
    }

    public int getRequestCount() {
        return requestCount;
    }

    private static void appendGroup(StringBuilder sb, String heading, List<Issue> issues) {
        if (issues.isEmpty()) {
            return;
        }
        sb.append('\n').append(heading).append(" (").append(issues.size()).append("):\n");
        int shown = Math.min(MAX_PER_GROUP, issues.size());
        for (int i = 0; i < shown; i++) {
            Issue issue = issues.get(i);
            sb.append("  - ").append(PRIORITY_MARKERS.getOrDefault(issue.getPriority(), ""))
                .append(issue.getTitle())
                .append(" (").append(shortId(issue.getId())).append(")\n");
        }
        if (issues.size() > shown) {
            sb.append("  ... and ").append(issues.size() - shown).append(" more\n");
        }
    }

    static String shortId(String id) {
        return id != null && id.length() > 8 ? id.substring(0, 8) : id;
    }

    private static void logWarning(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.warn("[SessionStartHook] " + message);
        }
    }
}

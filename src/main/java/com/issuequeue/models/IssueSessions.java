package com.issuequeue.models;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Which external sessions touched an issue, and what each of them did to it.
 */
public class IssueSessions {

    public static final String RESUME_HINT =
        "Resume one of the linked sessions to revive its context for follow-up questions";

    private final String issueId;
    private final List<String> linkedSessions;
    private final Map<String, List<String>> eventsBySession;

    public IssueSessions(String issueId, List<String> linkedSessions, Map<String, List<String>> eventsBySession) {
        this.issueId = issueId;
        this.linkedSessions = new ArrayList<>(linkedSessions);
        this.eventsBySession = new LinkedHashMap<>(eventsBySession);
    }

    public String getIssueId() {
        return issueId;
    }

    public List<String> getLinkedSessions() {
        return linkedSessions;
    }

    public int getSessionCount() {
        return linkedSessions.size();
    }

    public Map<String, List<String>> getEventsBySession() {
        return eventsBySession;
    }

    public String getHint() {
        return RESUME_HINT;
    }
}

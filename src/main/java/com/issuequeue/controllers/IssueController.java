package com.issuequeue.controllers;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.issuequeue.IssueManager;
import com.issuequeue.IssueNotFoundException;
import com.issuequeue.IssueValidationException;
import com.issuequeue.models.BlockedIssue;
import com.issuequeue.models.Dependency;
import com.issuequeue.models.Issue;
import com.issuequeue.models.IssueFilter;
import com.issuequeue.models.IssueUpdate;
import com.issuequeue.tools.IssueTool;
import com.issuequeue.tools.ToolExecutionResult;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * REST routes over {@link IssueManager}. Each request is a single manager call;
 * failures propagate to the exception handlers registered in {@code Main}.
 */
public class IssueController implements Controller {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final IssueManager manager;
    private final IssueTool tool;
    private final ObjectMapper objectMapper;

    public IssueController(IssueManager manager, IssueTool tool, ObjectMapper objectMapper) {
        this.manager = manager;
        this.tool = tool;
        this.objectMapper = objectMapper;
    }

    @Override
    public void registerRoutes(Javalin app) {
        // Fixed segments first so they are not captured by {id}.
        app.get("/api/issues/ready", this::getReady);
        app.get("/api/issues/blocked", this::getBlocked);

        app.get("/api/issues", this::listIssues);
        app.post("/api/issues", this::createIssue);
        app.get("/api/issues/{id}", this::getIssue);
        app.put("/api/issues/{id}", this::updateIssue);
        app.post("/api/issues/{id}/close", this::closeIssue);
        app.get("/api/issues/{id}/dependencies", this::getDependencies);
        app.get("/api/issues/{id}/dependents", this::getDependents);
        app.get("/api/issues/{id}/events", this::getEvents);
        app.get("/api/issues/{id}/sessions", this::getSessions);

        app.post("/api/dependencies", this::addDependency);
        app.delete("/api/dependencies", this::removeDependency);

        app.post("/api/tool", this::runTool);
    }

    private void listIssues(Context ctx) {
        IssueFilter filter = IssueFilter.all()
            .status(blankToNull(ctx.queryParam("status")))
            .priority(parseIntQuery(ctx, "priority"))
            .issueType(blankToNull(ctx.queryParam("issueType")))
            .assignee(blankToNull(ctx.queryParam("assignee")));
        ctx.json(manager.list(filter));
    }

    private void createIssue(Context ctx) throws IOException {
        JsonNode json = readBody(ctx);
        Integer priority = IssueTool.parsePriority(json.get("priority"));
        String description = text(json, "description");
        Issue created = manager.create(
            text(json, "title"),
            description != null ? description : "",
            priority != null ? priority : IssueManager.DEFAULT_PRIORITY,
            text(json, "issue_type"),
            text(json, "assignee"),
            text(json, "parent_id"),
            text(json, "discovered_from"),
            metadata(json));
        ctx.status(201).json(created);
    }

    private void getIssue(Context ctx) {
        String id = ctx.pathParam("id");
        Issue issue = manager.get(id).orElseThrow(() -> IssueNotFoundException.issue(id));
        ctx.json(issue);
    }

    private void updateIssue(Context ctx) throws IOException {
        JsonNode json = readBody(ctx);
        IssueUpdate update = new IssueUpdate()
            .title(text(json, "title"))
            .description(text(json, "description"))
            .status(text(json, "status"))
            .priority(IssueTool.parsePriority(json.get("priority")))
            .assignee(text(json, "assignee"))
            .blockingNotes(text(json, "blocking_notes"))
            .metadata(metadata(json));
        ctx.json(manager.update(ctx.pathParam("id"), update));
    }

    private void closeIssue(Context ctx) throws IOException {
        String reason = null;
        if (!ctx.body().isBlank()) {
            reason = text(readBody(ctx), "reason");
        }
        ctx.json(manager.close(ctx.pathParam("id"), reason));
    }

    private void getDependencies(Context ctx) {
        ctx.json(manager.getDependencies(ctx.pathParam("id")));
    }

    private void getDependents(Context ctx) {
        ctx.json(manager.getDependents(ctx.pathParam("id")));
    }

    private void getEvents(Context ctx) {
        ctx.json(manager.getIssueEvents(ctx.pathParam("id")));
    }

    private void getSessions(Context ctx) {
        ctx.json(manager.getIssueSessions(ctx.pathParam("id")));
    }

    private void getReady(Context ctx) {
        List<Issue> ready = manager.getReadyIssues(parseIntQuery(ctx, "limit"));
        ctx.json(ready);
    }

    private void getBlocked(Context ctx) {
        List<BlockedIssue> blocked = manager.getBlockedIssues();
        ctx.json(blocked);
    }

    private void addDependency(Context ctx) throws IOException {
        JsonNode json = readBody(ctx);
        Dependency dependency = manager.addDependency(text(json, "from_id"), text(json, "to_id"),
            text(json, "dep_type"));
        ctx.status(201).json(dependency);
    }

    private void removeDependency(Context ctx) {
        String from = ctx.queryParam("from");
        String to = ctx.queryParam("to");
        manager.removeDependency(from, to);
        ctx.json(Map.of("removed", true, "from_id", from, "to_id", to));
    }

    private void runTool(Context ctx) throws IOException {
        ToolExecutionResult result = tool.execute(readBody(ctx));
        ctx.status(result.isOk() ? 200 : 400).json(result);
    }

    private JsonNode readBody(Context ctx) throws IOException {
        String body = ctx.body();
        if (body == null || body.isBlank()) {
            throw new IssueValidationException("Request body is required");
        }
        JsonNode json = objectMapper.readTree(body);
        if (json == null || !json.isObject()) {
            throw new IssueValidationException("Request body must be a JSON object");
        }
        return json;
    }

    private Map<String, Object> metadata(JsonNode json) {
        JsonNode node = json.get("metadata");
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isObject()) {
            throw new IssueValidationException("metadata must be a JSON object");
        }
        return objectMapper.convertValue(node, MAP_TYPE);
    }

    private static String text(JsonNode json, String field) {
        JsonNode node = json.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    private static Integer parseIntQuery(Context ctx, String name) {
        String raw = ctx.queryParam(name);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IssueValidationException("Invalid " + name + ": " + raw);
        }
    }
}

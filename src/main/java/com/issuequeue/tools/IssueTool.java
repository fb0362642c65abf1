package com.issuequeue.tools;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.issuequeue.AppLogger;
import com.issuequeue.DependencyCycleException;
import com.issuequeue.IssueLockException;
import com.issuequeue.IssueManager;
import com.issuequeue.IssueNotFoundException;
import com.issuequeue.IssueValidationException;
import com.issuequeue.models.BlockedIssue;
import com.issuequeue.models.DependencyType;
import com.issuequeue.models.Issue;
import com.issuequeue.models.IssueFilter;
import com.issuequeue.models.IssueType;
import com.issuequeue.models.IssueUpdate;
import com.issuequeue.storage.JsonStorage;

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Named-operation facade over {@link IssueManager} for agent tool calls.
 * Params arrive as a JSON object, are checked against the operation's schema,
 * and every outcome (including failures) comes back as a {@link ToolExecutionResult}.
 */
public class IssueTool {
    public static final String NAME = "issue_manager";

    private static final Map<String, Integer> PRIORITY_WORDS = Map.of(
        "critical", 0,
        "high", 1,
        "medium", 2,
        "normal", 2,
        "low", 3,
        "deferred", 4
    );
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final IssueManager manager;
    private final ObjectMapper objectMapper;
    private final ToolSchemaRegistry schemas;

    public IssueTool(IssueManager manager) {
        this.manager = manager;
        this.objectMapper = JsonStorage.mapper();
        this.schemas = defaultSchemas();
    }

    public Set<String> getOperations() {
        return schemas.getOperations();
    }

    public ToolSchemaRegistry getSchemas() {
        return schemas;
    }

    /**
     * Accepts {@code {"operation": "...", "params": {...}}}.
     */
    public ToolExecutionResult execute(JsonNode request) {
        if (request == null || !request.isObject()) {
            return ToolExecutionResult.error("invalid-request", "Tool request must be a JSON object");
        }
        JsonNode operation = request.get("operation");
        if (operation == null || !operation.isTextual() || operation.asText().isBlank()) {
            return ToolExecutionResult.error("missing-operation", "operation is required");
        }
        JsonNode params = request.get("params");
        return execute(operation.asText(), params != null && !params.isNull() ? params : objectMapper.createObjectNode());
    }

    public ToolExecutionResult execute(String operation, JsonNode params) {
        if (operation == null || operation.isBlank()) {
            return ToolExecutionResult.error("missing-operation", "operation is required");
        }
        ToolSchema schema = schemas.getSchema(operation);
        if (schema == null) {
            return ToolExecutionResult.error("unknown-operation",
                "Unknown operation: " + operation + ". Available: " + String.join(", ", schemas.getOperations()));
        }
        JsonNode args = schema.normalizeArgsNode(params != null ? params : objectMapper.createObjectNode());
        String invalid = schema.validate(args);
        if (invalid != null) {
            return ToolExecutionResult.error("invalid-params", operation + ": " + invalid);
        }
        try {
            return ToolExecutionResult.ok(dispatch(operation, args));
        } catch (IssueValidationException | IssueNotFoundException | DependencyCycleException | IssueLockException e) {
            return ToolExecutionResult.error(e.getCode(), e.getMessage());
        } catch (Exception e) {
            logWarning("Operation " + operation + " failed: " + e.getMessage());
            return ToolExecutionResult.error("execution-error", "Tool execution failed: " + e.getMessage());
        }
    }

    private JsonNode dispatch(String operation, JsonNode args) {
        switch (operation) {
            case "create":
                return create(args);
            case "list":
                return list(args);
            case "get":
                return get(args);
            case "update":
                return update(args);
            case "close":
                return issueResult(manager.close(text(args, "issue_id"), text(args, "reason")));
            case "add_dependency":
                return add(args);
            case "remove_dependency":
                return remove(args);
            case "get_dependencies":
                return listResult("dependencies", manager.getDependencies(text(args, "issue_id")));
            case "get_dependents":
                return listResult("dependents", manager.getDependents(text(args, "issue_id")));
            case "get_ready":
                return listResult("ready_issues", manager.getReadyIssues(integer(args, "limit")));
            case "get_blocked":
                return blocked();
            case "get_events":
                return listResult("events", manager.getIssueEvents(text(args, "issue_id")));
            case "get_sessions":
                return objectMapper.valueToTree(manager.getIssueSessions(text(args, "issue_id")));
            default:
                throw new IssueValidationException("Unsupported operation: " + operation);
        }
    }

    private JsonNode create(JsonNode args) {
        Integer priority = parsePriority(args.get("priority"));
        Issue issue = manager.create(
            text(args, "title"),
            text(args, "description") != null ? text(args, "description") : "",
            priority != null ? priority : IssueManager.DEFAULT_PRIORITY,
            text(args, "issue_type"),
            text(args, "assignee"),
            text(args, "parent_id"),
            text(args, "discovered_from"),
            metadata(args));
        return issueResult(issue);
    }

    private JsonNode list(JsonNode args) {
        IssueFilter filter = IssueFilter.all()
            .status(text(args, "status"))
            .priority(parsePriority(args.get("priority")))
            .issueType(text(args, "issue_type"))
            .assignee(text(args, "assignee"));
        return listResult("issues", manager.list(filter));
    }

    private JsonNode get(JsonNode args) {
        String issueId = text(args, "issue_id");
        Issue issue = manager.get(issueId).orElseThrow(() -> IssueNotFoundException.issue(issueId));
        return issueResult(issue);
    }

    private JsonNode update(JsonNode args) {
        IssueUpdate update = new IssueUpdate()
            .title(text(args, "title"))
            .description(text(args, "description"))
            .status(text(args, "status"))
            .priority(parsePriority(args.get("priority")))
            .assignee(text(args, "assignee"))
            .blockingNotes(text(args, "blocking_notes"))
            .metadata(metadata(args));
        return issueResult(manager.update(text(args, "issue_id"), update));
    }

    private JsonNode add(JsonNode args) {
        String depType = text(args, "dep_type");
        ObjectNode root = objectMapper.createObjectNode();
        root.set("dependency", objectMapper.valueToTree(manager.addDependency(
            text(args, "from_id"), text(args, "to_id"), depType != null ? depType : DependencyType.BLOCKS.getValue())));
        return root;
    }

    private JsonNode remove(JsonNode args) {
        manager.removeDependency(text(args, "from_id"), text(args, "to_id"));
        ObjectNode root = objectMapper.createObjectNode();
        root.put("removed", true);
        root.put("from_id", text(args, "from_id"));
        root.put("to_id", text(args, "to_id"));
        return root;
    }

    private JsonNode blocked() {
        List<BlockedIssue> blocked = manager.getBlockedIssues();
        ObjectNode root = objectMapper.createObjectNode();
        ArrayNode items = root.putArray("blocked_issues");
        for (BlockedIssue entry : blocked) {
            ObjectNode item = items.addObject();
            item.set("issue", objectMapper.valueToTree(entry.getIssue()));
            item.set("blockers", objectMapper.valueToTree(entry.getBlockers()));
        }
        root.put("count", blocked.size());
        return root;
    }

    private ObjectNode issueResult(Issue issue) {
        ObjectNode root = objectMapper.createObjectNode();
        root.set("issue", objectMapper.valueToTree(issue));
        return root;
    }

    private ObjectNode listResult(String key, Collection<?> items) {
        ObjectNode root = objectMapper.createObjectNode();
        root.set(key, objectMapper.valueToTree(items));
        root.put("count", items.size());
        return root;
    }

    /**
     * Integer, numeric string, or one of the priority words. Null when absent.
     */
    public static Integer parsePriority(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isInt()) {
            return node.asInt();
        }
        String raw = node.asText().trim().toLowerCase(Locale.ROOT);
        Integer word = PRIORITY_WORDS.get(raw);
        if (word != null) {
            return word;
        }
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new IssueValidationException("Invalid priority value: " + node.asText()
                + " (use 0-4 or one of " + String.join(", ", PRIORITY_WORDS.keySet()) + ")");
        }
    }

    private Map<String, Object> metadata(JsonNode args) {
        JsonNode node = args.get("metadata");
        if (node == null || node.isNull()) {
            return null;
        }
        return objectMapper.convertValue(node, MAP_TYPE);
    }

    private static String text(JsonNode args, String name) {
        JsonNode node = args.get(name);
        return node == null || node.isNull() ? null : node.asText();
    }

    private static Integer integer(JsonNode args, String name) {
        JsonNode node = args.get(name);
        return node == null || node.isNull() ? null : node.asInt();
    }

    private static ToolSchemaRegistry defaultSchemas() {
        Set<String> issueTypes = values(Arrays.stream(IssueType.values()).map(IssueType::getValue).collect(Collectors.toList()));
        Set<String> depTypes = values(Arrays.stream(DependencyType.values()).map(DependencyType::getValue).collect(Collectors.toList()));
        ToolArgSpec.Type str = ToolArgSpec.Type.STRING;

        return new ToolSchemaRegistry()
            .register(new ToolSchema("create")
                .arg("title", str, true)
                .arg("description", str, false)
                .arg("priority", ToolArgSpec.Type.PRIORITY, false)
                .arg("issue_type", str, false, issueTypes)
                .arg("assignee", str, false)
                .arg("parent_id", str, false)
                .arg("discovered_from", str, false)
                .arg("metadata", ToolArgSpec.Type.OBJECT, false)
                .alias("type", "issue_type"))
            .register(new ToolSchema("list")
                .arg("status", str, false)
                .arg("priority", ToolArgSpec.Type.PRIORITY, false)
                .arg("issue_type", str, false, issueTypes)
                .arg("assignee", str, false)
                .alias("type", "issue_type"))
            .register(issueIdOnly("get"))
            .register(issueIdOnly("update")
                .arg("title", str, false)
                .arg("description", str, false)
                .arg("status", str, false)
                .arg("priority", ToolArgSpec.Type.PRIORITY, false)
                .arg("assignee", str, false)
                .arg("blocking_notes", str, false)
                .arg("metadata", ToolArgSpec.Type.OBJECT, false))
            .register(issueIdOnly("close")
                .arg("reason", str, false))
            .register(new ToolSchema("add_dependency")
                .arg("from_id", str, true)
                .arg("to_id", str, true)
                .arg("dep_type", str, false, depTypes)
                .alias("from", "from_id")
                .alias("to", "to_id")
                .alias("type", "dep_type"))
            .register(new ToolSchema("remove_dependency")
                .arg("from_id", str, true)
                .arg("to_id", str, true)
                .alias("from", "from_id")
                .alias("to", "to_id"))
            .register(issueIdOnly("get_dependencies"))
            .register(issueIdOnly("get_dependents"))
            .register(new ToolSchema("get_ready")
                .arg("limit", ToolArgSpec.Type.INT, false))
            .register(new ToolSchema("get_blocked"))
            .register(issueIdOnly("get_events"))
            .register(issueIdOnly("get_sessions"));
    }

    private static ToolSchema issueIdOnly(String operation) {
        return new ToolSchema(operation)
            .arg("issue_id", ToolArgSpec.Type.STRING, true)
            .alias("id", "issue_id");
    }

    private static Set<String> values(List<String> values) {
        return new LinkedHashSet<>(values);
    }

    private void logWarning(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.warn("[IssueTool] " + message);
        }
    }
}

package com.issuequeue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.issuequeue.controllers.Controller;
import com.issuequeue.controllers.IssueController;
import com.issuequeue.hooks.SessionEndHook;
import com.issuequeue.hooks.SessionStartHook;
import com.issuequeue.storage.JsonStorage;
import com.issuequeue.tools.IssueTool;
import io.javalin.Javalin;
import io.javalin.json.JavalinJackson;

public class Main {

    private static final String VERSION = "1.0.0";
    private static AppLogger logger;

    public static void main(String[] args) {
        try {
            // Defaults, then environment, then flags
            AppConfig config = new AppConfig.Builder()
                    .fromEnvironment(System.getenv())
                    .parseArgs(args)
                    .build();

            AppLogger.initialize(config.getLogPath(), config.isDevMode());
            logger = AppLogger.get();

            printBanner(config);

            IssueManager manager = IssueManager.fromConfig(config);
            IssueTool tool = new IssueTool(manager);
            logger.info("Issue store: " + manager.getDataDir());

            String reminder = new SessionStartHook(manager).onSessionStart();
            if (!reminder.isEmpty()) {
                logger.console(reminder);
            }

            Javalin app = createApp(manager, tool);
            app.start(config.getPort());

            String url = "http://localhost:" + config.getPort() + "/api/issues";
            logger.info("Server started on " + url);
            logger.console("");
            logger.console("  Listening on " + url);
            logger.console("  Data dir: " + config.getDataDir());
            logger.console("  Log file: " + config.getLogPath());
            logger.console("");
            logger.console("========================================");
            logger.console("  Press Ctrl+C to stop");
            logger.console("========================================");

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("Shutting down...");
                app.stop();
                if (config.getSessionId() != null) {
                    new SessionEndHook(manager).onSessionEnd(config.getSessionId());
                }
                logger.close();
            }));

        } catch (Exception e) {
            System.err.println("Failed to start Issue Queue: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    /**
     * Build the Javalin app with routes and exception mapping, without starting it.
     */
    public static Javalin createApp(IssueManager manager, IssueTool tool) {
        ObjectMapper objectMapper = JsonStorage.mapper();
        Javalin app = Javalin.create(cfg -> {
            cfg.jsonMapper(new JavalinJackson(objectMapper));
            cfg.http.defaultContentType = "application/json";
        });

        Controller issues = new IssueController(manager, tool, objectMapper);
        issues.registerRoutes(app);

        registerExceptionHandlers(app);
        return app;
    }

    private static void printBanner(AppConfig config) {
        logger.console("");
        logger.console("========================================");
        logger.console("  Issue Queue v" + VERSION);
        logger.console("========================================");
        logger.console("  Starting server...");
        if (config.isDevMode()) {
            logger.console("  Mode: Development");
        }
    }

    private static void registerExceptionHandlers(Javalin app) {
        app.exception(IssueValidationException.class, (e, ctx) -> {
            ctx.status(400).json(Controller.errorBody(e));
        });

        app.exception(JsonProcessingException.class, (e, ctx) -> {
            ctx.status(400).json(Controller.errorBody(new IssueValidationException("Malformed JSON body")));
        });

        app.exception(IssueNotFoundException.class, (e, ctx) -> {
            ctx.status(404).json(Controller.errorBody(e));
        });

        app.exception(DependencyCycleException.class, (e, ctx) -> {
            ctx.status(409).json(Controller.errorBody(e));
        });

        app.exception(IssueLockException.class, (e, ctx) -> {
            warn("Lock not acquired: " + e.getMessage());
            ctx.status(503).json(Controller.errorBody(e));
        });

        app.exception(Exception.class, (e, ctx) -> {
            AppLogger log = AppLogger.get();
            if (log != null) {
                log.error("Unhandled exception: " + e.getMessage(), e);
            }
            ctx.status(500).json(Controller.errorBody(e));
        });
    }

    private static void warn(String message) {
        AppLogger log = AppLogger.get();
        if (log != null) {
            log.warn(message);
        }
    }
}

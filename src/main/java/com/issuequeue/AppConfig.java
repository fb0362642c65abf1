package com.issuequeue;

import java.io.IOException;
import java.net.ServerSocket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Map;

/**
 * Process-start configuration: data directory, event attribution, lock timeout
 * and the HTTP port. Defaults, then environment, then command-line flags.
 */
public class AppConfig {

    private static final String APP_NAME = "issue-queue";

    public static final String ENV_DATA_DIR = "ISSUE_QUEUE_DATA_DIR";
    public static final String ENV_ACTOR = "ISSUE_QUEUE_ACTOR";
    public static final String ENV_SESSION_ID = "ISSUE_QUEUE_SESSION_ID";
    public static final String ENV_LOCK_TIMEOUT_MS = "ISSUE_QUEUE_LOCK_TIMEOUT_MS";

    private final Path dataDir;
    private final String actor;
    private final String sessionId;
    private final Duration lockTimeout;
    private final Path logPath;
    private final int port;
    private final boolean devMode;

    private AppConfig(Path dataDir, String actor, String sessionId, Duration lockTimeout, Path logPath,
                      int port, boolean devMode) {
        this.dataDir = dataDir;
        this.actor = actor;
        this.sessionId = sessionId;
        this.lockTimeout = lockTimeout;
        this.logPath = logPath;
        this.port = port;
        this.devMode = devMode;
    }

    public Path getDataDir() {
        return dataDir;
    }

    public String getActor() {
        return actor;
    }

    public String getSessionId() {
        return sessionId;
    }

    public Duration getLockTimeout() {
        return lockTimeout;
    }

    public Path getLogPath() {
        return logPath;
    }

    public int getPort() {
        return port;
    }

    public boolean isDevMode() {
        return devMode;
    }

    /**
     * Default data directory: ~/.issue-queue/issues
     */
    public static Path getDefaultDataDir() {
        return Paths.get(System.getProperty("user.home"), "." + APP_NAME, "issues");
    }

    /**
     * Get the log directory path based on the operating system.
     * Windows: %APPDATA%\issue-queue\logs
     * macOS: ~/Library/Logs/issue-queue
     * Linux: ~/.local/share/issue-queue/logs
     */
    public static Path getLogDirectory() {
        String os = System.getProperty("os.name").toLowerCase();
        String userHome = System.getProperty("user.home");

        if (os.contains("win")) {
            String appData = System.getenv("APPDATA");
            if (appData == null) {
                appData = Paths.get(userHome, "AppData", "Roaming").toString();
            }
            return Paths.get(appData, APP_NAME, "logs");
        } else if (os.contains("mac")) {
            return Paths.get(userHome, "Library", "Logs", APP_NAME);
        } else {
            return Paths.get(userHome, ".local", "share", APP_NAME, "logs");
        }
    }

    public static Path getLogFilePath() {
        return getLogDirectory().resolve(APP_NAME + ".log");
    }

    /**
     * Find an available port, starting with the preferred port.
     */
    public static int findAvailablePort(int preferredPort) {
        if (isPortAvailable(preferredPort)) {
            return preferredPort;
        }
        try (ServerSocket socket = new ServerSocket(0)) {
            socket.setReuseAddress(true);
            return socket.getLocalPort();
        } catch (IOException e) {
            for (int port = preferredPort + 1; port < preferredPort + 100; port++) {
                if (isPortAvailable(port)) {
                    return port;
                }
            }
        }
        // Let the server fail later with a clear error.
        return preferredPort;
    }

    public static boolean isPortAvailable(int port) {
        try (ServerSocket socket = new ServerSocket(port)) {
            socket.setReuseAddress(true);
            return true;
        } catch (IOException e) {
            return false;
        }
    }

    /**
     * Builder for AppConfig.
     */
    public static class Builder {
        private Path dataDir = null;
        private String actor = IssueManager.DEFAULT_ACTOR;
        private String sessionId = null;
        private Duration lockTimeout = IssueManager.DEFAULT_LOCK_TIMEOUT;
        private Path logPath = null;
        private int preferredPort = 8080;
        private boolean devMode = false;

        public Builder dataDir(String path) {
            if (path != null && !path.isBlank()) {
                this.dataDir = Paths.get(path).toAbsolutePath().normalize();
            }
            return this;
        }

        public Builder actor(String actor) {
            if (actor != null && !actor.isBlank()) {
                this.actor = actor;
            }
            return this;
        }

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId != null && !sessionId.isBlank() ? sessionId : null;
            return this;
        }

        public Builder lockTimeoutMillis(long millis) {
            if (millis <= 0) {
                throw new IllegalArgumentException("Lock timeout must be positive: " + millis);
            }
            this.lockTimeout = Duration.ofMillis(millis);
            return this;
        }

        public Builder logPath(Path logPath) {
            this.logPath = logPath;
            return this;
        }

        public Builder port(int port) {
            this.preferredPort = port;
            return this;
        }

        public Builder devMode(boolean devMode) {
            this.devMode = devMode;
            return this;
        }

        public Builder fromEnvironment(Map<String, String> env) {
            dataDir(env.get(ENV_DATA_DIR));
            actor(env.get(ENV_ACTOR));
            if (env.get(ENV_SESSION_ID) != null) {
                sessionId(env.get(ENV_SESSION_ID));
            }
            String timeout = env.get(ENV_LOCK_TIMEOUT_MS);
            if (timeout != null && !timeout.isBlank()) {
                lockTimeoutMillis(parseLong(ENV_LOCK_TIMEOUT_MS, timeout));
            }
            return this;
        }

        public Builder parseArgs(String[] args) {
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];

                if (arg.startsWith("--data-dir=")) {
                    dataDir(arg.substring("--data-dir=".length()));
                } else if ("--data-dir".equals(arg) && i + 1 < args.length) {
                    dataDir(args[++i]);
                } else if (arg.startsWith("--actor=")) {
                    actor(arg.substring("--actor=".length()));
                } else if ("--actor".equals(arg) && i + 1 < args.length) {
                    actor(args[++i]);
                } else if (arg.startsWith("--session=")) {
                    sessionId(arg.substring("--session=".length()));
                } else if ("--session".equals(arg) && i + 1 < args.length) {
                    sessionId(args[++i]);
                } else if (arg.startsWith("--lock-timeout-ms=")) {
                    lockTimeoutMillis(parseLong("--lock-timeout-ms", arg.substring("--lock-timeout-ms=".length())));
                } else if ("--lock-timeout-ms".equals(arg) && i + 1 < args.length) {
                    lockTimeoutMillis(parseLong("--lock-timeout-ms", args[++i]));
                } else if (arg.startsWith("--port=")) {
                    this.preferredPort = (int) parseLong("--port", arg.substring("--port=".length()));
                } else if ("--port".equals(arg) && i + 1 < args.length) {
                    this.preferredPort = (int) parseLong("--port", args[++i]);
                } else if ("--dev".equals(arg)) {
                    this.devMode = true;
                } else {
                    throw new IllegalArgumentException("Unknown argument: " + arg);
                }
            }
            return this;
        }

        /**
         * Resolve defaults without touching the filesystem or probing ports.
         */
        public AppConfig buildDetached() {
            Path data = dataDir != null ? dataDir : getDefaultDataDir();
            Path log = logPath != null ? logPath : getLogFilePath();
            return new AppConfig(data, actor, sessionId, lockTimeout, log, preferredPort, devMode);
        }

        public AppConfig build() throws IOException {
            AppConfig detached = buildDetached();
            Files.createDirectories(detached.getDataDir());
            Path logParent = detached.getLogPath().getParent();
            if (logParent != null) {
                Files.createDirectories(logParent);
            }
            int port = findAvailablePort(preferredPort);
            return new AppConfig(detached.getDataDir(), actor, sessionId, lockTimeout, detached.getLogPath(),
                port, devMode);
        }

        private static long parseLong(String name, String raw) {
            try {
                return Long.parseLong(raw.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for " + name + ": " + raw, e);
            }
        }
    }
}

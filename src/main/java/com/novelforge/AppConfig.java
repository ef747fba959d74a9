package com.novelforge;

import java.io.IOException;
import java.net.ServerSocket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Application configuration handling platform-specific paths and settings.
 */
public class AppConfig {

    private static final String APP_NAME = "Novel-Forge";
    public static final String OUTPUT_DIR = "output";

    private final Path workspacePath;
    private final Path logPath;
    private final int port;
    private final boolean devMode;
    private final String runProjectId;
    private final boolean showReasoning;

    private AppConfig(Path workspacePath, Path logPath, int port, boolean devMode, String runProjectId,
                      boolean showReasoning) {
        this.workspacePath = workspacePath;
        this.logPath = logPath;
        this.port = port;
        this.devMode = devMode;
        this.runProjectId = runProjectId;
        this.showReasoning = showReasoning;
    }

    public Path getWorkspacePath() {
        return workspacePath;
    }

    /**
     * Folder holding one subfolder per project.
     */
    public Path getOutputPath() {
        return workspacePath.resolve(OUTPUT_DIR);
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
     * Project to generate in the foreground instead of starting the server, or null.
     */
    public String getRunProjectId() {
        return runProjectId;
    }

    public boolean isShowReasoning() {
        return showReasoning;
    }

    /**
     * Get the default workspace path based on the operating system.
     * Windows: %USERPROFILE%\Documents\Novel-Forge
     * macOS: ~/Documents/Novel-Forge
     * Linux: ~/Novel-Forge
     */
    public static Path getDefaultWorkspacePath() {
        String os = System.getProperty("os.name").toLowerCase();
        String userHome = System.getProperty("user.home");

        if (os.contains("win")) {
            String documents = System.getenv("USERPROFILE");
            if (documents == null) {
                documents = userHome;
            }
            return Paths.get(documents, "Documents", APP_NAME);
        } else if (os.contains("mac")) {
            return Paths.get(userHome, "Documents", APP_NAME);
        } else {
            return Paths.get(userHome, APP_NAME);
        }
    }

    /**
     * Get the log directory path based on the operating system.
     * Windows: %APPDATA%\Novel-Forge\logs
     * macOS: ~/Library/Logs/Novel-Forge
     * Linux: ~/.local/share/Novel-Forge/logs
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
        private Path workspacePath = null;
        private Path logDirectory = null;
        private int preferredPort = 8080;
        private boolean devMode = false;
        private String runProjectId = null;
        private boolean showReasoning = false;

        public Builder workspacePath(String path) {
            if (path != null && !path.isEmpty()) {
                this.workspacePath = Paths.get(path).toAbsolutePath().normalize();
            }
            return this;
        }

        public Builder logDirectory(Path logDirectory) {
            this.logDirectory = logDirectory;
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

        /**
         * @throws IllegalArgumentException for a malformed port or a flag missing its value
         */
        public Builder parseArgs(String[] args) {
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];

                if (arg.startsWith("--workspace=")) {
                    workspacePath(arg.substring("--workspace=".length()));
                } else if ("--workspace".equals(arg)) {
                    workspacePath(value(args, ++i, arg));
                } else if (arg.startsWith("--port=")) {
                    this.preferredPort = parsePort(arg.substring("--port=".length()));
                } else if ("--port".equals(arg)) {
                    this.preferredPort = parsePort(value(args, ++i, arg));
                } else if (arg.startsWith("--run=")) {
                    this.runProjectId = arg.substring("--run=".length());
                } else if ("--run".equals(arg)) {
                    this.runProjectId = value(args, ++i, arg);
                } else if ("--show-reasoning".equals(arg)) {
                    this.showReasoning = true;
                } else if ("--dev".equals(arg)) {
                    this.devMode = true;
                }
            }
            return this;
        }

        private static String value(String[] args, int index, String flag) {
            if (index >= args.length) {
                throw new IllegalArgumentException(flag + " requires a value");
            }
            return args[index];
        }

        private static int parsePort(String raw) {
            try {
                return Integer.parseInt(raw.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid port: " + raw, e);
            }
        }

        public AppConfig build() throws IOException {
            Path workspace = workspacePath != null ? workspacePath : getDefaultWorkspacePath();
            Files.createDirectories(workspace.resolve(OUTPUT_DIR));

            int port = runProjectId != null ? preferredPort : findAvailablePort(preferredPort);

            Path logDir = logDirectory != null ? logDirectory : getLogDirectory();
            Files.createDirectories(logDir);

            return new AppConfig(workspace, logDir.resolve("novel-forge.log"), port, devMode, runProjectId,
                showReasoning);
        }
    }
}

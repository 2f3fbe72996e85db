package com.opensiddur;

import java.io.IOException;
import java.net.ServerSocket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Application configuration: where projects live, what to compile, and platform-specific paths.
 */
public class AppConfig {

    private static final String APP_NAME = "OpenSiddur";

    private final Path projectsPath;
    private final Path settingsPath;
    private final String project;
    private final String document;
    private final String urn;
    private final Path outputPath;
    private final Path logPath;
    private final boolean serve;
    private final int port;
    private final boolean devMode;

    private AppConfig(Builder builder, Path projectsPath, Path logPath, int port) {
        this.projectsPath = projectsPath;
        this.settingsPath = builder.settingsPath;
        this.project = builder.project;
        this.document = builder.document;
        this.urn = builder.urn;
        this.outputPath = builder.outputPath;
        this.logPath = logPath;
        this.serve = builder.serve;
        this.port = port;
        this.devMode = builder.devMode;
    }

    public Path getProjectsPath() {
        return projectsPath;
    }

    public Path getSettingsPath() {
        return settingsPath;
    }

    public String getProject() {
        return project;
    }

    public String getDocument() {
        return document;
    }

    public String getUrn() {
        return urn;
    }

    public Path getOutputPath() {
        return outputPath;
    }

    public Path getLogPath() {
        return logPath;
    }

    public boolean isServe() {
        return serve;
    }

    public int getPort() {
        return port;
    }

    public boolean isDevMode() {
        return devMode;
    }

    /**
     * Get the default projects path based on the operating system.
     * Windows: %USERPROFILE%\Documents\OpenSiddur\projects
     * macOS: ~/Documents/OpenSiddur/projects
     * Linux: ~/OpenSiddur/projects
     */
    public static Path getDefaultProjectsPath() {
        String os = System.getProperty("os.name").toLowerCase();
        String userHome = System.getProperty("user.home");

        if (os.contains("win")) {
            String documents = System.getenv("USERPROFILE");
            if (documents == null) {
                documents = userHome;
            }
            return Paths.get(documents, "Documents", APP_NAME, "projects");
        } else if (os.contains("mac")) {
            return Paths.get(userHome, "Documents", APP_NAME, "projects");
        } else {
            return Paths.get(userHome, APP_NAME, "projects");
        }
    }

    /**
     * Get the log directory path based on the operating system.
     * Windows: %APPDATA%\OpenSiddur\logs
     * macOS: ~/Library/Logs/OpenSiddur
     * Linux: ~/.local/share/OpenSiddur/logs
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
        return getLogDirectory().resolve("siddur-compiler.log");
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
        // let the server report the clash
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

    public static Path ensureLogDirectory() throws IOException {
        Files.createDirectories(getLogDirectory());
        return getLogFilePath();
    }

    /**
     * Builder for AppConfig.
     */
    public static class Builder {
        private Path projectsPath = null;
        private Path settingsPath = null;
        private String project = null;
        private String document = null;
        private String urn = null;
        private Path outputPath = null;
        private boolean serve = false;
        private int preferredPort = 8080;
        private boolean devMode = false;

        public Builder projectsPath(String path) {
            if (path != null && !path.isEmpty()) {
                this.projectsPath = Paths.get(path).toAbsolutePath().normalize();
            }
            return this;
        }

        public Builder settingsPath(String path) {
            if (path != null && !path.isEmpty()) {
                this.settingsPath = Paths.get(path).toAbsolutePath().normalize();
            }
            return this;
        }

        public Builder outputPath(String path) {
            if (path != null && !path.isEmpty()) {
                this.outputPath = Paths.get(path).toAbsolutePath().normalize();
            }
            return this;
        }

        public Builder project(String project) {
            this.project = project;
            return this;
        }

        public Builder document(String document) {
            this.document = document;
            return this;
        }

        public Builder urn(String urn) {
            this.urn = urn;
            return this;
        }

        public Builder serve(boolean serve) {
            this.serve = serve;
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
         * Accepts {@code --flag=value} and {@code --flag value}.
         *
         * @throws IllegalArgumentException for a port that is not a number
         */
        public Builder parseArgs(String[] args) {
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                String name = arg;
                String value = null;
                int eq = arg.indexOf('=');
                if (arg.startsWith("--") && eq > 0) {
                    name = arg.substring(0, eq);
                    value = arg.substring(eq + 1);
                }

                switch (name) {
                    case "--serve":
                        this.serve = true;
                        continue;
                    case "--dev":
                        this.devMode = true;
                        continue;
                    case "--projects":
                    case "--settings":
                    case "--project":
                    case "--document":
                    case "--urn":
                    case "--output":
                    case "--port":
                        break;
                    default:
                        continue;
                }
                if (value == null) {
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("Missing value for " + name);
                    }
                    value = args[++i];
                }
                apply(name, value);
            }
            return this;
        }

        private void apply(String name, String value) {
            switch (name) {
                case "--projects":
                    projectsPath(value);
                    break;
                case "--settings":
                    settingsPath(value);
                    break;
                case "--project":
                    project(value);
                    break;
                case "--document":
                    document(value);
                    break;
                case "--urn":
                    urn(value);
                    break;
                case "--output":
                    outputPath(value);
                    break;
                case "--port":
                    try {
                        this.preferredPort = Integer.parseInt(value);
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("Invalid port: " + value, e);
                    }
                    break;
                default:
                    break;
            }
        }

        public AppConfig build() throws IOException {
            return build(ensureLogDirectory());
        }

        public AppConfig build(Path logPath) {
            Path projects = projectsPath != null ? projectsPath : getDefaultProjectsPath();
            int port = serve ? findAvailablePort(preferredPort) : preferredPort;
            return new AppConfig(this, projects, logPath, port);
        }
    }
}

package com.certledger;

import java.io.IOException;
import java.net.ServerSocket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Process configuration: where ledger state lives, which port the API binds
 * and whether console logging is on.
 */
public class AppConfig {

    private static final String APP_NAME = "CertLedger";
    static final int DEFAULT_PORT = 8085;

    private final Path dataPath;
    private final Path logPath;
    private final int port;
    private final boolean devMode;

    private AppConfig(Path dataPath, Path logPath, int port, boolean devMode) {
        this.dataPath = dataPath;
        this.logPath = logPath;
        this.port = port;
        this.devMode = devMode;
    }

    public Path getDataPath() {
        return dataPath;
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
     * Default data directory.
     * Windows: %APPDATA%\CertLedger\data
     * macOS: ~/Library/Application Support/CertLedger/data
     * Linux: ~/.local/share/CertLedger/data
     */
    public static Path getDefaultDataPath() {
        return getAppHome().resolve("data");
    }

    public static Path getLogFilePath() {
        return getAppHome().resolve("logs").resolve("cert-ledger.log");
    }

    private static Path getAppHome() {
        String os = System.getProperty("os.name").toLowerCase();
        String userHome = System.getProperty("user.home");

        if (os.contains("win")) {
            String appData = System.getenv("APPDATA");
            if (appData == null) {
                appData = Paths.get(userHome, "AppData", "Roaming").toString();
            }
            return Paths.get(appData, APP_NAME);
        } else if (os.contains("mac")) {
            return Paths.get(userHome, "Library", "Application Support", APP_NAME);
        } else {
            return Paths.get(userHome, ".local", "share", APP_NAME);
        }
    }

    /**
     * Use the preferred port when free, otherwise any port the OS hands out.
     */
    public static int findAvailablePort(int preferredPort) {
        if (isPortAvailable(preferredPort)) {
            return preferredPort;
        }
        try (ServerSocket socket = new ServerSocket(0)) {
            socket.setReuseAddress(true);
            return socket.getLocalPort();
        } catch (IOException e) {
            return preferredPort;
        }
    }

    public static boolean isPortAvailable(int port) {
        try (ServerSocket socket = new ServerSocket(port)) {
            socket.setReuseAddress(true);
            return true;
        } catch (IOException e) {
            return false;
        }
    }

    public static class Builder {
        private Path dataPath = null;
        private Path logPath = null;
        private int preferredPort = DEFAULT_PORT;
        private boolean devMode = false;

        public Builder dataPath(String path) {
            if (path != null && !path.isEmpty()) {
                this.dataPath = Paths.get(path).toAbsolutePath().normalize();
            }
            return this;
        }

        public Builder logPath(Path path) {
            this.logPath = path;
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

        public Builder parseArgs(String[] args) {
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];

                if (arg.startsWith("--data-dir=")) {
                    dataPath(arg.substring("--data-dir=".length()));
                } else if ("--data-dir".equals(arg) && i + 1 < args.length) {
                    dataPath(args[++i]);
                } else if (arg.startsWith("--port=")) {
                    preferredPort = parsePort(arg.substring("--port=".length()));
                } else if ("--port".equals(arg) && i + 1 < args.length) {
                    preferredPort = parsePort(args[++i]);
                } else if ("--dev".equals(arg)) {
                    devMode = true;
                }
            }
            return this;
        }

        private int parsePort(String value) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid --port value: " + value);
            }
        }

        public AppConfig build() throws IOException {
            Path data = dataPath != null ? dataPath : getDefaultDataPath();
            Files.createDirectories(data);
            Path log = logPath != null ? logPath : getLogFilePath();
            if (log.getParent() != null) {
                Files.createDirectories(log.getParent());
            }
            int port = findAvailablePort(preferredPort);
            return new AppConfig(data, log, port, devMode);
        }

        int getPreferredPort() {
            return preferredPort;
        }

        Path getDataPath() {
            return dataPath;
        }

        boolean isDevMode() {
            return devMode;
        }
    }
}

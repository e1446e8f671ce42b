package io.walkie.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class WalkieConfig {
    public static final String ENV_HOME = "WALKIE_DIR";
    public static final String DEFAULT_DIR_NAME = ".walkie";
    public static final String TOPIC_NAMESPACE = "walkie";

    private final Path homeDir;

    public WalkieConfig(Path homeDir) {
        this.homeDir = homeDir;
    }

    public static WalkieConfig resolve(String home) {
        if (home != null && !home.isBlank()) {
            return fromHome(home);
        }
        return fromHome(System.getenv(ENV_HOME));
    }

    public static WalkieConfig fromHome(String home) {
        Path resolved = home == null || home.isBlank()
                ? Paths.get(System.getProperty("user.home"), DEFAULT_DIR_NAME)
                : Paths.get(home);
        return new WalkieConfig(resolved.toAbsolutePath().normalize());
    }

    public Path homeDir() {
        return homeDir;
    }

    public Path socketPath() {
        return homeDir.resolve("daemon.sock");
    }

    public Path pidFile() {
        return homeDir.resolve("daemon.pid");
    }

    public Path logFile() {
        return homeDir.resolve("daemon.log");
    }

    public Path lockFile() {
        return homeDir.resolve("daemon.lock");
    }

    public Path settingsFile() {
        return homeDir.resolve("walkie-settings.json");
    }
}

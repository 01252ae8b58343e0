package io.foreman.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class ForemanConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String SETTINGS_FILE = "foreman-settings.json";

    private final Path rootDir;

    public ForemanConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static ForemanConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new ForemanConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve("foreman.db");
    }

    public Path logsDir() {
        return rootDir.resolve("logs");
    }

    public Path taskLogFile(long taskId) {
        return logsDir().resolve("task-" + taskId + ".log");
    }

    public Path taskPromptFile(long taskId) {
        return logsDir().resolve("task-" + taskId + ".prompt.txt");
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path heartbeatFile() {
        return rootDir.resolve("HEARTBEAT.md");
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }
}

package io.foreman.config;

import io.foreman.model.WorkerRole;
import io.foreman.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Caps, timeouts and retention windows for one dispatcher. Loaded from {@code foreman-settings.json};
 * every field is optional and missing or invalid values fall back to {@link #defaults()}.
 */
public record DispatcherSettings(
        int maxParallelBuild,
        int maxParallelValidate,
        int buildMaxAttempts,
        int validateMaxAttempts,
        long buildTimeoutMs,
        long validateTimeoutMs,
        long staleThresholdMs,
        long terminateGraceMs,
        long launchWaitMs,
        int completedRetentionDays,
        long blockedDigestIntervalMs,
        boolean unblockResetsAttempts,
        int questionExpiryMinutes,
        long passLockTtlMs,
        List<String> buildCommand,
        List<String> validateCommand,
        List<String> notifyCommand
) {
    private static final Logger LOG = LoggerFactory.getLogger(DispatcherSettings.class);

    public static final List<String> DEFAULT_WORKER_COMMAND =
            List.of("openclaw", "agent", "--agent", "{agent}", "--timeout", "{timeoutSeconds}");

    public DispatcherSettings {
        buildCommand = List.copyOf(buildCommand);
        validateCommand = List.copyOf(validateCommand);
        notifyCommand = List.copyOf(notifyCommand);
    }

    public static DispatcherSettings defaults() {
        return new DispatcherSettings(
                3,
                1,
                3,
                2,
                3_600_000L,
                3_600_000L,
                7_200_000L,
                1_000L,
                0L,
                30,
                6L * 60L * 60L * 1000L,
                true,
                60,
                600_000L,
                DEFAULT_WORKER_COMMAND,
                DEFAULT_WORKER_COMMAND,
                List.of()
        );
    }

    public static DispatcherSettings load(ForemanConfig config) {
        return load(config.settingsFile());
    }

    public static DispatcherSettings load(Path file) {
        DispatcherSettings defaults = defaults();
        if (file == null || !Files.isRegularFile(file)) {
            return defaults;
        }
        try {
            SettingsFile raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(raw, defaults);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read dispatcher settings: " + file, e);
        }
    }

    public static DispatcherSettings fromFile(SettingsFile file, DispatcherSettings defaults) {
        if (file == null) {
            return defaults;
        }
        long stale = sanitizeLong(file.staleThresholdMs(), defaults.staleThresholdMs(), 1L);
        long buildTimeout = clampToStale("buildTimeoutMs",
                sanitizeLong(file.buildTimeoutMs(), defaults.buildTimeoutMs(), 1L), stale);
        long validateTimeout = clampToStale("validateTimeoutMs",
                sanitizeLong(file.validateTimeoutMs(), defaults.validateTimeoutMs(), 1L), stale);
        return new DispatcherSettings(
                sanitizeInt(file.maxParallelBuild(), defaults.maxParallelBuild(), 1),
                sanitizeInt(file.maxParallelValidate(), defaults.maxParallelValidate(), 1),
                sanitizeInt(file.buildMaxAttempts(), defaults.buildMaxAttempts(), 1),
                sanitizeInt(file.validateMaxAttempts(), defaults.validateMaxAttempts(), 1),
                buildTimeout,
                validateTimeout,
                stale,
                sanitizeLong(file.terminateGraceMs(), defaults.terminateGraceMs(), 0L),
                sanitizeLong(file.launchWaitMs(), defaults.launchWaitMs(), 0L),
                sanitizeInt(file.completedRetentionDays(), defaults.completedRetentionDays(), 1),
                sanitizeLong(file.blockedDigestIntervalMs(), defaults.blockedDigestIntervalMs(), 1L),
                file.unblockResetsAttempts() == null ? defaults.unblockResetsAttempts() : file.unblockResetsAttempts(),
                sanitizeInt(file.questionExpiryMinutes(), defaults.questionExpiryMinutes(), 1),
                sanitizeLong(file.passLockTtlMs(), defaults.passLockTtlMs(), 1L),
                sanitizeCommand(file.buildCommand(), defaults.buildCommand()),
                sanitizeCommand(file.validateCommand(), defaults.validateCommand()),
                file.notifyCommand() == null ? defaults.notifyCommand() : file.notifyCommand()
        );
    }

    public int maxParallel(WorkerRole role) {
        return role == WorkerRole.BUILD ? maxParallelBuild : maxParallelValidate;
    }

    public int maxAttempts(WorkerRole role) {
        return role == WorkerRole.BUILD ? buildMaxAttempts : validateMaxAttempts;
    }

    public long timeoutMs(WorkerRole role) {
        return role == WorkerRole.BUILD ? buildTimeoutMs : validateTimeoutMs;
    }

    public List<String> command(WorkerRole role) {
        return role == WorkerRole.BUILD ? buildCommand : validateCommand;
    }

    public long completedRetentionMs() {
        return completedRetentionDays * 24L * 60L * 60L * 1000L;
    }

    public DispatcherSettings withCaps(int build, int validate) {
        return new DispatcherSettings(build, validate, buildMaxAttempts, validateMaxAttempts, buildTimeoutMs,
                validateTimeoutMs, staleThresholdMs, terminateGraceMs, launchWaitMs, completedRetentionDays,
                blockedDigestIntervalMs, unblockResetsAttempts, questionExpiryMinutes, passLockTtlMs,
                buildCommand, validateCommand, notifyCommand);
    }

    public DispatcherSettings withMaxAttempts(int build, int validate) {
        return new DispatcherSettings(maxParallelBuild, maxParallelValidate, build, validate, buildTimeoutMs,
                validateTimeoutMs, staleThresholdMs, terminateGraceMs, launchWaitMs, completedRetentionDays,
                blockedDigestIntervalMs, unblockResetsAttempts, questionExpiryMinutes, passLockTtlMs,
                buildCommand, validateCommand, notifyCommand);
    }

    public DispatcherSettings withLaunchWaitMs(long waitMs) {
        return new DispatcherSettings(maxParallelBuild, maxParallelValidate, buildMaxAttempts, validateMaxAttempts,
                buildTimeoutMs, validateTimeoutMs, staleThresholdMs, terminateGraceMs, waitMs, completedRetentionDays,
                blockedDigestIntervalMs, unblockResetsAttempts, questionExpiryMinutes, passLockTtlMs,
                buildCommand, validateCommand, notifyCommand);
    }

    public DispatcherSettings withUnblockResetsAttempts(boolean reset) {
        return new DispatcherSettings(maxParallelBuild, maxParallelValidate, buildMaxAttempts, validateMaxAttempts,
                buildTimeoutMs, validateTimeoutMs, staleThresholdMs, terminateGraceMs, launchWaitMs,
                completedRetentionDays, blockedDigestIntervalMs, reset, questionExpiryMinutes, passLockTtlMs,
                buildCommand, validateCommand, notifyCommand);
    }

    public DispatcherSettings withCommands(List<String> build, List<String> validate) {
        return new DispatcherSettings(maxParallelBuild, maxParallelValidate, buildMaxAttempts, validateMaxAttempts,
                buildTimeoutMs, validateTimeoutMs, staleThresholdMs, terminateGraceMs, launchWaitMs,
                completedRetentionDays, blockedDigestIntervalMs, unblockResetsAttempts, questionExpiryMinutes,
                passLockTtlMs, build, validate, notifyCommand);
    }

    private static long clampToStale(String field, long timeoutMs, long staleMs) {
        if (timeoutMs > staleMs) {
            LOG.warn("{}={} exceeds staleThresholdMs={}, clamping", field, timeoutMs, staleMs);
            return staleMs;
        }
        return timeoutMs;
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null || raw < min) {
            return fallback;
        }
        return raw;
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null || raw < min) {
            return fallback;
        }
        return raw;
    }

    private static List<String> sanitizeCommand(List<String> raw, List<String> fallback) {
        if (raw == null || raw.isEmpty() || raw.get(0) == null || raw.get(0).isBlank()) {
            return fallback;
        }
        return raw;
    }

    public record SettingsFile(
            Integer maxParallelBuild,
            Integer maxParallelValidate,
            Integer buildMaxAttempts,
            Integer validateMaxAttempts,
            Long buildTimeoutMs,
            Long validateTimeoutMs,
            Long staleThresholdMs,
            Long terminateGraceMs,
            Long launchWaitMs,
            Integer completedRetentionDays,
            Long blockedDigestIntervalMs,
            Boolean unblockResetsAttempts,
            Integer questionExpiryMinutes,
            Long passLockTtlMs,
            List<String> buildCommand,
            List<String> validateCommand,
            List<String> notifyCommand
    ) {
    }
}

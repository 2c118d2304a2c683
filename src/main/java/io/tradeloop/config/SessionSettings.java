package io.tradeloop.config;

import io.tradeloop.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Orchestrator tunables. Loaded leniently from {@code tradeloop-settings.json}:
 * absent fields keep their defaults and values are clamped to sane minimums.
 */
public record SessionSettings(
        Duration heartbeatInterval,
        int recoveryMaxAttempts,
        Duration recoveryBaseDelay,
        Duration recoveryMaxDelay,
        double initialCapital,
        Duration pauseBetweenPhases,
        Duration maxPause
) {
    public static final long DEFAULT_HEARTBEAT_INTERVAL_MS = 30_000L;
    public static final int DEFAULT_RECOVERY_MAX_ATTEMPTS = 3;
    public static final long DEFAULT_RECOVERY_BASE_DELAY_MS = 2_000L;
    public static final long DEFAULT_RECOVERY_MAX_DELAY_MS = 30_000L;
    public static final double DEFAULT_INITIAL_CAPITAL = 10_000.0;
    public static final long DEFAULT_MAX_PAUSE_MS = 10L * 60L * 1000L;

    private static final Logger log = LoggerFactory.getLogger(SessionSettings.class);

    public static SessionSettings defaults() {
        return new SessionSettings(
                Duration.ofMillis(DEFAULT_HEARTBEAT_INTERVAL_MS),
                DEFAULT_RECOVERY_MAX_ATTEMPTS,
                Duration.ofMillis(DEFAULT_RECOVERY_BASE_DELAY_MS),
                Duration.ofMillis(DEFAULT_RECOVERY_MAX_DELAY_MS),
                DEFAULT_INITIAL_CAPITAL,
                Duration.ZERO,
                Duration.ofMillis(DEFAULT_MAX_PAUSE_MS)
        );
    }

    public static SessionSettings load(Path file) {
        SessionSettings defaults = defaults();
        if (file == null || !Files.exists(file)) {
            return defaults;
        }
        try {
            SettingsFile raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(raw, defaults);
        } catch (IOException e) {
            log.warn("Unreadable settings file {}, using defaults: {}", file, e.getMessage());
            return defaults;
        }
    }

    static SessionSettings fromFile(SettingsFile file, SessionSettings defaults) {
        if (file == null) {
            return defaults;
        }
        long heartbeat = sanitizeLong(file.heartbeatIntervalMs(), defaults.heartbeatInterval().toMillis(), 10L);
        int maxAttempts = sanitizeInt(file.recoveryMaxAttempts(), defaults.recoveryMaxAttempts(), 1);
        long baseDelay = sanitizeLong(file.recoveryBaseDelayMs(), defaults.recoveryBaseDelay().toMillis(), 0L);
        long maxDelay = sanitizeLong(file.recoveryMaxDelayMs(), defaults.recoveryMaxDelay().toMillis(), baseDelay);
        if (maxDelay < baseDelay) {
            maxDelay = baseDelay;
        }
        double capital = file.initialCapital() == null ? defaults.initialCapital() : Math.max(0.0, file.initialCapital());
        long maxPause = sanitizeLong(file.maxPauseMs(), defaults.maxPause().toMillis(), 0L);
        long pause = sanitizeLong(file.pauseBetweenPhasesMs(), defaults.pauseBetweenPhases().toMillis(), 0L);
        return new SessionSettings(
                Duration.ofMillis(heartbeat),
                maxAttempts,
                Duration.ofMillis(baseDelay),
                Duration.ofMillis(maxDelay),
                capital,
                Duration.ofMillis(pause),
                Duration.ofMillis(maxPause)
        );
    }

    public SessionSettings withHeartbeatInterval(Duration interval) {
        return new SessionSettings(interval, recoveryMaxAttempts, recoveryBaseDelay, recoveryMaxDelay,
                initialCapital, pauseBetweenPhases, maxPause);
    }

    public SessionSettings withRecovery(int maxAttempts, Duration baseDelay, Duration maxDelay) {
        return new SessionSettings(heartbeatInterval, maxAttempts, baseDelay, maxDelay,
                initialCapital, pauseBetweenPhases, maxPause);
    }

    public SessionSettings withPauseBetweenPhases(Duration pause) {
        return new SessionSettings(heartbeatInterval, recoveryMaxAttempts, recoveryBaseDelay, recoveryMaxDelay,
                initialCapital, pause, maxPause);
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    record SettingsFile(
            Long heartbeatIntervalMs,
            Integer recoveryMaxAttempts,
            Long recoveryBaseDelayMs,
            Long recoveryMaxDelayMs,
            Double initialCapital,
            Long pauseBetweenPhasesMs,
            Long maxPauseMs
    ) {
    }
}

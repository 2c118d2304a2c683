package io.tradeloop.engine;

import io.tradeloop.model.EventLevel;
import io.tradeloop.model.EventType;
import io.tradeloop.model.PhaseResult;
import io.tradeloop.model.RecoveryAttempt;
import io.tradeloop.model.RecoveryResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Phase-level recovery after a phase failed outright.
 *
 * <p>Unlike {@link RetryExecutor} it returns the full attempt history and
 * never throws for an attempt that failed with an exception. Attempt 1 runs
 * immediately; attempt k waits {@code min(base * 2^(k-1), max)} first. Each
 * attempt is written to the event log as soon as it finishes.
 */
public final class RecoveryManager {
    private static final Logger log = LoggerFactory.getLogger(RecoveryManager.class);

    private final SessionRecorder recorder;
    private final Sleeper sleeper;

    public RecoveryManager(SessionRecorder recorder, Sleeper sleeper) {
        this.recorder = Objects.requireNonNull(recorder, "recorder");
        this.sleeper = sleeper == null ? Sleeper.SYSTEM : sleeper;
    }

    public RecoveryResult attempt(
            String phaseName,
            RecoveryAction retryFn,
            int maxAttempts,
            Duration baseDelay,
            Duration maxDelay
    ) {
        return attempt(phaseName, null, retryFn, maxAttempts, baseDelay, maxDelay);
    }

    public RecoveryResult attempt(
            String phaseName,
            Throwable originalFailure,
            RecoveryAction retryFn,
            int maxAttempts,
            Duration baseDelay,
            Duration maxDelay
    ) {
        Objects.requireNonNull(retryFn, "retryFn");
        String originalError = originalFailure == null ? null : RetryExecutor.describe(originalFailure);
        if (maxAttempts < 1) {
            return RecoveryResult.notAttempted("recovery disabled for " + phaseName);
        }
        log.warn("Attempting recovery for {} (up to {} attempts)", phaseName, maxAttempts);
        List<RecoveryAttempt> attempts = new ArrayList<>();
        String lastError = originalError;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Duration delay = attempt == 1 ? Duration.ZERO : Backoff.delay(attempt, baseDelay, maxDelay);
            if (!delay.isZero()) {
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    lastError = "recovery interrupted before attempt " + attempt;
                    log.warn("Recovery for {} interrupted", phaseName);
                    break;
                }
            }
            RecoveryAttempt record;
            try {
                PhaseResult result = retryFn.retry();
                record = RecoveryAttempt.success(attempt, delay, result);
            } catch (Exception e) {
                lastError = RetryExecutor.describe(e);
                record = RecoveryAttempt.error(attempt, delay, lastError);
            }
            attempts.add(record);
            emitAttempt(phaseName, maxAttempts, record);
            if (record.succeeded()) {
                log.info("Recovered {} on attempt {}/{}", phaseName, attempt, maxAttempts);
                return new RecoveryResult(true, true,
                        "Recovered " + phaseName + " on attempt " + attempt, originalError, attempts);
            }
        }
        log.warn("Recovery for {} exhausted after {} attempts: {}", phaseName, attempts.size(), lastError);
        return new RecoveryResult(true, false, lastError, originalError, attempts);
    }

    private void emitAttempt(String phaseName, int maxAttempts, RecoveryAttempt record) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("attempt", record.attemptNumber());
        details.put("max_attempts", maxAttempts);
        details.put("delay_seconds", record.delayBeforeAttempt().toMillis() / 1000.0);
        details.put("status", record.succeeded() ? "success" : "error");
        if (record.error() != null) {
            details.put("error", record.error());
        }
        recorder.emit(
                EventType.RECOVERY_ATTEMPT,
                phaseName,
                record.succeeded() ? EventLevel.INFO : EventLevel.WARNING,
                "Recovery attempt " + record.attemptNumber() + "/" + maxAttempts + " for " + phaseName,
                details
        );
    }
}

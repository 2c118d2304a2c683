package io.tradeloop.engine;

import io.tradeloop.model.EventLevel;
import io.tradeloop.model.EventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * Operation-level retry with capped exponential backoff.
 *
 * <p>Phase work uses it for sub-operations such as loading data or calling an
 * exchange. Every retry is announced with an {@code autocorrect_attempt}
 * event. When the attempts run out, the exception of the last attempt is
 * rethrown unchanged.
 */
public final class RetryExecutor {
    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final SessionRecorder recorder;
    private final Sleeper sleeper;

    public RetryExecutor(SessionRecorder recorder, Sleeper sleeper) {
        this.recorder = Objects.requireNonNull(recorder, "recorder");
        this.sleeper = sleeper == null ? Sleeper.SYSTEM : sleeper;
    }

    public <T> T run(Callable<T> operation, RetryOptions options) throws Exception {
        return run(operation, options, null);
    }

    /**
     * Runs {@code operation} on behalf of {@code phase}. Retry events are
     * tagged with that phase even if the session has moved on, which happens
     * when a timed-out phase keeps working in the background. A {@code null}
     * phase tags events with whatever phase is active at the time.
     */
    public <T> T run(Callable<T> operation, RetryOptions options, String phase) throws Exception {
        Objects.requireNonNull(operation, "operation");
        RetryOptions opts = options == null ? RetryOptions.defaults(null) : options;
        int attempt = 1;
        while (true) {
            try {
                return operation.call();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw e;
            } catch (Exception e) {
                if (attempt >= opts.maxRetries()) {
                    log.warn("{} failed after {} attempts: {}", opts.operationName(), attempt, e.getMessage());
                    throw e;
                }
                Duration delay = Backoff.delay(attempt, opts.baseDelay(), opts.maxDelay());
                log.warn("{} attempt {}/{} failed, retrying after {} ms: {}",
                        opts.operationName(), attempt, opts.maxRetries(), delay.toMillis(), e.getMessage());
                String message = "Retrying " + opts.operationName() + " after failed attempt " + attempt;
                Map<String, Object> details = autocorrectDetails(opts, attempt, delay, e);
                if (phase == null) {
                    recorder.emitInActivePhase(EventType.AUTOCORRECT_ATTEMPT, EventLevel.WARNING, message, details);
                } else {
                    recorder.emit(EventType.AUTOCORRECT_ATTEMPT, phase, EventLevel.WARNING, message, details);
                }
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    throw interrupted;
                }
                attempt++;
            }
        }
    }

    private static Map<String, Object> autocorrectDetails(RetryOptions opts, int attempt, Duration delay, Exception error) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("operation", opts.operationName());
        details.put("attempt", attempt);
        details.put("max_retries", opts.maxRetries());
        details.put("delay_seconds", delay.toMillis() / 1000.0);
        details.put("error", describe(error));
        return details;
    }

    static String describe(Throwable error) {
        if (error == null) {
            return "unknown error";
        }
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }
}

package io.tradeloop.engine;

import io.tradeloop.model.PhaseResult;
import io.tradeloop.model.PhaseStatus;

import java.time.Duration;
import java.time.Instant;

public record PhaseOutcome(
        String name,
        PhaseStatus status,
        Duration timeout,
        Instant startedAt,
        Instant endedAt,
        PhaseResult result,
        Throwable error
) {
    static PhaseOutcome of(PhaseRun run, PhaseResult result, Throwable error) {
        return new PhaseOutcome(run.name(), run.status(), run.timeout(), run.startedAt(), run.endedAt(), result, error);
    }

    public boolean succeeded() {
        return status == PhaseStatus.SUCCESS;
    }

    public boolean timedOut() {
        return error instanceof PhaseTimeoutException;
    }

    public Duration duration() {
        if (startedAt == null || endedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, endedAt);
    }

    /**
     * Time the run spent past its timeout, {@link Duration#ZERO} when it
     * finished in time.
     */
    public Duration overshoot() {
        Duration over = duration().minus(timeout);
        return over.isNegative() ? Duration.ZERO : over;
    }

    public String errorMessage() {
        return error == null ? null : RetryExecutor.describe(error);
    }
}

package io.tradeloop.engine;

import io.tradeloop.model.PhaseStatus;

import java.time.Duration;
import java.time.Instant;

/**
 * One execution of a phase: {@code pending -> running -> success | failed}.
 * A terminal run is never restarted; recovery creates a new run.
 *
 * <p>The deadline is measured from {@link #start()}, and the recorded end is
 * the real one. Time past the deadline is reported by
 * {@link PhaseOutcome#overshoot()}.
 */
public final class PhaseRun {
    private final String name;
    private final Duration timeout;
    private PhaseStatus status = PhaseStatus.PENDING;
    private Instant startedAt;
    private Instant endedAt;
    private long deadlineNanos;

    public PhaseRun(String name, Duration timeout) {
        this.name = name;
        this.timeout = timeout;
    }

    public synchronized void start() {
        if (status != PhaseStatus.PENDING) {
            throw new IllegalStateException("Phase " + name + " cannot start from " + status.wireName());
        }
        status = PhaseStatus.RUNNING;
        startedAt = Instant.now();
        deadlineNanos = System.nanoTime() + timeout.toNanos();
    }

    public synchronized void succeed() {
        finish(PhaseStatus.SUCCESS);
    }

    public synchronized void fail() {
        finish(PhaseStatus.FAILED);
    }

    private void finish(PhaseStatus terminal) {
        if (status != PhaseStatus.RUNNING) {
            throw new IllegalStateException("Phase " + name + " cannot finish from " + status.wireName());
        }
        status = terminal;
        endedAt = Instant.now();
    }

    /**
     * {@link System#nanoTime()} value at which the run's time is up. Only
     * meaningful once started.
     */
    public synchronized long deadlineNanos() {
        if (startedAt == null) {
            throw new IllegalStateException("Phase " + name + " has not started");
        }
        return deadlineNanos;
    }

    public String name() {
        return name;
    }

    public Duration timeout() {
        return timeout;
    }

    public synchronized PhaseStatus status() {
        return status;
    }

    public synchronized Instant startedAt() {
        return startedAt;
    }

    public synchronized Instant endedAt() {
        return endedAt;
    }

    public synchronized Duration duration() {
        if (startedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, endedAt == null ? Instant.now() : endedAt);
    }
}

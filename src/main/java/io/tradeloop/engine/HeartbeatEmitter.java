package io.tradeloop.engine;

import io.tradeloop.model.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Background worker that writes a {@code heartbeat} event every interval
 * while a session runs.
 *
 * <p>Ticks are scheduled at a fixed rate from the start instant, so a run of
 * length T with interval I yields floor(T/I) heartbeats, give or take one.
 * A failed tick is logged and skipped; it never reaches the session.
 *
 * <p>An emitter is single use: {@link #start} may be called once.
 * {@link #stop()} is idempotent and joins the worker, except when invoked from
 * the worker itself, where it only signals.
 */
public final class HeartbeatEmitter implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(HeartbeatEmitter.class);

    private final SessionRecorder recorder;
    private final Object lock = new Object();
    private final AtomicLong ticks = new AtomicLong(0L);
    private final AtomicLong stopCalls = new AtomicLong(0L);
    private Thread worker;
    private boolean stopRequested;

    public HeartbeatEmitter(SessionRecorder recorder) {
        this.recorder = Objects.requireNonNull(recorder, "recorder");
    }

    public void start(Duration interval, Supplier<Metrics> metrics) {
        Objects.requireNonNull(metrics, "metrics");
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("heartbeat interval must be positive: " + interval);
        }
        long intervalNanos = interval.toNanos();
        synchronized (lock) {
            if (worker != null) {
                throw new IllegalStateException("heartbeat already started");
            }
            if (stopRequested) {
                return;
            }
            Thread thread = new Thread(() -> loop(intervalNanos, metrics),
                    "tradeloop-heartbeat-" + recorder.state().id());
            thread.setDaemon(true);
            worker = thread;
            thread.start();
        }
    }

    public void stop() {
        stopCalls.incrementAndGet();
        Thread thread;
        synchronized (lock) {
            stopRequested = true;
            lock.notifyAll();
            thread = worker;
        }
        if (thread == null || thread == Thread.currentThread()) {
            return;
        }
        boolean interrupted = false;
        while (thread.isAlive()) {
            try {
                thread.join();
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        synchronized (lock) {
            return worker != null && worker.isAlive() && !stopRequested;
        }
    }

    public long ticks() {
        return ticks.get();
    }

    public long stopCalls() {
        return stopCalls.get();
    }

    private void loop(long intervalNanos, Supplier<Metrics> metrics) {
        long origin = System.nanoTime();
        long tick = 1L;
        while (awaitTick(origin + tick * intervalNanos)) {
            emit(metrics);
            tick++;
        }
    }

    private boolean awaitTick(long dueNanos) {
        synchronized (lock) {
            while (!stopRequested) {
                long waitNanos = dueNanos - System.nanoTime();
                if (waitNanos <= 0L) {
                    return true;
                }
                try {
                    TimeUnit.NANOSECONDS.timedWait(lock, waitNanos);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            }
            return false;
        }
    }

    private void emit(Supplier<Metrics> metrics) {
        try {
            recorder.heartbeat(metrics.get());
            ticks.incrementAndGet();
        } catch (RuntimeException e) {
            log.warn("Heartbeat skipped for session {}: {}", recorder.state().id(), e.getMessage());
        }
    }
}

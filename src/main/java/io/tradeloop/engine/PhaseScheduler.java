package io.tradeloop.engine;

import io.tradeloop.model.EventLevel;
import io.tradeloop.model.PhaseResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one phase under its deadline and records the transition.
 *
 * <p>The work runs on a dedicated thread while the caller waits at most
 * {@code timeout}. At the deadline the context is cancelled and the thread
 * interrupted; the work is expected to notice and return. Exceptions become a
 * failed outcome. {@link Error}s are rethrown after {@code phase_end} is
 * written.
 */
public final class PhaseScheduler {
    private static final Logger log = LoggerFactory.getLogger(PhaseScheduler.class);

    private final SessionRecorder recorder;
    private final RetryExecutor retries;

    public PhaseScheduler(SessionRecorder recorder, RetryExecutor retries) {
        this.recorder = Objects.requireNonNull(recorder, "recorder");
        this.retries = Objects.requireNonNull(retries, "retries");
    }

    public PhaseOutcome runPhase(PhaseSpec spec) {
        return runPhase(spec.name(), spec.timeout(), spec.work());
    }

    public PhaseOutcome runPhase(String name, Duration timeout, PhaseWork work) {
        PhaseSpec spec = new PhaseSpec(name, timeout, work);
        SessionState state = recorder.state();
        PhaseRun run = new PhaseRun(spec.name(), spec.timeout());
        run.start();
        log.info("Phase {} started (timeout {} ms)", spec.name(), spec.timeout().toMillis());
        recorder.beginPhase(spec.name(), "Phase started: " + spec.name(),
                Map.of("timeout_seconds", seconds(spec.timeout())));

        PhaseContext context = new PhaseContext(spec.name(), spec.timeout(), run.deadlineNanos(), state, retries);
        ExecutorService executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "tradeloop-phase-" + spec.name());
            thread.setDaemon(true);
            return thread;
        });
        PhaseResult result = null;
        Throwable failure = null;
        Error fatal = null;
        try {
            Future<PhaseResult> future = executor.submit(() -> spec.work().run(context));
            try {
                long waitNanos = Math.max(0L, run.deadlineNanos() - System.nanoTime());
                result = future.get(waitNanos, TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                context.cancel();
                future.cancel(true);
                failure = new PhaseTimeoutException(spec.name(), spec.timeout());
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                if (cause instanceof Error) {
                    fatal = (Error) cause;
                }
                failure = cause;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                context.cancel();
                future.cancel(true);
                failure = e;
            }
        } finally {
            executor.shutdown();
        }

        if (failure == null) {
            run.succeed();
            state.markPhaseCompleted(spec.name());
        } else {
            run.fail();
        }
        recorder.refreshSummary();
        PhaseResult finalResult = failure == null && result == null ? PhaseResult.ok("") : result;
        PhaseOutcome outcome = PhaseOutcome.of(run, finalResult, failure);
        emitPhaseEnd(outcome);
        if (fatal != null) {
            throw fatal;
        }
        return outcome;
    }

    private void emitPhaseEnd(PhaseOutcome outcome) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("status", outcome.status().wireName());
        details.put("duration_seconds", seconds(outcome.duration()));
        if (!outcome.overshoot().isZero()) {
            details.put("overshoot_seconds", seconds(outcome.overshoot()));
            log.warn("Phase {} ran {} ms past its {} ms timeout", outcome.name(),
                    outcome.overshoot().toMillis(), outcome.timeout().toMillis());
        }
        if (outcome.succeeded()) {
            log.info("Phase {} succeeded in {} ms", outcome.name(), outcome.duration().toMillis());
            recorder.endPhase(outcome.name(), EventLevel.INFO, "Phase completed: " + outcome.name(), details);
            return;
        }
        details.put("error", outcome.errorMessage());
        details.put("timed_out", outcome.timedOut());
        log.warn("Phase {} failed after {} ms: {}", outcome.name(), outcome.duration().toMillis(), outcome.errorMessage());
        recorder.endPhase(outcome.name(), EventLevel.ERROR, "Phase failed: " + outcome.name(), details);
    }

    static double seconds(Duration duration) {
        return duration.toMillis() / 1000.0;
    }
}

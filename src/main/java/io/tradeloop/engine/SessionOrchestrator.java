package io.tradeloop.engine;

import io.tradeloop.config.SessionSettings;
import io.tradeloop.model.EventLevel;
import io.tradeloop.model.EventType;
import io.tradeloop.model.PhaseResult;
import io.tradeloop.model.RecoveryAttempt;
import io.tradeloop.model.RecoveryResult;
import io.tradeloop.model.SessionStatus;
import io.tradeloop.model.SessionSummary;
import io.tradeloop.store.EventSink;
import io.tradeloop.store.SummaryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Top-level driver of a session.
 *
 * <p>{@link #run(List)} executes the phases strictly in the given order on the
 * calling thread, with a heartbeat worker alongside. A failed phase gets one
 * round of recovery; if that is exhausted the remaining phases are skipped
 * and a {@code workflow_aborted} event lists every failure reason.
 *
 * <p>Whatever happens, including an {@link Error} escaping a phase, the
 * heartbeat is stopped once and the final summary is written once before
 * {@code run} returns or rethrows.
 */
public final class SessionOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(SessionOrchestrator.class);

    private final EventSink eventSink;
    private final SummaryStore summaryStore;
    private final SessionSettings settings;
    private final Sleeper sleeper;
    private volatile SessionState lastState;
    private volatile HeartbeatEmitter lastHeartbeat;

    public SessionOrchestrator(EventSink eventSink, SummaryStore summaryStore, SessionSettings settings) {
        this(eventSink, summaryStore, settings, Sleeper.SYSTEM);
    }

    public SessionOrchestrator(EventSink eventSink, SummaryStore summaryStore, SessionSettings settings, Sleeper sleeper) {
        this.eventSink = Objects.requireNonNull(eventSink, "eventSink");
        this.summaryStore = Objects.requireNonNull(summaryStore, "summaryStore");
        this.settings = settings == null ? SessionSettings.defaults() : settings;
        this.sleeper = sleeper == null ? Sleeper.SYSTEM : sleeper;
    }

    public SessionSummary run(List<PhaseSpec> phases) {
        List<PhaseSpec> pipeline = List.copyOf(Objects.requireNonNull(phases, "phases"));
        SessionState state = new SessionState(UUID.randomUUID().toString(), settings.initialCapital(), pipeline.size());
        SessionRecorder recorder = new SessionRecorder(eventSink, summaryStore, state);
        RetryExecutor retries = new RetryExecutor(recorder, sleeper);
        PhaseScheduler scheduler = new PhaseScheduler(recorder, retries);
        RecoveryManager recovery = new RecoveryManager(recorder, sleeper);
        HeartbeatEmitter heartbeat = new HeartbeatEmitter(recorder);
        lastState = state;
        lastHeartbeat = heartbeat;

        log.info("Session {} starting with {} phases", state.id(), pipeline.size());
        recorder.refreshSummary();
        recorder.emit(EventType.SESSION_START, null, EventLevel.INFO, "Session started", sessionStartDetails(pipeline));

        SessionStatus status = SessionStatus.ERROR;
        SessionSummary finalSummary;
        try (HeartbeatEmitter running = heartbeat) {
            running.start(settings.heartbeatInterval(), state::metrics);
            status = runPipeline(pipeline, recorder, scheduler, recovery);
        } catch (RuntimeException | Error e) {
            status = SessionStatus.ERROR;
            log.error("Session {} aborted by unexpected failure", state.id(), e);
            recorder.emit(EventType.ERROR, null, EventLevel.CRITICAL, "Unexpected failure: " + RetryExecutor.describe(e),
                    Map.of("exception", e.getClass().getName()));
            throw e;
        } finally {
            finalSummary = finish(recorder, status);
        }
        return finalSummary;
    }

    /**
     * State of the most recent {@link #run(List)}, or {@code null} before the
     * first run.
     */
    public SessionState lastState() {
        return lastState;
    }

    public HeartbeatEmitter lastHeartbeat() {
        return lastHeartbeat;
    }

    private SessionStatus runPipeline(
            List<PhaseSpec> pipeline,
            SessionRecorder recorder,
            PhaseScheduler scheduler,
            RecoveryManager recovery
    ) {
        for (int i = 0; i < pipeline.size(); i++) {
            PhaseSpec spec = pipeline.get(i);
            if (i > 0) {
                pauseAndCheck(recorder);
            }
            PhaseOutcome outcome = scheduler.runPhase(spec);
            if (outcome.succeeded()) {
                continue;
            }
            RecoveryResult recovered = recovery.attempt(
                    spec.name(),
                    outcome.error(),
                    () -> rerun(scheduler, spec),
                    settings.recoveryMaxAttempts(),
                    settings.recoveryBaseDelay(),
                    settings.recoveryMaxDelay()
            );
            if (recovered.success()) {
                continue;
            }
            abort(recorder, spec, outcome, recovered, pipeline.subList(i + 1, pipeline.size()));
            return SessionStatus.FAILED;
        }
        return SessionStatus.SUCCESS;
    }

    private static PhaseResult rerun(PhaseScheduler scheduler, PhaseSpec spec) throws Exception {
        PhaseOutcome outcome = scheduler.runPhase(spec);
        if (outcome.succeeded()) {
            return outcome.result();
        }
        Throwable error = outcome.error();
        if (error instanceof Exception) {
            throw (Exception) error;
        }
        throw new PhaseFailureException("Phase " + spec.name() + " failed", error);
    }

    private void abort(
            SessionRecorder recorder,
            PhaseSpec failed,
            PhaseOutcome outcome,
            RecoveryResult recovered,
            List<PhaseSpec> skipped
    ) {
        List<String> reasons = new ArrayList<>();
        reasons.add(failed.name() + ": " + outcome.errorMessage());
        for (RecoveryAttempt attempt : recovered.attempts()) {
            if (!attempt.succeeded()) {
                reasons.add(failed.name() + " recovery attempt " + attempt.attemptNumber() + ": " + attempt.error());
            }
        }
        if (!recovered.attempted()) {
            reasons.add(failed.name() + " recovery: " + recovered.message());
        }
        List<String> skippedNames = new ArrayList<>();
        for (PhaseSpec spec : skipped) {
            skippedNames.add(spec.name());
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("failed_phase", failed.name());
        details.put("reasons", reasons);
        details.put("skipped_phases", skippedNames);
        log.error("Session {} aborted at {}: {}", recorder.state().id(), failed.name(), reasons);
        recorder.emit(EventType.WORKFLOW_ABORTED, null, EventLevel.CRITICAL,
                "Workflow aborted: " + failed.name() + " could not be recovered", details);
    }

    private void pauseAndCheck(SessionRecorder recorder) {
        Duration pause = settings.pauseBetweenPhases();
        if (pause == null || pause.isZero() || pause.isNegative()) {
            return;
        }
        if (pause.compareTo(settings.maxPause()) > 0) {
            log.warn("Pause of {} ms exceeds max {} ms, capping", pause.toMillis(), settings.maxPause().toMillis());
            pause = settings.maxPause();
        }
        recorder.emit(EventType.PAUSE_START, null, EventLevel.INFO, "Pause before next phase",
                Map.of("pause_seconds", PhaseScheduler.seconds(pause)));
        try {
            sleeper.sleep(pause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Pause interrupted for session {}", recorder.state().id());
        }
        boolean eventLogHealthy = recorder.failedEventWrites() == 0L;
        boolean summaryReadable = recorder.summaryReadable();
        boolean healthy = eventLogHealthy && summaryReadable;
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("status", healthy ? "success" : "degraded");
        details.put("event_log_healthy", eventLogHealthy);
        details.put("summary_readable", summaryReadable);
        recorder.emit(EventType.PAUSE_END, null, healthy ? EventLevel.INFO : EventLevel.WARNING,
                healthy ? "Self-check passed" : "Self-check degraded", details);
    }

    private SessionSummary finish(SessionRecorder recorder, SessionStatus status) {
        SessionState state = recorder.state();
        state.finish(status);
        SessionSummary summary = recorder.refreshSummary();
        long dropped = recorder.failedEventWrites();
        if (dropped > 0L) {
            log.warn("Session {} finished with {} event log writes dropped", state.id(), dropped);
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("status", status.wireName());
        details.put("phases_completed", summary.phasesCompleted());
        details.put("runtime_secs", summary.runtimeSeconds());
        details.put("roi", summary.roi());
        recorder.emit(EventType.SESSION_END, null, status == SessionStatus.SUCCESS ? EventLevel.INFO : EventLevel.ERROR,
                "Session finished: " + status.wireName(), details);
        log.info("Session {} finished with status {} ({}/{} phases, roi {}%)", state.id(), status.wireName(),
                summary.phasesCompleted(), summary.phasesTotal(), String.format("%.2f", summary.roi()));
        return summary;
    }

    private static Map<String, Object> sessionStartDetails(List<PhaseSpec> pipeline) {
        List<String> names = new ArrayList<>();
        for (PhaseSpec spec : pipeline) {
            names.add(spec.name());
        }
        return Map.of("phases", names);
    }
}

package io.tradeloop.engine;

import io.tradeloop.model.EventLevel;
import io.tradeloop.model.EventType;
import io.tradeloop.model.PhaseResult;
import io.tradeloop.model.PhaseStatus;
import io.tradeloop.model.SessionEvent;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

final class PhaseSchedulerTest {

    @Test
    void successfulPhaseIsRecordedAndCounted() {
        Fixture f = new Fixture();

        PhaseOutcome outcome = f.scheduler.runPhase("data_phase", Duration.ofSeconds(5),
                ctx -> PhaseResult.ok("loaded", Map.of("records", 10)));

        Assertions.assertTrue(outcome.succeeded());
        Assertions.assertEquals(PhaseStatus.SUCCESS, outcome.status());
        Assertions.assertEquals("loaded", outcome.result().message());
        Assertions.assertNull(outcome.error());
        Assertions.assertEquals(List.of("data_phase"), f.state.phasesCompleted());
        Assertions.assertNull(f.state.activePhase());
        Assertions.assertEquals(List.of(EventType.PHASE_START, EventType.PHASE_END), f.sink.types());
        SessionEvent end = f.sink.ofType(EventType.PHASE_END).get(0);
        Assertions.assertEquals("data_phase", end.phase());
        Assertions.assertEquals("success", end.detail("status"));
        Assertions.assertEquals(1, f.store.writes().size());
        Assertions.assertEquals(1, f.store.writes().get(0).phasesCompleted());
    }

    @Test
    void failingWorkBecomesFailedOutcome() {
        Fixture f = new Fixture();

        PhaseOutcome outcome = f.scheduler.runPhase("strategy_phase", Duration.ofSeconds(5), ctx -> {
            throw new PhaseFailureException("no signal");
        });

        Assertions.assertFalse(outcome.succeeded());
        Assertions.assertEquals(PhaseStatus.FAILED, outcome.status());
        Assertions.assertFalse(outcome.timedOut());
        Assertions.assertEquals("no signal", outcome.errorMessage());
        Assertions.assertTrue(f.state.phasesCompleted().isEmpty());
        SessionEvent end = f.sink.ofType(EventType.PHASE_END).get(0);
        Assertions.assertEquals(EventLevel.ERROR, end.level());
        Assertions.assertEquals("failed", end.detail("status"));
        Assertions.assertEquals("no signal", end.detail("error"));
        Assertions.assertEquals(Boolean.FALSE, end.detail("timed_out"));
    }

    @Test
    void blockingWorkIsCutOffAtTheDeadline() {
        Fixture f = new Fixture();
        Duration timeout = Duration.ofMillis(150);
        long started = System.nanoTime();

        PhaseOutcome outcome = f.scheduler.runPhase("api_phase", timeout, ctx -> {
            Thread.sleep(10_000);
            return PhaseResult.ok("never");
        });

        long elapsedMs = (System.nanoTime() - started) / 1_000_000L;
        Assertions.assertTrue(outcome.timedOut());
        Assertions.assertEquals(PhaseStatus.FAILED, outcome.status());
        Assertions.assertTrue(outcome.overshoot().compareTo(Duration.ofMillis(500)) < 0, "overshoot " + outcome.overshoot());
        Assertions.assertTrue(elapsedMs < 2_000L, "scheduler waited " + elapsedMs + " ms");
        Assertions.assertTrue(outcome.errorMessage().contains("exceeded timeout"));
        Assertions.assertEquals(Boolean.TRUE, f.sink.ofType(EventType.PHASE_END).get(0).detail("timed_out"));
    }

    @Test
    void cooperativeWorkSeesCancellation() {
        Fixture f = new Fixture();

        PhaseOutcome outcome = f.scheduler.runPhase("data_phase", Duration.ofMillis(100), ctx -> {
            while (true) {
                ctx.pause(Duration.ofMillis(30));
            }
        });

        Assertions.assertTrue(outcome.timedOut());
        Assertions.assertTrue(f.state.phasesCompleted().isEmpty());
    }

    @Test
    void errorsEscapeAfterPhaseEndIsWritten() {
        Fixture f = new Fixture();

        AssertionError thrown = Assertions.assertThrows(AssertionError.class,
                () -> f.scheduler.runPhase("data_phase", Duration.ofSeconds(5), ctx -> {
                    throw new AssertionError("corrupted state");
                }));

        Assertions.assertEquals("corrupted state", thrown.getMessage());
        List<SessionEvent> ends = f.sink.ofType(EventType.PHASE_END);
        Assertions.assertEquals(1, ends.size());
        Assertions.assertEquals("failed", ends.get(0).detail("status"));
        Assertions.assertNull(f.state.activePhase());
    }

    @Test
    void heartbeatDuringPhaseIsTaggedWithIt() {
        Fixture f = new Fixture();
        SessionRecorder recorder = f.recorder;

        f.scheduler.runPhase("strategy_phase", Duration.ofSeconds(5), ctx -> {
            recorder.heartbeat(ctx.session().metrics());
            return PhaseResult.ok("done");
        });
        recorder.heartbeat(f.state.metrics());

        List<SessionEvent> beats = f.sink.ofType(EventType.HEARTBEAT);
        Assertions.assertEquals("strategy_phase", beats.get(0).phase());
        Assertions.assertNull(beats.get(1).phase());
    }

    @Test
    void invalidSpecIsRejected() {
        Fixture f = new Fixture();
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> f.scheduler.runPhase(" ", Duration.ofSeconds(1), ctx -> PhaseResult.ok("x")));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> f.scheduler.runPhase("p", Duration.ZERO, ctx -> PhaseResult.ok("x")));
        Assertions.assertTrue(f.sink.readAll().isEmpty());
    }

    private static final class Fixture {
        final RecordingEventSink sink = new RecordingEventSink();
        final RecordingSummaryStore store = new RecordingSummaryStore();
        final SessionState state = new SessionState("session-test", 10_000.0, 3);
        final SessionRecorder recorder = new SessionRecorder(sink, store, state);
        final PhaseScheduler scheduler = new PhaseScheduler(recorder, new RetryExecutor(recorder, new RecordingSleeper()));
    }
}

package io.tradeloop.engine;

import io.tradeloop.model.PhaseStatus;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;

final class PhaseRunTest {

    @Test
    void followsPendingRunningTerminal() {
        PhaseRun run = new PhaseRun("data_phase", Duration.ofSeconds(5));
        Assertions.assertEquals(PhaseStatus.PENDING, run.status());
        Assertions.assertNull(run.startedAt());

        run.start();
        Assertions.assertEquals(PhaseStatus.RUNNING, run.status());
        Assertions.assertNotNull(run.startedAt());

        run.succeed();
        Assertions.assertEquals(PhaseStatus.SUCCESS, run.status());
        Assertions.assertTrue(run.status().isTerminal());
        Assertions.assertFalse(run.endedAt().isBefore(run.startedAt()));
    }

    @Test
    void terminalRunCannotBeRestartedOrFinishedAgain() {
        PhaseRun run = new PhaseRun("data_phase", Duration.ofSeconds(5));
        Assertions.assertThrows(IllegalStateException.class, run::fail);

        run.start();
        run.fail();

        Assertions.assertThrows(IllegalStateException.class, run::start);
        Assertions.assertThrows(IllegalStateException.class, run::succeed);
        Assertions.assertEquals(PhaseStatus.FAILED, run.status());
    }

    @Test
    void lateFinishKeepsRealEndAndReportsOvershoot() throws Exception {
        PhaseRun run = new PhaseRun("slow", Duration.ofMillis(20));
        run.start();
        Thread.sleep(80);
        run.fail();

        Assertions.assertTrue(run.duration().compareTo(Duration.ofMillis(80)) >= 0, "duration " + run.duration());
        PhaseOutcome outcome = PhaseOutcome.of(run, null, new PhaseFailureException("late"));
        Assertions.assertTrue(outcome.overshoot().compareTo(Duration.ofMillis(60)) >= 0, "overshoot " + outcome.overshoot());
    }

    @Test
    void deadlineIsCountedFromStart() throws Exception {
        PhaseRun run = new PhaseRun("data_phase", Duration.ofSeconds(5));
        Assertions.assertThrows(IllegalStateException.class, run::deadlineNanos);

        long before = System.nanoTime();
        run.start();
        long after = System.nanoTime();

        long timeoutNanos = Duration.ofSeconds(5).toNanos();
        Assertions.assertTrue(run.deadlineNanos() - (before + timeoutNanos) >= 0L);
        Assertions.assertTrue((after + timeoutNanos) - run.deadlineNanos() >= 0L);
    }

    @Test
    void timelyFinishHasNoOvershoot() {
        PhaseRun run = new PhaseRun("fast", Duration.ofSeconds(5));
        run.start();
        run.succeed();

        Assertions.assertEquals(Duration.ZERO, PhaseOutcome.of(run, null, null).overshoot());
    }
}

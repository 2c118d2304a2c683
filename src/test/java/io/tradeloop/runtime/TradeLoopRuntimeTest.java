package io.tradeloop.runtime;

import io.tradeloop.config.SessionSettings;
import io.tradeloop.config.TradeLoopConfig;
import io.tradeloop.model.EventType;
import io.tradeloop.model.SessionEvent;
import io.tradeloop.model.SessionStatus;
import io.tradeloop.model.SessionSummary;
import io.tradeloop.sim.SimulatedPipeline;
import io.tradeloop.store.SessionLogValidator;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.stream.Stream;

final class TradeLoopRuntimeTest {

    @Test
    void simulatedSessionLeavesValidLogAndSummary() throws Exception {
        Path root = Files.createTempDirectory("tradeloop-test-runtime-");
        try {
            TradeLoopRuntime runtime = runtime(root);
            runtime.init();

            SessionSummary summary = runtime.runSimulated(new TradeLoopRuntime.SimulatedRun(
                    Duration.ofSeconds(30), Duration.ofMillis(50), Duration.ofMillis(120), null, 0));

            Assertions.assertEquals(SessionStatus.SUCCESS, summary.status());
            Assertions.assertEquals(1.5, summary.roi(), 1e-9);
            Assertions.assertTrue(Files.exists(runtime.config().eventsFile()));

            SessionSummary stored = runtime.summary().orElseThrow();
            Assertions.assertEquals(summary.sessionId(), stored.sessionId());
            Assertions.assertEquals(SessionStatus.SUCCESS, stored.status());
            Assertions.assertEquals(3, stored.phasesCompleted());

            List<SessionEvent> events = runtime.events(0, null);
            Assertions.assertEquals(EventType.SESSION_START, events.get(0).type());
            Assertions.assertEquals(EventType.SESSION_END, events.get(events.size() - 1).type());
            Assertions.assertFalse(runtime.events(0, "heartbeat").isEmpty());
            Assertions.assertEquals(1, runtime.events(1, null).size());
            Assertions.assertEquals(3, runtime.events(0, "PHASE_END").size());

            SessionLogValidator.Report report = runtime.validate();
            Assertions.assertTrue(report.passed(), report.toString());
            Assertions.assertEquals(report.totalEvents(), report.validEvents());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void recoveredFailureIsVisibleInTheLog() throws Exception {
        Path root = Files.createTempDirectory("tradeloop-test-runtime-recovery-");
        try {
            TradeLoopRuntime runtime = runtime(root);
            runtime.init();

            SessionSummary summary = runtime.runSimulated(new TradeLoopRuntime.SimulatedRun(
                    null, null, Duration.ZERO, SimulatedPipeline.STRATEGY_PHASE, 1));

            Assertions.assertEquals(SessionStatus.SUCCESS, summary.status());
            List<SessionEvent> attempts = runtime.events(0, EventType.RECOVERY_ATTEMPT);
            Assertions.assertEquals(1, attempts.size());
            Assertions.assertEquals(SimulatedPipeline.STRATEGY_PHASE, attempts.get(0).phase());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void unrecoverableFailureEndsFailed() throws Exception {
        Path root = Files.createTempDirectory("tradeloop-test-runtime-abort-");
        try {
            TradeLoopRuntime runtime = runtime(root);
            runtime.init();

            SessionSummary summary = runtime.runSimulated(new TradeLoopRuntime.SimulatedRun(
                    null, null, Duration.ZERO, SimulatedPipeline.DATA_PHASE, 10));

            Assertions.assertEquals(SessionStatus.FAILED, summary.status());
            Assertions.assertEquals(0, summary.phasesCompleted());
            Assertions.assertEquals(1, runtime.events(0, EventType.WORKFLOW_ABORTED).size());
            Assertions.assertTrue(runtime.validate().passed());
        } finally {
            deleteRecursively(root);
        }
    }

    private static TradeLoopRuntime runtime(Path root) {
        SessionSettings settings = SessionSettings.defaults()
                .withHeartbeatInterval(Duration.ofMillis(50))
                .withRecovery(2, Duration.ofMillis(5), Duration.ofMillis(20));
        return new TradeLoopRuntime(TradeLoopConfig.fromRoot(root.toString()), settings);
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}

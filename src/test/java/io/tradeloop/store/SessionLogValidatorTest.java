package io.tradeloop.store;

import io.tradeloop.model.EventLevel;
import io.tradeloop.model.EventType;
import io.tradeloop.model.SessionEvent;
import io.tradeloop.model.SessionStatus;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

final class SessionLogValidatorTest {

    @Test
    void wellFormedFilesPass() throws Exception {
        Path root = Files.createTempDirectory("tradeloop-test-validate-");
        try {
            Path events = root.resolve("events.jsonl");
            Path summary = root.resolve("summary.json");
            JsonlEventSink sink = new JsonlEventSink(events);
            sink.append(SessionEvent.of("s-1", EventType.SESSION_START, null, EventLevel.INFO, "Session started", null));
            sink.append(SessionEvent.of("s-1", EventType.SESSION_END, null, EventLevel.INFO, "Session finished", null));
            new JsonSummaryStore(summary).write(JsonSummaryStoreTest.summary(SessionStatus.SUCCESS, 3, 10_150.0));

            SessionLogValidator.Report report = SessionLogValidator.validate(events, summary);

            Assertions.assertTrue(report.passed());
            Assertions.assertEquals(2, report.validEvents());
            Assertions.assertEquals(2, report.totalEvents());
            Assertions.assertTrue(report.summaryErrors().isEmpty());
        } finally {
            JsonlEventSinkTest.deleteRecursively(root);
        }
    }

    @Test
    void badEventLinesAreReportedByLineNumber() throws Exception {
        Path root = Files.createTempDirectory("tradeloop-test-validate-events-");
        try {
            Path events = root.resolve("events.jsonl");
            JsonlEventSink sink = new JsonlEventSink(events);
            sink.append(SessionEvent.of("s-1", EventType.SESSION_START, null, EventLevel.INFO, "ok", null));
            Files.writeString(events, String.join("\n",
                    "not json",
                    "{\"timestamp\":\"2026-01-05T09:00:00Z\",\"sessionId\":\"s-1\",\"type\":\"heartbeat\",\"level\":\"debug\"}",
                    "{\"timestamp\":\"yesterday\",\"sessionId\":\"s-1\",\"type\":\"heartbeat\",\"level\":\"debug\",\"message\":\"x\"}",
                    "{\"timestamp\":\"2026-01-05T09:00:00Z\",\"sessionId\":\"s-1\",\"type\":\"heartbeat\",\"level\":\"loud\",\"message\":\"x\"}",
                    "{\"timestamp\":\"2026-01-05T09:00:00Z\",\"sessionId\":\"s-1\",\"type\":\"party\",\"level\":\"info\",\"message\":\"x\"}",
                    ""
            ), StandardCharsets.UTF_8, StandardOpenOption.APPEND);

            SessionLogValidator.EventCheck check = SessionLogValidator.validateEvents(events);

            Assertions.assertEquals(6, check.total());
            Assertions.assertEquals(1, check.valid());
            Assertions.assertEquals(List.of(
                    "Line 2: invalid JSON",
                    "Line 3: missing field: message",
                    "Line 4: invalid timestamp: yesterday",
                    "Line 5: Unknown event level: loud",
                    "Line 6: unknown event type: party"
            ), check.errors());
        } finally {
            JsonlEventSinkTest.deleteRecursively(root);
        }
    }

    @Test
    void summaryProblemsAreListed() throws Exception {
        Path root = Files.createTempDirectory("tradeloop-test-validate-summary-");
        try {
            Path summary = root.resolve("summary.json");
            Files.writeString(summary,
                    "{\"session_id\":\"s-1\",\"status\":\"paused\",\"phases_completed\":-1,\"initial_capital\":\"lots\"}",
                    StandardCharsets.UTF_8);

            List<String> errors = SessionLogValidator.validateSummary(summary);

            Assertions.assertTrue(errors.contains("missing field: current_equity"), errors.toString());
            Assertions.assertTrue(errors.contains("phases_completed must be a non-negative integer"), errors.toString());
            Assertions.assertTrue(errors.contains("initial_capital must be numeric"), errors.toString());
            Assertions.assertEquals(4, errors.size(), errors.toString());
        } finally {
            JsonlEventSinkTest.deleteRecursively(root);
        }
    }

    @Test
    void missingFilesFailValidation() throws Exception {
        Path root = Files.createTempDirectory("tradeloop-test-validate-missing-");
        try {
            SessionLogValidator.Report report = SessionLogValidator.validate(
                    root.resolve("events.jsonl"), root.resolve("summary.json"));

            Assertions.assertFalse(report.passed());
            Assertions.assertFalse(report.summaryValid());
            Assertions.assertEquals(1, report.eventErrors().size());
        } finally {
            JsonlEventSinkTest.deleteRecursively(root);
        }
    }
}

package io.tradeloop.store;

import com.fasterxml.jackson.databind.JsonNode;
import io.tradeloop.model.EventLevel;
import io.tradeloop.model.EventType;
import io.tradeloop.model.SessionStatus;
import io.tradeloop.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Offline checker for an event log and summary file, used by the
 * {@code validate} command and by external tooling.
 */
public final class SessionLogValidator {
    private static final List<String> REQUIRED_EVENT_FIELDS = List.of("timestamp", "sessionId", "type", "level", "message");
    private static final List<String> REQUIRED_SUMMARY_FIELDS = List.of(
            "session_id", "status", "phases_completed", "initial_capital", "current_equity"
    );

    private SessionLogValidator() {
    }

    public static Report validate(Path eventsFile, Path summaryFile) {
        EventCheck events = validateEvents(eventsFile);
        List<String> summaryErrors = validateSummary(summaryFile);
        return new Report(events.valid(), events.total(), events.errors(), summaryErrors.isEmpty(), summaryErrors);
    }

    static EventCheck validateEvents(Path eventsFile) {
        if (eventsFile == null || !Files.exists(eventsFile)) {
            return new EventCheck(0, 0, List.of("Events file not found: " + eventsFile));
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(eventsFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            return new EventCheck(0, 0, List.of("Events file unreadable: " + e.getMessage()));
        }
        int valid = 0;
        int total = 0;
        List<String> errors = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line == null || line.isBlank()) {
                continue;
            }
            total++;
            int lineNumber = i + 1;
            JsonNode node;
            try {
                node = Jsons.mapper().readTree(line);
            } catch (IOException e) {
                errors.add("Line " + lineNumber + ": invalid JSON");
                continue;
            }
            String problem = eventProblem(node);
            if (problem == null) {
                valid++;
            } else {
                errors.add("Line " + lineNumber + ": " + problem);
            }
        }
        return new EventCheck(valid, total, errors);
    }

    static List<String> validateSummary(Path summaryFile) {
        if (summaryFile == null || !Files.exists(summaryFile)) {
            return List.of("Summary file not found: " + summaryFile);
        }
        JsonNode node;
        try {
            node = Jsons.mapper().readTree(summaryFile.toFile());
        } catch (IOException e) {
            return List.of("Invalid JSON: " + e.getMessage());
        }
        List<String> errors = new ArrayList<>();
        if (node == null || !node.isObject()) {
            errors.add("summary is not a JSON object");
            return errors;
        }
        for (String field : REQUIRED_SUMMARY_FIELDS) {
            if (!node.hasNonNull(field)) {
                errors.add("missing field: " + field);
            }
        }
        if (node.hasNonNull("status")) {
            try {
                SessionStatus.fromString(node.get("status").asText());
            } catch (IllegalArgumentException e) {
                errors.add(e.getMessage());
            }
        }
        if (node.hasNonNull("phases_completed") && node.get("phases_completed").asInt(-1) < 0) {
            errors.add("phases_completed must be a non-negative integer");
        }
        for (String numeric : List.of("initial_capital", "current_equity")) {
            if (node.hasNonNull(numeric) && !node.get(numeric).isNumber()) {
                errors.add(numeric + " must be numeric");
            }
        }
        for (String timestamp : List.of("started_at", "ended_at", "last_updated")) {
            if (node.hasNonNull(timestamp) && !isInstant(node.get(timestamp).asText())) {
                errors.add("invalid timestamp in " + timestamp);
            }
        }
        return errors;
    }

    private static String eventProblem(JsonNode node) {
        if (node == null || !node.isObject()) {
            return "event is not a JSON object";
        }
        for (String field : REQUIRED_EVENT_FIELDS) {
            if (!node.hasNonNull(field)) {
                return "missing field: " + field;
            }
        }
        if (!isInstant(node.get("timestamp").asText())) {
            return "invalid timestamp: " + node.get("timestamp").asText();
        }
        try {
            EventLevel.fromString(node.get("level").asText());
        } catch (IllegalArgumentException e) {
            return e.getMessage();
        }
        if (!EventType.KNOWN.contains(node.get("type").asText())) {
            return "unknown event type: " + node.get("type").asText();
        }
        if (node.has("metrics") && !node.get("metrics").isNull() && !node.get("metrics").isObject()) {
            return "metrics must be an object";
        }
        if (node.has("details") && !node.get("details").isNull() && !node.get("details").isObject()) {
            return "details must be an object";
        }
        return null;
    }

    private static boolean isInstant(String raw) {
        try {
            Instant.parse(raw);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }

    record EventCheck(int valid, int total, List<String> errors) {
    }

    public record Report(
            int validEvents,
            int totalEvents,
            List<String> eventErrors,
            boolean summaryValid,
            List<String> summaryErrors
    ) {
        public boolean passed() {
            return eventErrors.isEmpty() && summaryValid;
        }
    }
}

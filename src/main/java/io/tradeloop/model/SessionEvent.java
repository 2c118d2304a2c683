package io.tradeloop.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One immutable line of the session event log.
 *
 * <p>{@code phase}, {@code metrics} and {@code details} are optional and are
 * omitted from the JSON line when absent.
 */
@JsonPropertyOrder({"timestamp", "sessionId", "type", "phase", "level", "message", "metrics", "details"})
public record SessionEvent(
        Instant timestamp,
        String sessionId,
        String type,
        String phase,
        EventLevel level,
        String message,
        Metrics metrics,
        Map<String, Object> details
) {
    public SessionEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(type, "type");
        level = level == null ? EventLevel.INFO : level;
        message = message == null ? "" : message;
        details = details == null || details.isEmpty()
                ? null
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static SessionEvent of(
            String sessionId,
            String type,
            String phase,
            EventLevel level,
            String message,
            Map<String, Object> details
    ) {
        return new SessionEvent(Instant.now(), sessionId, type, phase, level, message, null, details);
    }

    public static SessionEvent heartbeat(String sessionId, String phase, Metrics metrics) {
        return new SessionEvent(Instant.now(), sessionId, EventType.HEARTBEAT, phase, EventLevel.DEBUG, "Heartbeat", metrics, null);
    }

    public Object detail(String key) {
        return details == null ? null : details.get(key);
    }
}

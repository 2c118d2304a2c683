package io.tradeloop.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Opaque value returned by phase work. The engine only checks whether work
 * returned or threw; the payload is passed through untouched.
 */
public record PhaseResult(String message, Map<String, Object> data) {
    public PhaseResult {
        message = message == null ? "" : message;
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public static PhaseResult ok(String message) {
        return new PhaseResult(message, Map.of());
    }

    public static PhaseResult ok(String message, Map<String, Object> data) {
        return new PhaseResult(message, data);
    }
}

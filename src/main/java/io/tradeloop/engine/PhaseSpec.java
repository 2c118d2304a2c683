package io.tradeloop.engine;

import java.time.Duration;
import java.util.Objects;

public record PhaseSpec(String name, Duration timeout, PhaseWork work) {
    public PhaseSpec {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("phase name cannot be empty");
        }
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("phase timeout must be positive: " + name);
        }
        Objects.requireNonNull(work, "work");
        name = name.trim();
    }
}

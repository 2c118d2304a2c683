package io.tradeloop.engine;

import java.time.Duration;

/**
 * Capped exponential backoff: {@code min(base * 2^(attempt-1), max)}.
 */
public final class Backoff {
    private Backoff() {
    }

    public static Duration delay(int attempt, Duration baseDelay, Duration maxDelay) {
        long baseMs = Math.max(0L, baseDelay.toMillis());
        long maxMs = Math.max(baseMs, maxDelay.toMillis());
        long backoff = baseMs;
        for (int i = 1; i < attempt; i++) {
            if (backoff > maxMs - backoff) {
                backoff = maxMs;
                break;
            }
            backoff *= 2L;
        }
        return Duration.ofMillis(Math.min(backoff, maxMs));
    }
}

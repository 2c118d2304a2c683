package io.tradeloop.model;

import java.util.List;

/**
 * Audit trail of one recovery invocation: every attempt with its delay and
 * outcome, plus the final verdict.
 */
public record RecoveryResult(
        boolean attempted,
        boolean success,
        String message,
        String originalError,
        List<RecoveryAttempt> attempts
) {
    public RecoveryResult {
        attempts = attempts == null ? List.of() : List.copyOf(attempts);
    }

    public static RecoveryResult notAttempted(String message) {
        return new RecoveryResult(false, false, message, null, List.of());
    }
}

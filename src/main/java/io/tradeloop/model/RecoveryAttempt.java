package io.tradeloop.model;

import java.time.Duration;

public record RecoveryAttempt(
        int attemptNumber,
        Duration delayBeforeAttempt,
        Status status,
        String error,
        PhaseResult result
) {
    public enum Status {
        SUCCESS,
        ERROR
    }

    public static RecoveryAttempt success(int attemptNumber, Duration delay, PhaseResult result) {
        return new RecoveryAttempt(attemptNumber, delay, Status.SUCCESS, null, result);
    }

    public static RecoveryAttempt error(int attemptNumber, Duration delay, String error) {
        return new RecoveryAttempt(attemptNumber, delay, Status.ERROR, error, null);
    }

    public boolean succeeded() {
        return status == Status.SUCCESS;
    }
}

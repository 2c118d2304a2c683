package io.tradeloop.engine;

import java.time.Duration;

public record RetryOptions(
        int maxRetries,
        Duration baseDelay,
        Duration maxDelay,
        String operationName
) {
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(1);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(30);

    public RetryOptions {
        maxRetries = Math.max(1, maxRetries);
        baseDelay = baseDelay == null || baseDelay.isNegative() ? DEFAULT_BASE_DELAY : baseDelay;
        maxDelay = maxDelay == null || maxDelay.compareTo(baseDelay) < 0 ? baseDelay : maxDelay;
        operationName = operationName == null || operationName.isBlank() ? "operation" : operationName.trim();
    }

    public static RetryOptions defaults(String operationName) {
        return new RetryOptions(DEFAULT_MAX_RETRIES, DEFAULT_BASE_DELAY, DEFAULT_MAX_DELAY, operationName);
    }

    public RetryOptions withMaxRetries(int value) {
        return new RetryOptions(value, baseDelay, maxDelay, operationName);
    }

    public RetryOptions withBaseDelay(Duration value) {
        return new RetryOptions(maxRetries, value, maxDelay, operationName);
    }

    public RetryOptions withMaxDelay(Duration value) {
        return new RetryOptions(maxRetries, baseDelay, value, operationName);
    }
}

package io.tradeloop.engine;

import java.time.Duration;

public class PhaseTimeoutException extends Exception {
    private final String phase;
    private final Duration timeout;

    public PhaseTimeoutException(String phase, Duration timeout) {
        super("Phase " + phase + " exceeded timeout of " + timeout.toMillis() / 1000.0 + "s");
        this.phase = phase;
        this.timeout = timeout;
    }

    public String phase() {
        return phase;
    }

    public Duration timeout() {
        return timeout;
    }
}

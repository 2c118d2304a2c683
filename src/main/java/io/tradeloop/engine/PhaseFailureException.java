package io.tradeloop.engine;

/**
 * Business failure reported by phase work, as opposed to a timeout or an
 * infrastructure error.
 */
public class PhaseFailureException extends Exception {
    public PhaseFailureException(String message) {
        super(message);
    }

    public PhaseFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}

package io.tradeloop.engine;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Handle passed to {@link PhaseWork}: the phase deadline, the shared session
 * state, and the operation-level retry helper.
 */
public final class PhaseContext {
    private final String phase;
    private final Duration timeout;
    private final long deadlineNanos;
    private final SessionState session;
    private final RetryExecutor retries;
    private volatile boolean cancelled;

    PhaseContext(String phase, Duration timeout, long deadlineNanos, SessionState session, RetryExecutor retries) {
        this.phase = phase;
        this.timeout = timeout;
        this.deadlineNanos = deadlineNanos;
        this.session = session;
        this.retries = retries;
    }

    public String phase() {
        return phase;
    }

    public Duration timeout() {
        return timeout;
    }

    public SessionState session() {
        return session;
    }

    public RetryExecutor retries() {
        return retries;
    }

    public <T> T retry(String operationName, Callable<T> operation) throws Exception {
        return retry(operation, RetryOptions.defaults(operationName));
    }

    public <T> T retry(Callable<T> operation, RetryOptions options) throws Exception {
        return retries.run(operation, options, phase);
    }

    public Duration remaining() {
        long left = deadlineNanos - System.nanoTime();
        return left <= 0L ? Duration.ZERO : Duration.ofNanos(left);
    }

    public boolean isCancelled() {
        return cancelled || Thread.currentThread().isInterrupted() || System.nanoTime() - deadlineNanos >= 0L;
    }

    public void checkDeadline() throws PhaseTimeoutException {
        if (isCancelled()) {
            throw new PhaseTimeoutException(phase, timeout);
        }
    }

    /**
     * Sleeps for {@code duration} or until the deadline, whichever comes
     * first, then re-checks the deadline.
     */
    public void pause(Duration duration) throws PhaseTimeoutException, InterruptedException {
        checkDeadline();
        long millis = Math.min(duration.toMillis(), remaining().toMillis());
        if (millis > 0L) {
            Thread.sleep(millis);
        }
        checkDeadline();
    }

    void cancel() {
        cancelled = true;
    }
}

package io.tradeloop.engine;

import io.tradeloop.model.Metrics;
import io.tradeloop.model.SessionStatus;
import io.tradeloop.model.SessionSummary;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Live state of one session, shared between the thread running phases and
 * the heartbeat thread. Every accessor holds the instance monitor, so a
 * {@link #metrics()} snapshot is never torn.
 */
public final class SessionState {
    private final String id;
    private final Instant startedAt;
    private final double initialCapital;
    private final int phasesTotal;
    private final List<String> phasesCompleted = new ArrayList<>();
    private Instant endedAt;
    private SessionStatus status = SessionStatus.RUNNING;
    private double currentEquity;
    private int trades;
    private int wins;
    private int losses;
    private String activePhase;
    private String lastPhase;

    public SessionState(String id, double initialCapital, int phasesTotal) {
        this.id = Objects.requireNonNull(id, "id");
        this.startedAt = Instant.now();
        this.initialCapital = initialCapital;
        this.currentEquity = initialCapital;
        this.phasesTotal = Math.max(0, phasesTotal);
    }

    public String id() {
        return id;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public double initialCapital() {
        return initialCapital;
    }

    public synchronized Instant endedAt() {
        return endedAt;
    }

    public synchronized SessionStatus status() {
        return status;
    }

    public synchronized double currentEquity() {
        return currentEquity;
    }

    public synchronized void updateEquity(double equity) {
        this.currentEquity = equity;
    }

    /**
     * Books a closed trade: equity moves by {@code pnl}, a positive result
     * counts as a win and anything else as a loss.
     */
    public synchronized void recordTrade(double pnl) {
        currentEquity += pnl;
        trades++;
        if (pnl > 0.0) {
            wins++;
        } else {
            losses++;
        }
    }

    public synchronized Metrics metrics() {
        return new Metrics(currentEquity, currentEquity - initialCapital, trades, wins, losses);
    }

    public synchronized String activePhase() {
        return activePhase;
    }

    synchronized void enterPhase(String phase) {
        this.activePhase = phase;
        this.lastPhase = phase;
    }

    synchronized void leavePhase() {
        this.activePhase = null;
    }

    synchronized void markPhaseCompleted(String phase) {
        phasesCompleted.add(phase);
    }

    public synchronized List<String> phasesCompleted() {
        return List.copyOf(phasesCompleted);
    }

    synchronized void finish(SessionStatus finalStatus) {
        if (status.isTerminal()) {
            throw new IllegalStateException("Session " + id + " already finished as " + status.wireName());
        }
        this.status = finalStatus;
        this.endedAt = Instant.now();
        this.activePhase = null;
    }

    public synchronized SessionSummary summary() {
        Instant now = Instant.now();
        Instant end = endedAt == null ? now : endedAt;
        double runtimeSeconds = Duration.between(startedAt, end).toMillis() / 1000.0;
        return new SessionSummary(
                id,
                status,
                startedAt,
                endedAt,
                runtimeSeconds,
                phasesCompleted.size(),
                phasesTotal,
                initialCapital,
                currentEquity,
                new SessionSummary.Totals(trades, wins, losses),
                SessionSummary.roi(initialCapital, currentEquity),
                lastPhase,
                now
        );
    }
}

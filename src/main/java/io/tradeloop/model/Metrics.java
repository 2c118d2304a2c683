package io.tradeloop.model;

/**
 * Point-in-time trading metrics carried by heartbeat events.
 */
public record Metrics(
        double equity,
        double pnl,
        int trades,
        int wins,
        int losses
) {
    public static Metrics empty(double equity) {
        return new Metrics(equity, 0.0, 0, 0, 0);
    }
}

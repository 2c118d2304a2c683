package io.tradeloop.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;

/**
 * Current-state record of a session, overwritten on every phase transition
 * and once more when the session finishes.
 */
@JsonPropertyOrder({
        "session_id", "status", "started_at", "ended_at", "runtime_secs", "phases_completed",
        "phases_total", "initial_capital", "current_equity", "totals", "roi", "last_phase", "last_updated"
})
public record SessionSummary(
        @JsonProperty("session_id") String sessionId,
        @JsonProperty("status") SessionStatus status,
        @JsonProperty("started_at") Instant startedAt,
        @JsonProperty("ended_at") Instant endedAt,
        @JsonProperty("runtime_secs") double runtimeSeconds,
        @JsonProperty("phases_completed") int phasesCompleted,
        @JsonProperty("phases_total") int phasesTotal,
        @JsonProperty("initial_capital") double initialCapital,
        @JsonProperty("current_equity") double currentEquity,
        @JsonProperty("totals") Totals totals,
        @JsonProperty("roi") double roi,
        @JsonProperty("last_phase") String lastPhase,
        @JsonProperty("last_updated") Instant lastUpdated
) {
    public SessionSummary {
        totals = totals == null ? new Totals(0, 0, 0) : totals;
    }

    public int trades() {
        return totals.trades();
    }

    public int wins() {
        return totals.wins();
    }

    public int losses() {
        return totals.losses();
    }

    public static double roi(double initialCapital, double currentEquity) {
        if (initialCapital <= 0.0) {
            return 0.0;
        }
        return ((currentEquity - initialCapital) / initialCapital) * 100.0;
    }

    public record Totals(
            @JsonProperty("trades") int trades,
            @JsonProperty("wins") int wins,
            @JsonProperty("losses") int losses
    ) {
    }
}

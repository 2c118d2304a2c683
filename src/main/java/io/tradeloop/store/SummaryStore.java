package io.tradeloop.store;

import io.tradeloop.model.SessionSummary;

import java.util.Optional;

/**
 * Holds the single current summary of a session. Each write replaces the
 * previous record as a whole; readers see either the old or the new one.
 */
public interface SummaryStore {
    void write(SessionSummary summary);

    Optional<SessionSummary> read();
}

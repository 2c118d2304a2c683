package io.tradeloop.engine;

import io.tradeloop.model.SessionSummary;
import io.tradeloop.store.SummaryStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

final class RecordingSummaryStore implements SummaryStore {
    private final List<SessionSummary> writes = new ArrayList<>();

    @Override
    public synchronized void write(SessionSummary summary) {
        writes.add(summary);
    }

    @Override
    public synchronized Optional<SessionSummary> read() {
        return writes.isEmpty() ? Optional.empty() : Optional.of(writes.get(writes.size() - 1));
    }

    synchronized List<SessionSummary> writes() {
        return List.copyOf(writes);
    }

    synchronized long terminalWrites() {
        return writes.stream().filter(s -> s.status().isTerminal()).count();
    }
}

package io.tradeloop.store;

import io.tradeloop.model.SessionEvent;

import java.io.IOException;
import java.util.List;

/**
 * Append-only session event log.
 *
 * <p>{@link #append(SessionEvent)} is best-effort: implementations never throw
 * from it. A failed write is reported on the SLF4J channel and counted in
 * {@link #failedWrites()}. Reads exist for tooling only; the orchestrator
 * never makes decisions from them.
 */
public interface EventSink {
    void append(SessionEvent event);

    List<SessionEvent> readAll() throws IOException;

    default List<SessionEvent> readTail(int count) throws IOException {
        List<SessionEvent> all = readAll();
        if (count <= 0 || count >= all.size()) {
            return all;
        }
        return List.copyOf(all.subList(all.size() - count, all.size()));
    }

    long failedWrites();
}

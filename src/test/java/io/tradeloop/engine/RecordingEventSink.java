package io.tradeloop.engine;

import io.tradeloop.model.SessionEvent;
import io.tradeloop.store.EventSink;

import java.util.ArrayList;
import java.util.List;

final class RecordingEventSink implements EventSink {
    private final List<SessionEvent> events = new ArrayList<>();
    private long failedWrites;
    private boolean failing;

    @Override
    public synchronized void append(SessionEvent event) {
        if (failing) {
            failedWrites++;
            throw new IllegalStateException("sink offline");
        }
        events.add(event);
    }

    @Override
    public synchronized List<SessionEvent> readAll() {
        return List.copyOf(events);
    }

    @Override
    public synchronized long failedWrites() {
        return failedWrites;
    }

    synchronized void failing(boolean value) {
        this.failing = value;
    }

    synchronized List<SessionEvent> ofType(String type) {
        List<SessionEvent> out = new ArrayList<>();
        for (SessionEvent event : events) {
            if (type.equals(event.type())) {
                out.add(event);
            }
        }
        return out;
    }

    synchronized List<String> types() {
        List<String> out = new ArrayList<>();
        for (SessionEvent event : events) {
            out.add(event.type());
        }
        return out;
    }
}

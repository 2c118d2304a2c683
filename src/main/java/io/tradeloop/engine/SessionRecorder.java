package io.tradeloop.engine;

import io.tradeloop.model.EventLevel;
import io.tradeloop.model.EventType;
import io.tradeloop.model.Metrics;
import io.tradeloop.model.SessionEvent;
import io.tradeloop.model.SessionSummary;
import io.tradeloop.store.EventSink;
import io.tradeloop.store.SummaryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Session-bound front for the event log and the summary store.
 *
 * <p>Events are stamped and appended under one monitor, so timestamps in the
 * log never go backwards, and a heartbeat can never be tagged with a phase
 * whose {@code phase_end} is already written. This is also the one place
 * where storage failures are caught: no caller can be aborted by a logging
 * problem.
 */
public final class SessionRecorder {
    private static final Logger log = LoggerFactory.getLogger(SessionRecorder.class);

    private final EventSink eventSink;
    private final SummaryStore summaryStore;
    private final SessionState state;

    public SessionRecorder(EventSink eventSink, SummaryStore summaryStore, SessionState state) {
        this.eventSink = eventSink;
        this.summaryStore = summaryStore;
        this.state = state;
    }

    public SessionState state() {
        return state;
    }

    public synchronized void emit(String type, String phase, EventLevel level, String message, Map<String, Object> details) {
        append(SessionEvent.of(state.id(), type, phase, level, message, details));
    }

    /**
     * Emits an event tagged with whichever phase is active right now.
     */
    public synchronized void emitInActivePhase(String type, EventLevel level, String message, Map<String, Object> details) {
        emit(type, state.activePhase(), level, message, details);
    }

    public synchronized void heartbeat(Metrics metrics) {
        append(SessionEvent.heartbeat(state.id(), state.activePhase(), metrics));
    }

    synchronized void beginPhase(String phase, String message, Map<String, Object> details) {
        state.enterPhase(phase);
        emit(EventType.PHASE_START, phase, EventLevel.INFO, message, details);
    }

    synchronized void endPhase(String phase, EventLevel level, String message, Map<String, Object> details) {
        state.leavePhase();
        emit(EventType.PHASE_END, phase, level, message, details);
    }

    public SessionSummary refreshSummary() {
        SessionSummary summary = state.summary();
        try {
            summaryStore.write(summary);
        } catch (RuntimeException e) {
            log.warn("Summary store rejected update for session {}: {}", state.id(), e.getMessage());
        }
        return summary;
    }

    public long failedEventWrites() {
        return eventSink.failedWrites();
    }

    public boolean summaryReadable() {
        try {
            return summaryStore.read().isPresent();
        } catch (RuntimeException e) {
            log.warn("Summary store read failed for session {}: {}", state.id(), e.getMessage());
            return false;
        }
    }

    private void append(SessionEvent event) {
        try {
            eventSink.append(event);
        } catch (RuntimeException e) {
            log.warn("Event sink rejected {} event for session {}: {}", event.type(), state.id(), e.getMessage());
        }
    }
}

package io.tradeloop.model;

import java.util.Set;

public final class EventType {
    public static final String SESSION_START = "session_start";
    public static final String SESSION_END = "session_end";
    public static final String PHASE_START = "phase_start";
    public static final String PHASE_END = "phase_end";
    public static final String HEARTBEAT = "heartbeat";
    public static final String AUTOCORRECT_ATTEMPT = "autocorrect_attempt";
    public static final String RECOVERY_ATTEMPT = "recovery_attempt";
    public static final String WORKFLOW_ABORTED = "workflow_aborted";
    public static final String PAUSE_START = "pause_start";
    public static final String PAUSE_END = "pause_end";
    public static final String ERROR = "error";

    public static final Set<String> KNOWN = Set.of(
            SESSION_START,
            SESSION_END,
            PHASE_START,
            PHASE_END,
            HEARTBEAT,
            AUTOCORRECT_ATTEMPT,
            RECOVERY_ATTEMPT,
            WORKFLOW_ABORTED,
            PAUSE_START,
            PAUSE_END,
            ERROR
    );

    private EventType() {
    }
}

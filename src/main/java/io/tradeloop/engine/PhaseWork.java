package io.tradeloop.engine;

import io.tradeloop.model.PhaseResult;

/**
 * Body of a phase. Implementations are expected to poll
 * {@link PhaseContext#checkDeadline()} or {@link PhaseContext#isCancelled()}
 * while they run; the scheduler stops waiting at the deadline but never kills
 * the work.
 */
@FunctionalInterface
public interface PhaseWork {
    PhaseResult run(PhaseContext context) throws Exception;
}

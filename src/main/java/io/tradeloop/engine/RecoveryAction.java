package io.tradeloop.engine;

import io.tradeloop.model.PhaseResult;

@FunctionalInterface
public interface RecoveryAction {
    PhaseResult retry() throws Exception;
}

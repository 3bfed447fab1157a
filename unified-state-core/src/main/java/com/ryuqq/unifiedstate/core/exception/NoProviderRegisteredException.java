package com.ryuqq.unifiedstate.core.exception;

import com.ryuqq.unifiedstate.core.model.StateType;

/**
 * Raised when an operation targets a {@link StateType} that has no provider registered.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class NoProviderRegisteredException extends StateException {

    public static final String ERROR_CODE = "STATE-001";

    private final StateType stateType;

    public NoProviderRegisteredException(StateType stateType) {
        super(ERROR_CODE, "No provider registered for state type: " + stateType);
        this.stateType = stateType;
    }

    public StateType stateType() {
        return stateType;
    }
}

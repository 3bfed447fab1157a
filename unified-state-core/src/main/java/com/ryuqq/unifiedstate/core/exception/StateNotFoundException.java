package com.ryuqq.unifiedstate.core.exception;

import com.ryuqq.unifiedstate.core.model.StateType;

/**
 * Raised by providers when no value is stored under the requested ID.
 *
 * <p>The manager forwards this unchanged from {@code getState}.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class StateNotFoundException extends StateException {

    public static final String ERROR_CODE = "STATE-404";

    private final StateType stateType;
    private final String stateId;

    public StateNotFoundException(StateType stateType, String stateId) {
        super(ERROR_CODE, "State not found: " + stateType.id() + ":" + stateId);
        this.stateType = stateType;
        this.stateId = stateId;
    }

    public StateType stateType() {
        return stateType;
    }

    public String stateId() {
        return stateId;
    }
}

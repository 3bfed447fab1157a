package com.ryuqq.unifiedstate.core.exception;

import com.ryuqq.unifiedstate.core.model.StateType;

/**
 * Raised when {@code migrateState} targets a type without a registered migrator.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class NoMigratorRegisteredException extends StateException {

    public static final String ERROR_CODE = "STATE-004";

    private final StateType stateType;

    public NoMigratorRegisteredException(StateType stateType) {
        super(ERROR_CODE, "No migrator registered for state type: " + stateType);
        this.stateType = stateType;
    }

    public StateType stateType() {
        return stateType;
    }
}

package com.ryuqq.unifiedstate.core.exception;

/**
 * Raised when a provider fails to persist or delete a value.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class StatePersistException extends StateException {

    public static final String ERROR_CODE = "STATE-003";

    public StatePersistException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}

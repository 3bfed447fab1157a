package com.ryuqq.unifiedstate.core.exception;

/**
 * Raised when a migration transformer fails for a reason other than a missing path.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class StateMigrationException extends StateException {

    public static final String ERROR_CODE = "STATE-006";

    public StateMigrationException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}

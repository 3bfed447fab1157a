package com.ryuqq.unifiedstate.core.exception;

/**
 * Raised when a value is rejected before it is written.
 *
 * <p>Validators throw this directly; the manager also raises it when a value does not
 * match the value type declared by the target provider. A rejected write leaves the
 * stored state, the event log and observers untouched.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class StateValidationException extends StateException {

    public static final String ERROR_CODE = "STATE-002";

    public StateValidationException(String message) {
        super(ERROR_CODE, message);
    }

    public StateValidationException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}

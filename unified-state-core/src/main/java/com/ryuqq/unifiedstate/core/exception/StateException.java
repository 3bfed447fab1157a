package com.ryuqq.unifiedstate.core.exception;

/**
 * Base type for every failure raised by the unified state subsystem.
 *
 * <p>Each subclass carries a stable error code so callers (conversation engine,
 * tool orchestrator) can branch on the failure kind without parsing messages.</p>
 *
 * <p><strong>Error Codes:</strong></p>
 * <ul>
 *   <li>STATE-001: {@link NoProviderRegisteredException}</li>
 *   <li>STATE-002: {@link StateValidationException}</li>
 *   <li>STATE-003: {@link StatePersistException}</li>
 *   <li>STATE-004: {@link NoMigratorRegisteredException}</li>
 *   <li>STATE-005: {@link NoMigrationPathException}</li>
 *   <li>STATE-006: {@link StateMigrationException}</li>
 *   <li>STATE-007: {@link SyncPartialFailureException}</li>
 *   <li>STATE-008: {@link DuplicateActiveSyncException}</li>
 *   <li>STATE-404: {@link StateNotFoundException}</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class StateException extends RuntimeException {

    private final String errorCode;

    protected StateException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected StateException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /**
     * Returns the stable error code of this failure.
     *
     * @return error code (e.g. STATE-002)
     */
    public String errorCode() {
        return errorCode;
    }
}

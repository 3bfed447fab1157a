package com.ryuqq.unifiedstate.core.exception;

/**
 * Raised when a continuous sync is requested for an ordered (source, target) pair
 * that already has an active one.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class DuplicateActiveSyncException extends StateException {

    public static final String ERROR_CODE = "STATE-008";

    private final String syncId;

    public DuplicateActiveSyncException(String syncId) {
        super(ERROR_CODE, "Continuous sync already active: " + syncId);
        this.syncId = syncId;
    }

    public String syncId() {
        return syncId;
    }
}

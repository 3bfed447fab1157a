package com.ryuqq.unifiedstate.core.exception;

import java.util.List;

/**
 * Aggregate failure of a synchronization pass.
 *
 * <p>A pass continues past per-ID failures, so by the time this is thrown every
 * successful ID has already been written to the target domain. The exception only
 * reports what did not make it.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class SyncPartialFailureException extends StateException {

    public static final String ERROR_CODE = "STATE-007";

    private final int failedCount;
    private final int totalCount;
    private final List<String> failedIds;

    public SyncPartialFailureException(String syncId, int totalCount, List<String> failedIds) {
        super(ERROR_CODE, String.format("Sync %s failed for %d of %d states: %s",
            syncId, failedIds.size(), totalCount, failedIds));
        this.failedCount = failedIds.size();
        this.totalCount = totalCount;
        this.failedIds = List.copyOf(failedIds);
    }

    public int failedCount() {
        return failedCount;
    }

    public int totalCount() {
        return totalCount;
    }

    public List<String> failedIds() {
        return failedIds;
    }
}

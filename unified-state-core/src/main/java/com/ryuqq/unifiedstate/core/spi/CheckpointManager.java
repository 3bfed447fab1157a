package com.ryuqq.unifiedstate.core.spi;

import com.ryuqq.unifiedstate.core.domain.WorkflowState;

/**
 * Persists workflow snapshots. Invoked by the workflow provider after every successful write.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface CheckpointManager {

    /**
     * Saves a checkpoint for a workflow.
     *
     * @param workflowId workflow ID
     * @param state workflow snapshot
     */
    void saveCheckpoint(String workflowId, WorkflowState state);
}

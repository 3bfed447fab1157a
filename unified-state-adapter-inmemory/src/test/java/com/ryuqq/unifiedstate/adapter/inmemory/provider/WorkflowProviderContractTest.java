package com.ryuqq.unifiedstate.adapter.inmemory.provider;

import com.ryuqq.unifiedstate.core.domain.WorkflowState;
import com.ryuqq.unifiedstate.core.spi.StateProvider;
import com.ryuqq.unifiedstate.testkit.contract.AbstractStateProviderContractTest;
import com.ryuqq.unifiedstate.testkit.support.RecordingCheckpointManager;

/**
 * Contract Tests for {@link WorkflowStateProvider}.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class WorkflowProviderContractTest extends AbstractStateProviderContractTest<WorkflowState> {

    @Override
    protected StateProvider<WorkflowState> createProvider() {
        return new WorkflowStateProvider(new RecordingCheckpointManager());
    }

    @Override
    protected WorkflowState sampleValue(String id, int variant) {
        return WorkflowState.of(id, "session-1", "build", "running", variant % 101);
    }
}

package com.ryuqq.unifiedstate.adapter.inmemory.provider;

import com.ryuqq.unifiedstate.core.domain.WorkflowState;
import com.ryuqq.unifiedstate.core.model.StateType;
import com.ryuqq.unifiedstate.core.spi.CheckpointManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * WORKFLOW 도메인 Provider.
 *
 * <p>메모리에 상태를 보관하고, CheckpointManager가 설정된 경우 저장할 때마다 체크포인트를 남깁니다.
 * 체크포인트 실패는 경고 로그만 남기며 저장 자체를 실패시키지 않습니다 (메모리 상태가 기준).</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class WorkflowStateProvider extends InMemoryStateProvider<WorkflowState> {

    private static final Logger log = LoggerFactory.getLogger(WorkflowStateProvider.class);

    private final CheckpointManager checkpointManager;

    /**
     * 체크포인트 없이 생성.
     */
    public WorkflowStateProvider() {
        this(null);
    }

    /**
     * 생성자.
     *
     * @param checkpointManager 체크포인트 관리자 (null이면 체크포인트 생략)
     */
    public WorkflowStateProvider(CheckpointManager checkpointManager) {
        super(StateType.WORKFLOW, WorkflowState.class);
        this.checkpointManager = checkpointManager;
    }

    @Override
    public void setState(String id, WorkflowState value) {
        super.setState(id, value);
        if (checkpointManager == null) {
            return;
        }
        try {
            checkpointManager.saveCheckpoint(id, value);
        } catch (RuntimeException e) {
            log.warn("Checkpoint failed for workflow {} at stage {}: {}", id, value.currentStage(), e.getMessage());
        }
    }
}

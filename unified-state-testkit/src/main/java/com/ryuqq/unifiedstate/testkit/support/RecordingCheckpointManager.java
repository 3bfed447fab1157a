package com.ryuqq.unifiedstate.testkit.support;

import com.ryuqq.unifiedstate.core.domain.WorkflowState;
import com.ryuqq.unifiedstate.core.spi.CheckpointManager;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 저장 요청을 기록하는 테스트용 CheckpointManager.
 *
 * <p>{@link #failWith(RuntimeException)}로 이후 저장 요청이 실패하도록 설정할 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class RecordingCheckpointManager implements CheckpointManager {

    private final List<Map.Entry<String, WorkflowState>> checkpoints = new CopyOnWriteArrayList<>();
    private volatile RuntimeException failure;

    @Override
    public void saveCheckpoint(String workflowId, WorkflowState state) {
        RuntimeException configured = failure;
        if (configured != null) {
            throw configured;
        }
        checkpoints.add(Map.entry(workflowId, state));
    }

    /**
     * 이후 저장 요청이 주어진 예외로 실패하도록 설정 (null이면 해제).
     */
    public void failWith(RuntimeException failure) {
        this.failure = failure;
    }

    /**
     * 기록된 체크포인트 (저장 순).
     */
    public List<Map.Entry<String, WorkflowState>> checkpoints() {
        return List.copyOf(checkpoints);
    }

    /**
     * 특정 워크플로우의 마지막 체크포인트.
     *
     * @return 마지막 상태, 없으면 null
     */
    public WorkflowState lastCheckpoint(String workflowId) {
        WorkflowState last = null;
        for (Map.Entry<String, WorkflowState> entry : checkpoints) {
            if (entry.getKey().equals(workflowId)) {
                last = entry.getValue();
            }
        }
        return last;
    }
}

package com.ryuqq.unifiedstate.core.validation;

import com.ryuqq.unifiedstate.core.domain.WorkflowState;
import com.ryuqq.unifiedstate.core.exception.StateValidationException;
import com.ryuqq.unifiedstate.core.model.StateType;
import com.ryuqq.unifiedstate.core.spi.StateValidator;

/**
 * 워크플로우 상태 Validator.
 *
 * <p><strong>검증 규칙:</strong></p>
 * <ul>
 *   <li>sessionId: 필수</li>
 *   <li>currentStage: 필수</li>
 *   <li>progress: 0 이상 100 이하 (NaN 불가)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class WorkflowStateValidator implements StateValidator<WorkflowState> {

    @Override
    public Class<WorkflowState> valueType() {
        return WorkflowState.class;
    }

    @Override
    public void validate(StateType stateType, WorkflowState state) {
        if (state.sessionId() == null || state.sessionId().isBlank()) {
            throw new StateValidationException("workflow session ID is required");
        }
        if (state.currentStage() == null || state.currentStage().isBlank()) {
            throw new StateValidationException("current stage is required");
        }
        double progress = state.progress();
        if (Double.isNaN(progress) || progress < 0 || progress > 100) {
            throw new StateValidationException(
                "workflow progress out of range: " + progress + " (must be 0-100)");
        }
    }
}

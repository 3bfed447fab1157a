package com.ryuqq.unifiedstate.core.validation;

import com.ryuqq.unifiedstate.core.domain.ConversationState;
import com.ryuqq.unifiedstate.core.exception.StateValidationException;
import com.ryuqq.unifiedstate.core.model.StateType;
import com.ryuqq.unifiedstate.core.spi.StateValidator;

/**
 * 대화 상태 Validator.
 *
 * <p>stage는 ConversationStage enum이므로 값의 범위는 타입이 보장하고, 여기서는 존재 여부만 확인합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ConversationStateValidator implements StateValidator<ConversationState> {

    @Override
    public Class<ConversationState> valueType() {
        return ConversationState.class;
    }

    @Override
    public void validate(StateType stateType, ConversationState state) {
        if (state.conversationId() == null || state.conversationId().isBlank()) {
            throw new StateValidationException("conversation ID is required");
        }
        if (state.sessionId() == null || state.sessionId().isBlank()) {
            throw new StateValidationException("conversation session ID is required");
        }
        if (state.stage() == null) {
            throw new StateValidationException("conversation stage is required");
        }
    }
}

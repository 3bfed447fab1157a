package com.ryuqq.unifiedstate.core.domain;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 대화 상태.
 *
 * <p>stage는 {@link ConversationStage}로 표현되므로 타입 수준에서 닫힌 집합이 보장되며,
 * null 여부는 ConversationStateValidator가 검증합니다.</p>
 *
 * @param conversationId 대화 ID
 * @param sessionId 소속 세션 ID
 * @param stage 현재 대화 단계
 * @param variables 대화 변수
 * @param updatedAt 마지막 갱신 시각
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ConversationState(
    String conversationId,
    String sessionId,
    ConversationStage stage,
    Map<String, Object> variables,
    Instant updatedAt
) {

    public ConversationState {
        variables = variables == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(variables));
    }

    /**
     * stage만 변경한 새 인스턴스 생성.
     */
    public ConversationState withStage(ConversationStage stage, Instant updatedAt) {
        return new ConversationState(conversationId, sessionId, stage, variables, updatedAt);
    }
}

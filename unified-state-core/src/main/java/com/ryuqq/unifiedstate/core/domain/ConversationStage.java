package com.ryuqq.unifiedstate.core.domain;

import java.util.Locale;

/**
 * 대화 단계 (닫힌 집합).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ConversationStage {

    PLANNING,
    BUILDING,
    DEPLOYING,
    MONITORING,
    OPTIMIZING;

    /**
     * 소문자 단계 이름으로 조회.
     *
     * @param name 단계 이름 (대소문자 무관, 예: "building")
     * @return 일치하는 단계
     * @throws IllegalArgumentException 알 수 없는 단계인 경우
     */
    public static ConversationStage fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("stage name cannot be null or blank");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown conversation stage: " + name, e);
        }
    }
}

package com.ryuqq.unifiedstate.core.model;

/**
 * 상태 도메인 구분자.
 *
 * <p>UnifiedStateManager가 관리하는 다섯 가지 상태 도메인을 나타냅니다.
 * 각 도메인에는 Provider, Validator, Migrator가 최대 하나씩 등록됩니다 (마지막 등록 우선).</p>
 *
 * <ul>
 *   <li>SESSION: 세션 관리자에 위임되는 세션 상태</li>
 *   <li>WORKFLOW: build → push → manifests → deploy 워크플로우 진행 상태</li>
 *   <li>CONVERSATION: 대화 단계 및 변수</li>
 *   <li>TOOL: 도구 실행 결과</li>
 *   <li>GLOBAL: 프로세스 전역 설정/상태</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum StateType {

    SESSION("session"),
    WORKFLOW("workflow"),
    CONVERSATION("conversation"),
    TOOL("tool"),
    GLOBAL("global");

    private final String id;

    StateType(String id) {
        this.id = id;
    }

    /**
     * 외부 식별자 조회 (이벤트 버킷 키, SyncSession ID에 사용).
     *
     * @return 소문자 식별자 (예: "workflow")
     */
    public String id() {
        return id;
    }

    /**
     * 외부 식별자로 StateType 조회.
     *
     * @param id 소문자 식별자
     * @return 일치하는 StateType
     * @throws IllegalArgumentException 일치하는 타입이 없는 경우
     */
    public static StateType fromId(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("StateType id cannot be null or blank");
        }
        for (StateType type : values()) {
            if (type.id.equals(id)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown StateType id: " + id);
    }
}

package com.ryuqq.unifiedstate.core.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 워크플로우 진행 상태.
 *
 * <p>build → push → manifests → deploy 흐름에서 현재 단계와 진행률을 나타냅니다.
 * 진행률 범위(0~100)는 WorkflowStateValidator가 검증합니다.</p>
 *
 * @param workflowId 워크플로우 ID
 * @param sessionId 소속 세션 ID
 * @param currentStage 현재 단계 (예: "build")
 * @param status 상태 문자열 (예: "running")
 * @param progress 진행률 (퍼센트)
 * @param metadata 메타데이터
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record WorkflowState(
    String workflowId,
    String sessionId,
    String currentStage,
    String status,
    double progress,
    Map<String, Object> metadata
) {

    public WorkflowState {
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * 메타데이터 없이 생성.
     */
    public static WorkflowState of(String workflowId, String sessionId, String currentStage, String status, double progress) {
        return new WorkflowState(workflowId, sessionId, currentStage, status, progress, Map.of());
    }

    /**
     * progress만 변경한 새 인스턴스 생성.
     */
    public WorkflowState withProgress(double progress) {
        return new WorkflowState(workflowId, sessionId, currentStage, status, progress, metadata);
    }

    /**
     * currentStage와 status를 변경한 새 인스턴스 생성.
     */
    public WorkflowState withStage(String currentStage, String status) {
        return new WorkflowState(workflowId, sessionId, currentStage, status, progress, metadata);
    }
}

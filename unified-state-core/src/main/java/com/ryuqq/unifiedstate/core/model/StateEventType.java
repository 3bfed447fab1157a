package com.ryuqq.unifiedstate.core.model;

/**
 * 상태 이벤트 유형.
 *
 * <p>StateEventStore에 기록되는 모든 이벤트는 다음 유형 중 하나를 가집니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum StateEventType {

    /**
     * 최초 생성.
     */
    CREATED,

    /**
     * 값 갱신 (setState).
     */
    UPDATED,

    /**
     * 삭제 (deleteState).
     */
    DELETED,

    /**
     * 스키마 버전 마이그레이션 (migrateState).
     */
    MIGRATED,

    /**
     * 다른 도메인으로부터 동기화됨 (StateSyncCoordinator).
     */
    SYNCED,

    /**
     * 검증 통과 기록.
     */
    VALIDATED
}

package com.ryuqq.unifiedstate.sync;

import com.ryuqq.unifiedstate.core.model.StateType;

import java.time.Instant;
import java.util.List;

/**
 * 동기화 세션의 특정 시점 스냅샷 (불변).
 *
 * @param id 세션 ID ({@code "sync-{source}-to-{target}"})
 * @param sourceType 원본 상태 타입
 * @param targetType 대상 상태 타입
 * @param strategy 동기화 전략
 * @param startTime 세션 시작 시각
 * @param lastSync 마지막 패스 완료 시각 (아직 없으면 null)
 * @param syncCount 완료된 패스 수
 * @param errors 최근 오류 메시지
 * @param active 활성 여부
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record SyncSessionSnapshot(
    String id,
    StateType sourceType,
    StateType targetType,
    SyncStrategy strategy,
    Instant startTime,
    Instant lastSync,
    long syncCount,
    List<String> errors,
    boolean active
) {

    public SyncSessionSnapshot {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }
}

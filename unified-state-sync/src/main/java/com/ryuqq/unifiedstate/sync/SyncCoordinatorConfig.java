package com.ryuqq.unifiedstate.sync;

/**
 * StateSyncCoordinator 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>schedulerThreads: 연속 동기화 주기 실행용 스케줄러 스레드 수 (기본 2)</li>
 *   <li>maxRecordedErrors: 세션당 보관할 최근 오류 메시지 수 (기본 100)</li>
 * </ul>
 *
 * <p>스케줄러 스레드 수보다 많은 연속 동기화가 동시에 실행되면 일부 주기가 지연될 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param schedulerThreads 스케줄러 스레드 수 (1 이상이어야 함)
 * @param maxRecordedErrors 세션당 오류 보관 수 (1 이상이어야 함)
 */
public record SyncCoordinatorConfig(
    int schedulerThreads,
    int maxRecordedErrors
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: schedulerThreads=2, maxRecordedErrors=100</p>
     */
    public SyncCoordinatorConfig() {
        this(2, 100);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public SyncCoordinatorConfig {
        if (schedulerThreads <= 0) {
            throw new IllegalArgumentException(
                "schedulerThreads must be positive (current: " + schedulerThreads + ")"
            );
        }
        if (maxRecordedErrors <= 0) {
            throw new IllegalArgumentException(
                "maxRecordedErrors must be positive (current: " + maxRecordedErrors + ")"
            );
        }
    }

    /**
     * schedulerThreads만 변경한 새 인스턴스 생성.
     */
    public SyncCoordinatorConfig withSchedulerThreads(int schedulerThreads) {
        return new SyncCoordinatorConfig(schedulerThreads, maxRecordedErrors);
    }

    /**
     * maxRecordedErrors만 변경한 새 인스턴스 생성.
     */
    public SyncCoordinatorConfig withMaxRecordedErrors(int maxRecordedErrors) {
        return new SyncCoordinatorConfig(schedulerThreads, maxRecordedErrors);
    }
}

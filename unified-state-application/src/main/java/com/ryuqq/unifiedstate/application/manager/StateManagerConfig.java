package com.ryuqq.unifiedstate.application.manager;

/**
 * UnifiedStateManager 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>observerThreads: Observer 알림 전용 스레드 수 (기본 4)</li>
 *   <li>observerQueueCapacity: 대기 중인 알림 최대 개수 (기본 1024)</li>
 * </ul>
 *
 * <p><strong>튜닝 가이드:</strong></p>
 * <ul>
 *   <li>느린 Observer가 많음: observerThreads 증가</li>
 *   <li>변경 폭주 시 알림 누락 발생: observerQueueCapacity 증가 (메모리 사용량과 트레이드오프)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param observerThreads 알림 스레드 수 (1 이상이어야 함)
 * @param observerQueueCapacity 알림 큐 용량 (1 이상이어야 함)
 */
public record StateManagerConfig(
    int observerThreads,
    int observerQueueCapacity
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: observerThreads=4, observerQueueCapacity=1024</p>
     */
    public StateManagerConfig() {
        this(4, 1024);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public StateManagerConfig {
        if (observerThreads <= 0) {
            throw new IllegalArgumentException(
                "observerThreads must be positive (current: " + observerThreads + ")"
            );
        }
        if (observerQueueCapacity <= 0) {
            throw new IllegalArgumentException(
                "observerQueueCapacity must be positive (current: " + observerQueueCapacity + ")"
            );
        }
    }

    /**
     * observerThreads만 변경한 새 인스턴스 생성.
     */
    public StateManagerConfig withObserverThreads(int observerThreads) {
        return new StateManagerConfig(observerThreads, observerQueueCapacity);
    }

    /**
     * observerQueueCapacity만 변경한 새 인스턴스 생성.
     */
    public StateManagerConfig withObserverQueueCapacity(int observerQueueCapacity) {
        return new StateManagerConfig(observerThreads, observerQueueCapacity);
    }
}

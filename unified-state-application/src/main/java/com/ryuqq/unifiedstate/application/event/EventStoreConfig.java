package com.ryuqq.unifiedstate.application.event;

import java.time.Duration;

/**
 * StateEventStore 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxEventsPerKey: 키별 최대 보관 이벤트 수 (기본 1000)</li>
 *   <li>retention: 이벤트 보관 기간 (기본 24시간)</li>
 *   <li>cleanupInterval: 만료 이벤트 정리 주기 (기본 1시간)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param maxEventsPerKey 키별 최대 이벤트 수 (1 이상이어야 함)
 * @param retention 보관 기간 (양수여야 함)
 * @param cleanupInterval 정리 주기 (양수여야 함)
 */
public record EventStoreConfig(
    int maxEventsPerKey,
    Duration retention,
    Duration cleanupInterval
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxEventsPerKey=1000, retention=24h, cleanupInterval=1h</p>
     */
    public EventStoreConfig() {
        this(1000, Duration.ofHours(24), Duration.ofHours(1));
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public EventStoreConfig {
        if (maxEventsPerKey <= 0) {
            throw new IllegalArgumentException(
                "maxEventsPerKey must be positive (current: " + maxEventsPerKey + ")"
            );
        }
        if (retention == null || retention.isZero() || retention.isNegative()) {
            throw new IllegalArgumentException(
                "retention must be positive (current: " + retention + ")"
            );
        }
        if (cleanupInterval == null || cleanupInterval.isZero() || cleanupInterval.isNegative()) {
            throw new IllegalArgumentException(
                "cleanupInterval must be positive (current: " + cleanupInterval + ")"
            );
        }
    }

    /**
     * maxEventsPerKey만 변경한 새 인스턴스 생성.
     */
    public EventStoreConfig withMaxEventsPerKey(int maxEventsPerKey) {
        return new EventStoreConfig(maxEventsPerKey, retention, cleanupInterval);
    }

    /**
     * retention만 변경한 새 인스턴스 생성.
     */
    public EventStoreConfig withRetention(Duration retention) {
        return new EventStoreConfig(maxEventsPerKey, retention, cleanupInterval);
    }

    /**
     * cleanupInterval만 변경한 새 인스턴스 생성.
     */
    public EventStoreConfig withCleanupInterval(Duration cleanupInterval) {
        return new EventStoreConfig(maxEventsPerKey, retention, cleanupInterval);
    }
}

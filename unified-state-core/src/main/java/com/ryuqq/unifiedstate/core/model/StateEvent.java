package com.ryuqq.unifiedstate.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 단일 상태 변경의 불변 기록.
 *
 * <p>StateEvent는 성공한 모든 변경(set/delete/migrate/sync)마다 생성되어
 * StateEventStore에 저장되고, 등록된 Observer에게 전달됩니다.</p>
 *
 * <p><strong>불변성:</strong> 저장 이후 변경 불가. metadata와 Map 문서 값(oldValue/newValue)은
 * 생성 시점에 복사되어 읽기 전용으로 노출됩니다.</p>
 *
 * <p><strong>ID 형식:</strong> {@code evt-{epochMillis}-{random hex}}</p>
 *
 * @param id 전역 고유 이벤트 ID
 * @param type 이벤트 유형
 * @param stateType 상태 도메인
 * @param stateId 상태 ID
 * @param oldValue 변경 전 값 (null 가능)
 * @param newValue 변경 후 값 (null 가능)
 * @param metadata 자유 형식 메타데이터 (null이면 빈 맵)
 * @param timestamp 발생 시각
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record StateEvent(
    String id,
    StateEventType type,
    StateType stateType,
    String stateId,
    Object oldValue,
    Object newValue,
    Map<String, Object> metadata,
    Instant timestamp
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 빈 문자열인 경우
     */
    public StateEvent {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (stateType == null) {
            throw new IllegalArgumentException("stateType cannot be null");
        }
        if (stateId == null || stateId.isBlank()) {
            throw new IllegalArgumentException("stateId cannot be null or blank");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
        if (oldValue instanceof Map<?, ?> document) {
            oldValue = Documents.copyOf(document);
        }
        if (newValue instanceof Map<?, ?> document) {
            newValue = Documents.copyOf(document);
        }
        metadata = metadata == null || metadata.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * 새 ID를 발급하여 StateEvent 생성.
     *
     * @param type 이벤트 유형
     * @param stateType 상태 도메인
     * @param stateId 상태 ID
     * @param oldValue 변경 전 값
     * @param newValue 변경 후 값
     * @param metadata 메타데이터
     * @param timestamp 발생 시각
     * @return StateEvent 인스턴스
     */
    public static StateEvent of(
        StateEventType type,
        StateType stateType,
        String stateId,
        Object oldValue,
        Object newValue,
        Map<String, Object> metadata,
        Instant timestamp
    ) {
        return new StateEvent(
            generateId(timestamp), type, stateType, stateId, oldValue, newValue, metadata, timestamp
        );
    }

    /**
     * 이벤트 버킷 키 조회.
     *
     * @return {@code "{stateType}:{stateId}"}
     */
    public String bucketKey() {
        return bucketKey(stateType, stateId);
    }

    /**
     * 이벤트 버킷 키 생성.
     *
     * @param stateType 상태 도메인
     * @param stateId 상태 ID
     * @return {@code "{stateType}:{stateId}"}
     */
    public static String bucketKey(StateType stateType, String stateId) {
        return stateType.id() + ":" + stateId;
    }

    private static String generateId(Instant timestamp) {
        long millis = timestamp != null ? timestamp.toEpochMilli() : System.currentTimeMillis();
        long random = ThreadLocalRandom.current().nextLong() & 0xFFFF_FFFF_FFFFL;
        return String.format("evt-%d-%012x", millis, random);
    }
}

package com.ryuqq.unifiedstate.core.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 세션 상태 스냅샷.
 *
 * <p>세션 관리자가 소유하는 세션의 불변 스냅샷입니다. 필드 값의 유효성
 * (세션 ID, 생성 시각, 디스크 사용량)은 생성 시점이 아니라 SessionStateValidator가 검증합니다.</p>
 *
 * @param sessionId 세션 ID
 * @param workspaceDir 작업 디렉터리
 * @param createdAt 생성 시각 (검증 대상, null 불가)
 * @param lastAccessed 마지막 접근 시각
 * @param expiresAt 만료 시각
 * @param diskUsage 디스크 사용량 (바이트)
 * @param maxDiskUsage 최대 디스크 사용량 (바이트, 0이면 제한 없음)
 * @param labels 라벨 목록
 * @param metadata 메타데이터
 * @param schemaVersion 스키마 버전 (migrateState 대상)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record SessionState(
    String sessionId,
    String workspaceDir,
    Instant createdAt,
    Instant lastAccessed,
    Instant expiresAt,
    long diskUsage,
    long maxDiskUsage,
    List<String> labels,
    Map<String, Object> metadata,
    String schemaVersion
) {

    /**
     * 현재 스키마 버전.
     */
    public static final String CURRENT_SCHEMA_VERSION = "v1.0.0";

    /**
     * 기본 세션 TTL (24시간).
     */
    public static final Duration DEFAULT_TTL = Duration.ofHours(24);

    /**
     * 기본 최대 디스크 사용량 (1GiB).
     */
    public static final long DEFAULT_MAX_DISK_USAGE = 1024L * 1024L * 1024L;

    /**
     * Compact Constructor (컬렉션 정규화).
     */
    public SessionState {
        labels = labels == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(labels));
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * 기본값으로 새 세션 생성.
     *
     * @param sessionId 세션 ID
     * @param workspaceDir 작업 디렉터리
     * @param now 생성 시각
     * @return SessionState 인스턴스
     */
    public static SessionState create(String sessionId, String workspaceDir, Instant now) {
        return new SessionState(
            sessionId, workspaceDir, now, now, now.plus(DEFAULT_TTL),
            0L, DEFAULT_MAX_DISK_USAGE, List.of(), Map.of(), CURRENT_SCHEMA_VERSION
        );
    }

    /**
     * 만료 여부 확인.
     *
     * @param now 기준 시각
     * @return expiresAt이 now 이전이면 true
     */
    public boolean isExpired(Instant now) {
        return expiresAt != null && now.isAfter(expiresAt);
    }

    /**
     * 디스크 할당량 초과 여부 확인.
     *
     * @return maxDiskUsage가 설정되어 있고 diskUsage가 이를 초과하면 true
     */
    public boolean hasExceededDiskQuota() {
        return maxDiskUsage > 0 && diskUsage > maxDiskUsage;
    }

    /**
     * diskUsage만 변경한 새 인스턴스 생성.
     */
    public SessionState withDiskUsage(long diskUsage) {
        return new SessionState(sessionId, workspaceDir, createdAt, lastAccessed, expiresAt,
            diskUsage, maxDiskUsage, labels, metadata, schemaVersion);
    }

    /**
     * lastAccessed만 변경한 새 인스턴스 생성.
     */
    public SessionState withLastAccessed(Instant lastAccessed) {
        return new SessionState(sessionId, workspaceDir, createdAt, lastAccessed, expiresAt,
            diskUsage, maxDiskUsage, labels, metadata, schemaVersion);
    }

    /**
     * metadata만 변경한 새 인스턴스 생성.
     */
    public SessionState withMetadata(Map<String, Object> metadata) {
        return new SessionState(sessionId, workspaceDir, createdAt, lastAccessed, expiresAt,
            diskUsage, maxDiskUsage, labels, metadata, schemaVersion);
    }

    /**
     * schemaVersion만 변경한 새 인스턴스 생성.
     */
    public SessionState withSchemaVersion(String schemaVersion) {
        return new SessionState(sessionId, workspaceDir, createdAt, lastAccessed, expiresAt,
            diskUsage, maxDiskUsage, labels, metadata, schemaVersion);
    }

    /**
     * 라벨을 추가한 새 인스턴스 생성 (이미 있으면 그대로 반환).
     */
    public SessionState withLabel(String label) {
        if (labels.contains(label)) {
            return this;
        }
        List<String> next = new ArrayList<>(labels);
        next.add(label);
        return new SessionState(sessionId, workspaceDir, createdAt, lastAccessed, expiresAt,
            diskUsage, maxDiskUsage, next, metadata, schemaVersion);
    }
}

package com.ryuqq.unifiedstate.sync;

import com.ryuqq.unifiedstate.core.model.StateType;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

/**
 * 동기화 세션 (가변, 내부 전용).
 *
 * <p>카운터와 오류 목록은 세션 자신의 락으로 보호되며, 코디네이터의 레지스트리 락과 독립적입니다.
 * 외부에는 {@link SyncSessionSnapshot}으로만 노출됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class SyncSession {

    private final String id;
    private final StateType sourceType;
    private final StateType targetType;
    private final SyncStrategy strategy;
    private final Instant startTime;
    private final int maxRecordedErrors;
    private final Object lock = new Object();

    private Instant lastSync;
    private long syncCount;
    private final Deque<String> errors = new ArrayDeque<>();
    private volatile boolean active = true;
    private ScheduledFuture<?> future;

    SyncSession(StateType sourceType, StateType targetType, SyncStrategy strategy, Instant startTime, int maxRecordedErrors) {
        this.id = idOf(sourceType, targetType);
        this.sourceType = sourceType;
        this.targetType = targetType;
        this.strategy = strategy;
        this.startTime = startTime;
        this.maxRecordedErrors = maxRecordedErrors;
    }

    /**
     * 세션 ID 생성.
     *
     * @return {@code "sync-{source}-to-{target}"}
     */
    static String idOf(StateType sourceType, StateType targetType) {
        return "sync-" + sourceType.id() + "-to-" + targetType.id();
    }

    String id() {
        return id;
    }

    StateType sourceType() {
        return sourceType;
    }

    StateType targetType() {
        return targetType;
    }

    SyncStrategy strategy() {
        return strategy;
    }

    boolean isActive() {
        return active;
    }

    /**
     * 패스 결과 기록.
     *
     * @param completedAt 패스 완료 시각
     * @param passErrors 이번 패스에서 발생한 오류 메시지
     */
    void recordPass(Instant completedAt, List<String> passErrors) {
        synchronized (lock) {
            lastSync = completedAt;
            syncCount++;
            for (String error : passErrors) {
                errors.addLast(error);
                while (errors.size() > maxRecordedErrors) {
                    errors.removeFirst();
                }
            }
        }
    }

    void attach(ScheduledFuture<?> future) {
        synchronized (lock) {
            this.future = future;
        }
    }

    /**
     * 비활성화 및 이후 주기 취소 (진행 중인 패스는 인터럽트하지 않음).
     */
    void deactivate() {
        active = false;
        synchronized (lock) {
            if (future != null) {
                future.cancel(false);
            }
        }
    }

    SyncSessionSnapshot snapshot() {
        synchronized (lock) {
            return new SyncSessionSnapshot(
                id, sourceType, targetType, strategy, startTime, lastSync, syncCount,
                new ArrayList<>(errors), active
            );
        }
    }
}

package com.ryuqq.unifiedstate.sync;

import com.ryuqq.unifiedstate.application.manager.UnifiedStateManager;
import com.ryuqq.unifiedstate.core.exception.DuplicateActiveSyncException;
import com.ryuqq.unifiedstate.core.exception.NoProviderRegisteredException;
import com.ryuqq.unifiedstate.core.exception.SyncPartialFailureException;
import com.ryuqq.unifiedstate.core.model.StateEvent;
import com.ryuqq.unifiedstate.core.model.StateEventType;
import com.ryuqq.unifiedstate.core.model.StateType;
import com.ryuqq.unifiedstate.core.spi.StateMapping;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 상태 도메인 간 동기화 코디네이터.
 *
 * <p>원본 도메인의 모든 ID를 읽어 {@link StateMapping}으로 변환한 뒤 대상 도메인에 저장합니다.
 * 저장은 {@link UnifiedStateManager#setState}를 거치므로 대상 Validator와 이벤트 기록이 그대로 적용됩니다.</p>
 *
 * <p><strong>패스 처리 흐름:</strong></p>
 * <pre>
 * 1. manager.listStates(source) → [id1, id2, ...]
 * 2. For each id (순차):
 *    a. manager.getState(source, id)
 *    b. mapping.mapState(value)
 *    c. manager.setState(target, id, mapped)
 *    d. SYNCED 이벤트 발행 (대상 타입 기준)
 *    e. 실패 시 기록 후 다음 ID 계속
 * 3. 세션에 패스 결과 기록
 * 4. 실패가 있으면 SyncPartialFailureException (성공분은 이미 적용됨)
 * </pre>
 *
 * <p><strong>Best-effort:</strong> 패스는 트랜잭션이 아닙니다. 일부 ID가 실패해도 성공한 ID의 변경은
 * 되돌리지 않으며, 호출자는 집계 예외의 {@code failedIds()}로 실패 대상을 확인해야 합니다.</p>
 *
 * <p><strong>연속 동기화:</strong> {@link SyncStrategy#PERIODIC_FULL_RECONCILIATION} 전략으로,
 * 매 주기마다 전체 ID 목록을 다시 동기화합니다. 변경분 추적(커서/버전)은 하지 않습니다.</p>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>세션 레지스트리 락은 세션 등록/조회에만 사용되며, 패스는 락 밖에서 실행됩니다.</li>
 *   <li>세션 카운터와 오류 목록은 각 세션의 락으로 보호됩니다.</li>
 *   <li>중지는 협력적입니다: 진행 중인 패스는 끝까지 실행되고 이후 주기만 취소됩니다.</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StateSyncCoordinator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(StateSyncCoordinator.class);

    private final SyncCoordinatorConfig config;
    private final Clock clock;
    private final ScheduledThreadPoolExecutor scheduler;
    private final Map<String, SyncSession> sessions = new HashMap<>();
    private final Object registryLock = new Object();

    /**
     * 기본 설정 생성자.
     */
    public StateSyncCoordinator() {
        this(new SyncCoordinatorConfig());
    }

    /**
     * 생성자.
     *
     * @param config 코디네이터 설정
     */
    public StateSyncCoordinator(SyncCoordinatorConfig config) {
        this(config, Clock.systemUTC());
    }

    /**
     * 생성자 (Clock 지정).
     *
     * @param config 코디네이터 설정
     * @param clock 세션/이벤트 타임스탬프용 Clock
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public StateSyncCoordinator(SyncCoordinatorConfig config, Clock clock) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.config = config;
        this.clock = clock;

        AtomicInteger threadIndex = new AtomicInteger();
        this.scheduler = new ScheduledThreadPoolExecutor(config.schedulerThreads(), runnable -> {
            Thread thread = new Thread(runnable, "state-sync-" + threadIndex.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        this.scheduler.setRemoveOnCancelPolicy(true);
    }

    /**
     * 단발성 동기화 패스 실행.
     *
     * <p>같은 (source, target) 쌍의 연속 동기화 세션이 활성 상태이면 해당 세션에 결과를 기록하고,
     * 없으면 임시 세션을 만들어 패스 종료 시 제거합니다.</p>
     *
     * @param manager 상태 관리자
     * @param sourceType 원본 상태 타입
     * @param targetType 대상 상태 타입
     * @param mapping 원본 → 대상 변환
     * @return 동기화된 ID 수
     * @throws NoProviderRegisteredException 원본 또는 대상 Provider가 없는 경우
     * @throws SyncPartialFailureException 일부 ID 동기화 실패 시 (성공분은 이미 적용됨)
     */
    public int syncStates(UnifiedStateManager manager, StateType sourceType, StateType targetType, StateMapping mapping) {
        validateArguments(manager, sourceType, targetType, mapping);

        SyncSession created = new SyncSession(
            sourceType, targetType, SyncStrategy.ONE_SHOT, clock.instant(), config.maxRecordedErrors()
        );
        SyncSession session;
        synchronized (registryLock) {
            session = sessions.putIfAbsent(created.id(), created);
            if (session == null) {
                session = created;
            }
        }

        try {
            return runPass(manager, session, mapping);
        } finally {
            if (session == created) {
                synchronized (registryLock) {
                    sessions.remove(created.id(), created);
                }
            }
        }
    }

    /**
     * 연속 동기화 시작.
     *
     * <p>첫 패스는 interval 이후에 실행되며, 이후 이전 패스 종료 시점부터 interval마다 반복됩니다.</p>
     *
     * @param manager 상태 관리자
     * @param sourceType 원본 상태 타입
     * @param targetType 대상 상태 타입
     * @param mapping 원본 → 대상 변환
     * @param interval 패스 간격 (양수)
     * @return 세션 ID
     * @throws DuplicateActiveSyncException 같은 쌍의 연속 동기화가 이미 활성인 경우
     */
    public String startContinuousSync(
        UnifiedStateManager manager,
        StateType sourceType,
        StateType targetType,
        StateMapping mapping,
        Duration interval
    ) {
        validateArguments(manager, sourceType, targetType, mapping);
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive (current: " + interval + ")");
        }

        SyncSession session = new SyncSession(
            sourceType, targetType, SyncStrategy.PERIODIC_FULL_RECONCILIATION, clock.instant(), config.maxRecordedErrors()
        );
        synchronized (registryLock) {
            SyncSession existing = sessions.get(session.id());
            if (existing != null && existing.isActive()
                && existing.strategy() == SyncStrategy.PERIODIC_FULL_RECONCILIATION) {
                throw new DuplicateActiveSyncException(session.id());
            }
            sessions.put(session.id(), session);

            long intervalMs = interval.toMillis();
            ScheduledFuture<?> future = scheduler.scheduleWithFixedDelay(
                () -> tick(manager, session, mapping), intervalMs, intervalMs, TimeUnit.MILLISECONDS
            );
            session.attach(future);
        }

        log.info("Continuous sync started: {} (interval={}, strategy={})",
            session.id(), interval, session.strategy());
        return session.id();
    }

    /**
     * 연속 동기화 중지.
     *
     * @param syncId 세션 ID
     * @return 활성 연속 동기화를 중지했으면 true, 해당 세션이 없으면 false
     */
    public boolean stopContinuousSync(String syncId) {
        if (syncId == null) {
            throw new IllegalArgumentException("syncId cannot be null");
        }

        SyncSession session;
        synchronized (registryLock) {
            session = sessions.get(syncId);
            if (session == null || session.strategy() != SyncStrategy.PERIODIC_FULL_RECONCILIATION) {
                return false;
            }
            sessions.remove(syncId);
        }

        session.deactivate();
        SyncSessionSnapshot snapshot = session.snapshot();
        log.info("Continuous sync stopped: {} after {} pass(es)", syncId, snapshot.syncCount());
        return true;
    }

    /**
     * 활성 세션 스냅샷 목록.
     *
     * @return 현재 활성 세션 (단발성 패스 진행 중인 세션 포함)
     */
    public List<SyncSessionSnapshot> getActiveSyncs() {
        List<SyncSession> current;
        synchronized (registryLock) {
            current = new ArrayList<>(sessions.values());
        }

        List<SyncSessionSnapshot> snapshots = new ArrayList<>();
        for (SyncSession session : current) {
            if (session.isActive()) {
                snapshots.add(session.snapshot());
            }
        }
        return snapshots;
    }

    /**
     * 모든 세션 중지 및 스케줄러 종료.
     *
     * <p>진행 중인 패스가 끝나도록 잠시 기다린 후, 시간 내 끝나지 않으면 강제 종료합니다.</p>
     */
    public void shutdown() {
        List<SyncSession> current;
        synchronized (registryLock) {
            current = new ArrayList<>(sessions.values());
            sessions.clear();
        }
        current.forEach(SyncSession::deactivate);

        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("StateSyncCoordinator shut down ({} session(s) stopped)", current.size());
    }

    @Override
    public void close() {
        shutdown();
    }

    /**
     * 연속 동기화 1회 주기.
     *
     * <p>예외가 전파되면 스케줄이 중단되므로 모든 예외를 로그로 남깁니다.</p>
     */
    private void tick(UnifiedStateManager manager, SyncSession session, StateMapping mapping) {
        if (!session.isActive()) {
            return;
        }
        try {
            runPass(manager, session, mapping);
        } catch (SyncPartialFailureException e) {
            log.warn("Continuous sync {} pass completed with {} of {} failure(s)",
                session.id(), e.failedCount(), e.totalCount());
        } catch (RuntimeException e) {
            session.recordPass(clock.instant(), List.of("pass failed: " + e.getMessage()));
            log.error("Continuous sync {} pass failed", session.id(), e);
        }
    }

    private int runPass(UnifiedStateManager manager, SyncSession session, StateMapping mapping) {
        StateType sourceType = session.sourceType();
        StateType targetType = session.targetType();

        List<String> ids = manager.listStates(sourceType);
        List<String> failedIds = new ArrayList<>();
        List<String> errors = new ArrayList<>();

        for (String id : ids) {
            try {
                syncOne(manager, session, mapping, id);
            } catch (RuntimeException e) {
                failedIds.add(id);
                errors.add(id + ": " + e.getMessage());
                log.warn("Sync {} failed for {}: {}", session.id(), id, e.getMessage());
            }
        }

        session.recordPass(clock.instant(), errors);

        if (!failedIds.isEmpty()) {
            throw new SyncPartialFailureException(session.id(), ids.size(), failedIds);
        }
        log.debug("Sync {} pass completed: {} {} state(s) -> {}",
            session.id(), ids.size(), sourceType.id(), targetType.id());
        return ids.size();
    }

    private void syncOne(UnifiedStateManager manager, SyncSession session, StateMapping mapping, String id) {
        Object value = manager.getState(session.sourceType(), id);
        Object mapped = mapping.mapState(value);
        manager.setState(session.targetType(), id, mapped);
        manager.publishEvent(StateEvent.of(
            StateEventType.SYNCED,
            session.targetType(),
            id,
            null,
            mapped,
            Map.of("syncId", session.id(), "sourceType", session.sourceType().id()),
            clock.instant()
        ));
    }

    private static void validateArguments(
        UnifiedStateManager manager,
        StateType sourceType,
        StateType targetType,
        StateMapping mapping
    ) {
        if (manager == null) {
            throw new IllegalArgumentException("manager cannot be null");
        }
        if (sourceType == null) {
            throw new IllegalArgumentException("sourceType cannot be null");
        }
        if (targetType == null) {
            throw new IllegalArgumentException("targetType cannot be null");
        }
        if (mapping == null) {
            throw new IllegalArgumentException("mapping cannot be null");
        }
        if (sourceType == targetType) {
            throw new IllegalArgumentException("sourceType and targetType must differ: " + sourceType.id());
        }
        if (!manager.isProviderRegistered(targetType)) {
            throw new NoProviderRegisteredException(targetType);
        }
        if (!manager.isProviderRegistered(sourceType)) {
            throw new NoProviderRegisteredException(sourceType);
        }
    }
}

package com.ryuqq.unifiedstate.application.manager;

import com.ryuqq.unifiedstate.application.event.StateEventStore;
import com.ryuqq.unifiedstate.application.transaction.StateTransaction;
import com.ryuqq.unifiedstate.core.domain.SessionState;
import com.ryuqq.unifiedstate.core.exception.NoMigrationPathException;
import com.ryuqq.unifiedstate.core.exception.NoMigratorRegisteredException;
import com.ryuqq.unifiedstate.core.exception.NoProviderRegisteredException;
import com.ryuqq.unifiedstate.core.exception.StateMigrationException;
import com.ryuqq.unifiedstate.core.exception.StatePersistException;
import com.ryuqq.unifiedstate.core.exception.StateValidationException;
import com.ryuqq.unifiedstate.core.model.Documents;
import com.ryuqq.unifiedstate.core.model.StateEvent;
import com.ryuqq.unifiedstate.core.model.StateEventType;
import com.ryuqq.unifiedstate.core.model.StateType;
import com.ryuqq.unifiedstate.core.spi.StateMigrator;
import com.ryuqq.unifiedstate.core.spi.StateObserver;
import com.ryuqq.unifiedstate.core.spi.StateProvider;
import com.ryuqq.unifiedstate.core.spi.StateValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 통합 상태 관리자 (Facade).
 *
 * <p>StateType별 Provider/Validator/Migrator 레지스트리와 Observer 목록을 보유하며,
 * 모든 상태 변경을 검증 → 저장 → 이벤트 기록 → 알림 순서로 처리합니다.</p>
 *
 * <p><strong>setState 처리 흐름:</strong></p>
 * <pre>
 * 1. Provider 조회 (없으면 NoProviderRegisteredException)
 * 2. 값 타입 확인 (provider.valueType() 불일치 시 StateValidationException)
 *    Map 문서는 불변 복사본으로 대체되어 이후 검증/저장/이벤트에 같은 스냅샷이 사용됨
 * 3. Validator 실행 (실패 시 변경/이벤트/알림 없이 StateValidationException)
 * 4. 이전 값 조회 (실패해도 무시, oldValue = null)
 * 5. provider.setState() (실패 시 StatePersistException)
 * 6. UPDATED 이벤트 생성 → EventStore 기록 → Observer 알림 제출
 * </pre>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>매니저 락은 레지스트리만 보호합니다. Provider 호출은 락 밖에서 수행됩니다.</li>
 *   <li>Provider 내부 동기화는 각 Provider가 책임집니다.</li>
 *   <li>Observer 알림은 {@link ObserverNotifier}의 별도 스레드에서 실행되며 호출자를 블로킹하지 않습니다.</li>
 * </ul>
 *
 * <p><strong>생명주기:</strong> 생성 시 이벤트 저장소의 보존 기간 정리 작업을 시작하고,
 * {@link #close()}에서 정리 작업과 알림 풀을 종료합니다.</p>
 *
 * <p><strong>등록 정책:</strong> StateType당 하나의 Provider/Validator/Migrator만 유지하며
 * 재등록 시 교체됩니다. 같은 ID의 Observer도 교체됩니다. 등록 해제는 지원하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class UnifiedStateManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(UnifiedStateManager.class);

    private final Map<StateType, StateProvider<?>> providers = new EnumMap<>(StateType.class);
    private final Map<StateType, StateValidator<?>> validators = new EnumMap<>(StateType.class);
    private final Map<StateType, StateMigrator<?>> migrators = new EnumMap<>(StateType.class);
    private final List<StateObserver> observers = new ArrayList<>();
    private final ReadWriteLock registryLock = new ReentrantReadWriteLock();

    private final StateEventStore eventStore;
    private final ObserverNotifier notifier;
    private final Clock clock;

    /**
     * 기본 설정 생성자.
     */
    public UnifiedStateManager() {
        this(new StateEventStore(), new StateManagerConfig());
    }

    /**
     * 생성자.
     *
     * @param eventStore 이벤트 저장소
     * @param config 매니저 설정
     */
    public UnifiedStateManager(StateEventStore eventStore, StateManagerConfig config) {
        this(eventStore, config, Clock.systemUTC());
    }

    /**
     * 생성자 (Clock 지정).
     *
     * <p>전달된 이벤트 저장소의 정리 작업을 시작합니다 (이미 시작된 경우 무시).</p>
     *
     * @param eventStore 이벤트 저장소
     * @param config 매니저 설정
     * @param clock 이벤트 타임스탬프용 Clock
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public UnifiedStateManager(StateEventStore eventStore, StateManagerConfig config, Clock clock) {
        if (eventStore == null) {
            throw new IllegalArgumentException("eventStore cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.eventStore = eventStore;
        this.notifier = new ObserverNotifier(config);
        this.clock = clock;
        eventStore.start();
    }

    // ===== 레지스트리 =====

    /**
     * Provider 등록 (기존 Provider 교체).
     *
     * @param stateType 상태 타입
     * @param provider Provider
     * @throws IllegalArgumentException 인자가 null이거나 provider.stateType()이 일치하지 않는 경우
     */
    public void registerStateProvider(StateType stateType, StateProvider<?> provider) {
        requireNonNull(stateType, "stateType");
        requireNonNull(provider, "provider");
        if (provider.stateType() != stateType) {
            throw new IllegalArgumentException(
                "provider serves " + provider.stateType() + " but was registered for " + stateType
            );
        }
        register(providers, stateType, provider);
        log.info("Registered state provider for {}: {}", stateType.id(), provider.getClass().getSimpleName());
    }

    /**
     * Validator 등록 (기존 Validator 교체).
     */
    public void registerStateValidator(StateType stateType, StateValidator<?> validator) {
        requireNonNull(stateType, "stateType");
        requireNonNull(validator, "validator");
        register(validators, stateType, validator);
        log.info("Registered state validator for {}: {}", stateType.id(), validator.getClass().getSimpleName());
    }

    /**
     * Migrator 등록 (기존 Migrator 교체).
     */
    public void registerStateMigrator(StateType stateType, StateMigrator<?> migrator) {
        requireNonNull(stateType, "stateType");
        requireNonNull(migrator, "migrator");
        register(migrators, stateType, migrator);
        log.info("Registered state migrator for {}: {}", stateType.id(), migrator.getClass().getSimpleName());
    }

    /**
     * Observer 등록.
     *
     * <p>같은 {@link StateObserver#getId()}를 가진 Observer가 이미 있으면 교체합니다.</p>
     *
     * @param observer Observer
     */
    public void registerObserver(StateObserver observer) {
        requireNonNull(observer, "observer");
        requireNonNull(observer.getId(), "observer.getId()");

        registryLock.writeLock().lock();
        try {
            observers.removeIf(existing -> existing.getId().equals(observer.getId()));
            observers.add(observer);
        } finally {
            registryLock.writeLock().unlock();
        }
        log.info("Registered state observer: {}", observer.getId());
    }

    /**
     * Provider 등록 여부 확인.
     */
    public boolean isProviderRegistered(StateType stateType) {
        requireNonNull(stateType, "stateType");
        return lookup(providers, stateType) != null;
    }

    // ===== 조회 =====

    /**
     * 상태 조회.
     *
     * <p>Provider가 던진 {@code StateNotFoundException}은 그대로 전파됩니다.</p>
     *
     * @param stateType 상태 타입
     * @param stateId 상태 ID
     * @return 저장된 값
     * @throws NoProviderRegisteredException Provider가 없는 경우
     */
    public Object getState(StateType stateType, String stateId) {
        requireNonNull(stateType, "stateType");
        requireNonNull(stateId, "stateId");
        return requireProvider(stateType).getState(stateId);
    }

    /**
     * 타입을 지정한 상태 조회.
     *
     * @param stateType 상태 타입
     * @param stateId 상태 ID
     * @param type 기대하는 값 타입
     * @param <T> 값 타입
     * @return 저장된 값
     * @throws IllegalArgumentException 저장된 값이 type의 인스턴스가 아닌 경우
     */
    public <T> T getState(StateType stateType, String stateId, Class<T> type) {
        requireNonNull(type, "type");
        Object value = getState(stateType, stateId);
        if (!type.isInstance(value)) {
            throw new IllegalArgumentException(
                "State " + StateEvent.bucketKey(stateType, stateId) + " is "
                    + value.getClass().getName() + ", not " + type.getName()
            );
        }
        return type.cast(value);
    }

    /**
     * 세션 상태 조회 (SESSION Provider 단축 메서드).
     */
    public SessionState getSessionState(String sessionId) {
        return getState(StateType.SESSION, sessionId, SessionState.class);
    }

    /**
     * 상태 ID 목록 조회.
     *
     * @param stateType 상태 타입
     * @return Provider가 보유한 ID 목록
     */
    public List<String> listStates(StateType stateType) {
        requireNonNull(stateType, "stateType");
        return requireProvider(stateType).listStates();
    }

    /**
     * 상태 변경 이력 조회 (오래된 순).
     *
     * @param stateType 상태 타입
     * @param stateId 상태 ID
     * @param limit 최대 개수
     * @return 최근 limit개의 이벤트
     */
    public List<StateEvent> getStateHistory(StateType stateType, String stateId, int limit) {
        return eventStore.getEvents(stateType, stateId, limit);
    }

    // ===== 변경 =====

    /**
     * 상태 저장.
     *
     * @param stateType 상태 타입
     * @param stateId 상태 ID
     * @param value 저장할 값
     * @throws NoProviderRegisteredException Provider가 없는 경우
     * @throws StateValidationException 타입 불일치 또는 검증 실패 시
     * @throws StatePersistException Provider 저장 실패 시
     */
    public void setState(StateType stateType, String stateId, Object value) {
        requireNonNull(stateType, "stateType");
        requireNonNull(stateId, "stateId");
        requireNonNull(value, "value");

        StateProvider<?> provider = requireProvider(stateType);
        checkValueType(stateType, stateId, provider.valueType(), value);
        Object snapshot = snapshot(stateType, stateId, value);
        validate(stateType, stateId, snapshot);

        Object oldValue = fetchQuietly(provider, stateId);
        persist(provider, stateId, snapshot);

        emit(StateEvent.of(StateEventType.UPDATED, stateType, stateId, oldValue, snapshot, Map.of(), clock.instant()));
        log.debug("State updated: {}", StateEvent.bucketKey(stateType, stateId));
    }

    /**
     * 상태 삭제.
     *
     * @param stateType 상태 타입
     * @param stateId 상태 ID
     * @throws NoProviderRegisteredException Provider가 없는 경우
     * @throws StatePersistException Provider 삭제 실패 시
     */
    public void deleteState(StateType stateType, String stateId) {
        requireNonNull(stateType, "stateType");
        requireNonNull(stateId, "stateId");

        StateProvider<?> provider = requireProvider(stateType);
        Object oldValue = fetchQuietly(provider, stateId);
        try {
            provider.deleteState(stateId);
        } catch (RuntimeException e) {
            throw new StatePersistException(
                "Failed to delete state " + StateEvent.bucketKey(stateType, stateId), e
            );
        }

        emit(StateEvent.of(StateEventType.DELETED, stateType, stateId, oldValue, null, Map.of(), clock.instant()));
        log.debug("State deleted: {}", StateEvent.bucketKey(stateType, stateId));
    }

    /**
     * 상태 스키마 마이그레이션.
     *
     * <p>현재 값을 조회하여 Migrator로 변환한 후, 변환 결과를 검증하고 저장합니다.
     * 경로가 없으면 저장된 값은 변경되지 않습니다.</p>
     *
     * @param stateType 상태 타입
     * @param stateId 상태 ID
     * @param fromVersion 원본 버전
     * @param toVersion 대상 버전
     * @throws NoProviderRegisteredException Provider가 없는 경우
     * @throws NoMigratorRegisteredException Migrator가 없는 경우
     * @throws NoMigrationPathException 버전 경로가 없는 경우
     * @throws StateMigrationException 변환 실패 시
     */
    public void migrateState(StateType stateType, String stateId, String fromVersion, String toVersion) {
        requireNonNull(stateType, "stateType");
        requireNonNull(stateId, "stateId");
        requireNonNull(fromVersion, "fromVersion");
        requireNonNull(toVersion, "toVersion");

        StateProvider<?> provider = requireProvider(stateType);
        StateMigrator<?> migrator = lookup(migrators, stateType);
        if (migrator == null) {
            throw new NoMigratorRegisteredException(stateType);
        }

        Object current = provider.getState(stateId);
        Object migrated = runMigrator(migrator, stateType, stateId, fromVersion, toVersion, current);

        checkValueType(stateType, stateId, provider.valueType(), migrated);
        migrated = snapshot(stateType, stateId, migrated);
        validate(stateType, stateId, migrated);
        persist(provider, stateId, migrated);

        emit(StateEvent.of(
            StateEventType.MIGRATED, stateType, stateId, current, migrated,
            Map.of("from", fromVersion, "to", toVersion), clock.instant()
        ));
        log.info("State migrated: {} {} -> {}", StateEvent.bucketKey(stateType, stateId), fromVersion, toVersion);
    }

    /**
     * 외부에서 생성한 이벤트를 기록하고 Observer에 알림.
     *
     * <p>동기화 코디네이터의 SYNCED 이벤트처럼 매니저 밖에서 만들어진 이벤트에 사용합니다.</p>
     *
     * @param event 이벤트
     */
    public void publishEvent(StateEvent event) {
        requireNonNull(event, "event");
        emit(event);
    }

    /**
     * 트랜잭션 생성.
     *
     * @return 이 매니저에 커밋되는 새 트랜잭션
     */
    public StateTransaction createStateTransaction() {
        return new StateTransaction(this);
    }

    /**
     * 다중 노드 복제 활성화.
     *
     * <p>단일 프로세스 구현이므로 대상 목록을 로그로만 남깁니다.</p>
     *
     * @param targets 복제 대상 노드
     */
    public void enableStateReplication(List<String> targets) {
        requireNonNull(targets, "targets");
        log.info("State replication requested for {} target(s) {}; replication is not supported in-process",
            targets.size(), targets);
    }

    /**
     * Observer 알림 풀과 이벤트 저장소 정리 작업 종료.
     */
    @Override
    public void close() {
        notifier.shutdown();
        eventStore.close();
        log.info("UnifiedStateManager closed");
    }

    /**
     * 이벤트 저장소 조회.
     */
    public StateEventStore eventStore() {
        return eventStore;
    }

    /**
     * 버려진 Observer 알림 수 조회.
     */
    public long droppedNotifications() {
        return notifier.droppedNotifications();
    }

    // ===== 내부 처리 =====

    private void emit(StateEvent event) {
        eventStore.append(event);
        List<StateObserver> snapshot;
        registryLock.readLock().lock();
        try {
            snapshot = List.copyOf(observers);
        } finally {
            registryLock.readLock().unlock();
        }
        notifier.notify(snapshot, event);
    }

    private StateProvider<?> requireProvider(StateType stateType) {
        StateProvider<?> provider = lookup(providers, stateType);
        if (provider == null) {
            throw new NoProviderRegisteredException(stateType);
        }
        return provider;
    }

    private void validate(StateType stateType, String stateId, Object value) {
        StateValidator<?> validator = lookup(validators, stateType);
        if (validator == null) {
            return;
        }
        checkValueType(stateType, stateId, validator.valueType(), value);
        try {
            invokeValidator(validator, stateType, value);
        } catch (RuntimeException e) {
            throw new StateValidationException(
                "Validation failed for " + StateEvent.bucketKey(stateType, stateId) + ": " + e.getMessage(), e
            );
        }
    }

    private static <T> void invokeValidator(StateValidator<T> validator, StateType stateType, Object value) {
        validator.validate(stateType, validator.valueType().cast(value));
    }

    private static <T> void persist(StateProvider<T> provider, String stateId, Object value) {
        try {
            provider.setState(stateId, provider.valueType().cast(value));
        } catch (RuntimeException e) {
            throw new StatePersistException(
                "Failed to persist state " + StateEvent.bucketKey(provider.stateType(), stateId), e
            );
        }
    }

    private static <T> Object runMigrator(
        StateMigrator<T> migrator,
        StateType stateType,
        String stateId,
        String fromVersion,
        String toVersion,
        Object current
    ) {
        checkValueType(stateType, stateId, migrator.valueType(), current);
        try {
            return migrator.migrateState(fromVersion, toVersion, migrator.valueType().cast(current));
        } catch (NoMigrationPathException | StateMigrationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new StateMigrationException(
                "Migration of " + StateEvent.bucketKey(stateType, stateId)
                    + " from " + fromVersion + " to " + toVersion + " failed", e
            );
        }
    }

    private static Object fetchQuietly(StateProvider<?> provider, String stateId) {
        try {
            return provider.getState(stateId);
        } catch (RuntimeException e) {
            // 이전 값이 없거나 조회 실패: oldValue 없이 진행
            return null;
        }
    }

    private static Object snapshot(StateType stateType, String stateId, Object value) {
        if (!(value instanceof Map<?, ?> document)) {
            return value;
        }
        try {
            return Documents.copyOf(document);
        } catch (IllegalArgumentException e) {
            throw new StateValidationException(
                "Validation failed for " + StateEvent.bucketKey(stateType, stateId) + ": " + e.getMessage(), e
            );
        }
    }

    private static void checkValueType(StateType stateType, String stateId, Class<?> expected, Object value) {
        if (value == null || !expected.isInstance(value)) {
            String actual = value == null ? "null" : value.getClass().getName();
            throw new StateValidationException(
                "Value for " + StateEvent.bucketKey(stateType, stateId) + " must be "
                    + expected.getName() + " (current: " + actual + ")"
            );
        }
    }

    private <V> void register(Map<StateType, V> registry, StateType stateType, V value) {
        registryLock.writeLock().lock();
        try {
            registry.put(stateType, value);
        } finally {
            registryLock.writeLock().unlock();
        }
    }

    private <V> V lookup(Map<StateType, V> registry, StateType stateType) {
        registryLock.readLock().lock();
        try {
            return registry.get(stateType);
        } finally {
            registryLock.readLock().unlock();
        }
    }

    private static void requireNonNull(Object value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " cannot be null");
        }
    }
}

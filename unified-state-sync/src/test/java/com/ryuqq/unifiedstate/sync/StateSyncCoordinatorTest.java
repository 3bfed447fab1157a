package com.ryuqq.unifiedstate.sync;

import com.ryuqq.unifiedstate.adapter.inmemory.provider.InMemoryStateProvider;
import com.ryuqq.unifiedstate.application.manager.UnifiedStateManager;
import com.ryuqq.unifiedstate.core.exception.DuplicateActiveSyncException;
import com.ryuqq.unifiedstate.core.exception.NoProviderRegisteredException;
import com.ryuqq.unifiedstate.core.exception.SyncPartialFailureException;
import com.ryuqq.unifiedstate.core.mapping.IdentityMapping;
import com.ryuqq.unifiedstate.core.model.Documents;
import com.ryuqq.unifiedstate.core.model.StateEvent;
import com.ryuqq.unifiedstate.core.model.StateEventType;
import com.ryuqq.unifiedstate.core.model.StateType;
import com.ryuqq.unifiedstate.core.spi.StateMapping;
import com.ryuqq.unifiedstate.core.validation.ToolStateValidator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

/**
 * StateSyncCoordinator 테스트.
 *
 * <p>TOOL → GLOBAL 방향으로 동기화하며, 대상 타입의 SYNCED 이벤트 수로 패스 결과를 확인합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class StateSyncCoordinatorTest {

    private static final Duration INTERVAL = Duration.ofMillis(50);
    private static final String SYNC_ID = "sync-tool-to-global";

    private UnifiedStateManager manager;
    private StateSyncCoordinator coordinator;

    @BeforeEach
    void setUp() {
        manager = new UnifiedStateManager();
        manager.registerStateProvider(StateType.TOOL, InMemoryStateProvider.documents(StateType.TOOL));
        manager.registerStateProvider(StateType.GLOBAL, InMemoryStateProvider.documents(StateType.GLOBAL));
        coordinator = new StateSyncCoordinator();
    }

    @AfterEach
    void tearDown() {
        coordinator.close();
        manager.close();
    }

    // ============================================================
    // 1. 단발성 동기화
    // ============================================================

    @Test
    void syncStates_모든_원본_ID를_변환하여_대상에_기록함() {
        // given
        seed("a", 1);
        seed("b", 2);
        seed("c", 3);

        // when
        int synced = coordinator.syncStates(manager, StateType.TOOL, StateType.GLOBAL, new MarkingMapping());

        // then
        assertThat(synced).isEqualTo(3);
        assertThat(manager.listStates(StateType.GLOBAL)).containsExactly("a", "b", "c");
        assertThat(manager.getState(StateType.GLOBAL, "b")).isEqualTo(Map.of("n", 2, "mirrored", true));

        List<StateEvent> syncedEvents = syncedEvents();
        assertThat(syncedEvents).hasSize(3);
        assertThat(syncedEvents).allSatisfy(event -> {
            assertThat(event.stateType()).isEqualTo(StateType.GLOBAL);
            assertThat(event.oldValue()).isNull();
            assertThat(event.metadata())
                .containsEntry("syncId", SYNC_ID)
                .containsEntry("sourceType", "tool");
        });
    }

    @Test
    void syncStates_반복_실행해도_대상은_동일함() {
        // given
        seed("a", 1);
        seed("b", 2);

        // when
        coordinator.syncStates(manager, StateType.TOOL, StateType.GLOBAL, IdentityMapping.instance());
        Map<String, Object> afterFirst = snapshotTarget();
        coordinator.syncStates(manager, StateType.TOOL, StateType.GLOBAL, IdentityMapping.instance());

        // then
        assertThat(snapshotTarget()).isEqualTo(afterFirst);
        assertThat(syncedEvents()).hasSize(4);
    }

    @Test
    void syncStates_IdentityMapping이어도_원본과_대상_문서는_공유되지_않음() {
        // given
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("n", 1);
        manager.setState(StateType.TOOL, "a", document);

        // when
        coordinator.syncStates(manager, StateType.TOOL, StateType.GLOBAL, IdentityMapping.instance());
        document.put("y", "leak");

        // then
        Map<String, Object> source = manager.getState(StateType.TOOL, "a", Documents.TYPE);
        Map<String, Object> target = manager.getState(StateType.GLOBAL, "a", Documents.TYPE);
        assertThat(target).isNotSameAs(source).isEqualTo(Map.of("n", 1));
        assertThatThrownBy(() -> source.put("y", "leak")).isInstanceOf(UnsupportedOperationException.class);
        assertThat(syncedEvents()).singleElement()
            .extracting(StateEvent::newValue)
            .isEqualTo(Map.of("n", 1));
    }

    @Test
    void syncStates_원본이_비어있으면_0을_반환함() {
        int synced = coordinator.syncStates(manager, StateType.TOOL, StateType.GLOBAL, IdentityMapping.instance());

        assertThat(synced).isZero();
        assertThat(manager.listStates(StateType.GLOBAL)).isEmpty();
    }

    @Test
    void syncStates_일부_실패시_성공분은_적용하고_실패_ID를_보고함() {
        // given: 대상 검증기가 n=2를 거부
        manager.registerStateValidator(StateType.GLOBAL, new ToolStateValidator("mirror")
            .requireField("n", v -> !Integer.valueOf(2).equals(v), "must not be 2"));
        seed("a", 1);
        seed("b", 2);
        seed("c", 3);

        // when & then
        assertThatThrownBy(() -> coordinator.syncStates(manager, StateType.TOOL, StateType.GLOBAL, IdentityMapping.instance()))
            .isInstanceOfSatisfying(SyncPartialFailureException.class, e -> {
                assertThat(e.failedCount()).isEqualTo(1);
                assertThat(e.totalCount()).isEqualTo(3);
                assertThat(e.failedIds()).containsExactly("b");
                assertThat(e.errorCode()).isEqualTo(SyncPartialFailureException.ERROR_CODE);
            });
        assertThat(manager.listStates(StateType.GLOBAL)).containsExactly("a", "c");
        assertThat(syncedEvents()).extracting(StateEvent::stateId).containsExactly("a", "c");
    }

    @Test
    void syncStates_완료_후_단발성_세션은_남지_않음() {
        seed("a", 1);

        coordinator.syncStates(manager, StateType.TOOL, StateType.GLOBAL, IdentityMapping.instance());

        assertThat(coordinator.getActiveSyncs()).isEmpty();
    }

    @Test
    void syncStates_원본과_대상이_같으면_거부함() {
        assertThatThrownBy(() -> coordinator.syncStates(manager, StateType.TOOL, StateType.TOOL, IdentityMapping.instance()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("must differ");
    }

    @Test
    void syncStates_대상_Provider가_없으면_거부함() {
        assertThatThrownBy(() -> coordinator.syncStates(manager, StateType.TOOL, StateType.SESSION, IdentityMapping.instance()))
            .isInstanceOf(NoProviderRegisteredException.class)
            .hasMessageContaining("SESSION");
    }

    // ============================================================
    // 2. 연속 동기화
    // ============================================================

    @Test
    void startContinuousSync_주기마다_전체_재조정함() {
        // given
        seed("a", 1);

        // when
        String syncId = coordinator.startContinuousSync(
            manager, StateType.TOOL, StateType.GLOBAL, IdentityMapping.instance(), INTERVAL
        );

        // then
        assertThat(syncId).isEqualTo(SYNC_ID);
        await().atMost(Duration.ofSeconds(5)).until(() -> manager.listStates(StateType.GLOBAL).contains("a"));

        seed("b", 2);
        await().atMost(Duration.ofSeconds(5))
            .until(() -> manager.listStates(StateType.GLOBAL).contains("b"));

        List<SyncSessionSnapshot> active = coordinator.getActiveSyncs();
        assertThat(active).hasSize(1);
        SyncSessionSnapshot snapshot = active.get(0);
        assertThat(snapshot.id()).isEqualTo(SYNC_ID);
        assertThat(snapshot.strategy()).isEqualTo(SyncStrategy.PERIODIC_FULL_RECONCILIATION);
        assertThat(snapshot.active()).isTrue();
        assertThat(snapshot.syncCount()).isGreaterThanOrEqualTo(2);
        assertThat(snapshot.lastSync()).isNotNull();
        assertThat(snapshot.errors()).isEmpty();
    }

    @Test
    void startContinuousSync_같은_쌍이_활성이면_DuplicateActiveSync() {
        coordinator.startContinuousSync(manager, StateType.TOOL, StateType.GLOBAL, IdentityMapping.instance(), INTERVAL);

        assertThatThrownBy(() -> coordinator.startContinuousSync(
            manager, StateType.TOOL, StateType.GLOBAL, IdentityMapping.instance(), INTERVAL))
            .isInstanceOf(DuplicateActiveSyncException.class)
            .hasMessageContaining(SYNC_ID);
    }

    @Test
    void startContinuousSync_간격이_양수가_아니면_거부함() {
        assertThatThrownBy(() -> coordinator.startContinuousSync(
            manager, StateType.TOOL, StateType.GLOBAL, IdentityMapping.instance(), Duration.ZERO))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("interval must be positive");
    }

    @Test
    void stopContinuousSync_이후에는_패스가_실행되지_않음() {
        // given
        seed("a", 1);
        String syncId = coordinator.startContinuousSync(
            manager, StateType.TOOL, StateType.GLOBAL, IdentityMapping.instance(), INTERVAL
        );
        await().atMost(Duration.ofSeconds(5)).until(() -> syncedEvents().size() >= 1);

        // when
        assertThat(coordinator.stopContinuousSync(syncId)).isTrue();

        // then: 진행 중이던 패스가 끝난 뒤 SYNCED 수가 더 이상 늘지 않음
        await().pollDelay(INTERVAL.multipliedBy(2)).atMost(Duration.ofSeconds(5)).until(() -> true);
        int afterStop = syncedEvents().size();
        await().during(INTERVAL.multipliedBy(4)).atMost(Duration.ofSeconds(5))
            .until(() -> syncedEvents().size() == afterStop);

        assertThat(coordinator.getActiveSyncs()).isEmpty();
        assertThat(coordinator.stopContinuousSync(syncId)).isFalse();
    }

    @Test
    void stopContinuousSync_알_수_없는_ID는_false() {
        assertThat(coordinator.stopContinuousSync("sync-unknown")).isFalse();
    }

    @Test
    void stop_후_같은_쌍을_다시_시작할_수_있음() {
        String first = coordinator.startContinuousSync(
            manager, StateType.TOOL, StateType.GLOBAL, IdentityMapping.instance(), INTERVAL
        );
        coordinator.stopContinuousSync(first);

        String second = coordinator.startContinuousSync(
            manager, StateType.TOOL, StateType.GLOBAL, IdentityMapping.instance(), INTERVAL
        );

        assertThat(second).isEqualTo(first);
        assertThat(coordinator.getActiveSyncs()).hasSize(1);
    }

    @Test
    void 연속_동기화_오류는_세션에_기록되고_스케줄은_유지됨() {
        // given
        manager.registerStateValidator(StateType.GLOBAL, new ToolStateValidator("mirror")
            .requireField("n", v -> !Integer.valueOf(2).equals(v), "must not be 2"));
        seed("a", 1);
        seed("b", 2);

        // when
        coordinator.startContinuousSync(manager, StateType.TOOL, StateType.GLOBAL, IdentityMapping.instance(), INTERVAL);

        // then
        await().atMost(Duration.ofSeconds(5)).until(() -> {
            List<SyncSessionSnapshot> active = coordinator.getActiveSyncs();
            return !active.isEmpty() && active.get(0).syncCount() >= 2;
        });
        SyncSessionSnapshot snapshot = coordinator.getActiveSyncs().get(0);
        assertThat(snapshot.errors()).isNotEmpty();
        assertThat(snapshot.errors()).allSatisfy(error -> assertThat(error).startsWith("b: "));
        assertThat(manager.listStates(StateType.GLOBAL)).containsExactly("a");
    }

    @Test
    void shutdown_모든_세션을_중지함() {
        coordinator.startContinuousSync(manager, StateType.TOOL, StateType.GLOBAL, IdentityMapping.instance(), INTERVAL);
        coordinator.startContinuousSync(manager, StateType.GLOBAL, StateType.TOOL, IdentityMapping.instance(), INTERVAL);
        assertThat(coordinator.getActiveSyncs()).hasSize(2);

        coordinator.shutdown();

        assertThat(coordinator.getActiveSyncs()).isEmpty();
    }

    private void seed(String id, int n) {
        manager.setState(StateType.TOOL, id, Map.of("n", n));
    }

    private List<StateEvent> syncedEvents() {
        return manager.eventStore().getEventsByType(StateType.GLOBAL, 10_000).stream()
            .filter(event -> event.type() == StateEventType.SYNCED)
            .toList();
    }

    private Map<String, Object> snapshotTarget() {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        for (String id : manager.listStates(StateType.GLOBAL)) {
            snapshot.put(id, manager.getState(StateType.GLOBAL, id));
        }
        return snapshot;
    }

    /**
     * 원본 문서에 mirrored=true를 추가하는 매핑.
     */
    private static final class MarkingMapping implements StateMapping {

        @Override
        public Object mapState(Object source) {
            Map<String, Object> mapped = new LinkedHashMap<>(Documents.copyOf((Map<?, ?>) source));
            mapped.put("mirrored", true);
            return mapped;
        }

        @Override
        public boolean supportsReverse() {
            return false;
        }

        @Override
        public Object reverseMap(Object target) {
            throw new UnsupportedOperationException("MarkingMapping is not reversible");
        }
    }
}

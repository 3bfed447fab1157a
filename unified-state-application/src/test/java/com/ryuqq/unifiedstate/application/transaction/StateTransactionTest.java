package com.ryuqq.unifiedstate.application.transaction;

import com.ryuqq.unifiedstate.adapter.inmemory.provider.InMemoryStateProvider;
import com.ryuqq.unifiedstate.adapter.inmemory.provider.WorkflowStateProvider;
import com.ryuqq.unifiedstate.application.manager.UnifiedStateManager;
import com.ryuqq.unifiedstate.core.domain.WorkflowState;
import com.ryuqq.unifiedstate.core.exception.StateValidationException;
import com.ryuqq.unifiedstate.core.model.StateType;
import com.ryuqq.unifiedstate.core.validation.WorkflowStateValidator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * StateTransaction 테스트.
 *
 * <p>쓰기는 순서대로 적용되며 실패 시 이미 적용된 쓰기는 되돌리지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class StateTransactionTest {

    private UnifiedStateManager manager;

    @BeforeEach
    void setUp() {
        manager = new UnifiedStateManager();
        manager.registerStateProvider(StateType.TOOL, InMemoryStateProvider.documents(StateType.TOOL));
        manager.registerStateProvider(StateType.WORKFLOW, new WorkflowStateProvider());
        manager.registerStateValidator(StateType.WORKFLOW, new WorkflowStateValidator());
    }

    @AfterEach
    void tearDown() {
        manager.close();
    }

    @Test
    void commit_모든_쓰기를_순서대로_적용함() {
        // given
        StateTransaction tx = manager.createStateTransaction()
            .set(StateType.TOOL, "t", Map.of("n", 1))
            .set(StateType.TOOL, "t", Map.of("n", 2))
            .set(StateType.WORKFLOW, "wf-1", WorkflowState.of("wf-1", "s-1", "build", "running", 10));

        // when
        tx.commit();

        // then
        assertThat(tx.status()).isEqualTo(TransactionStatus.COMMITTED);
        assertThat(tx.appliedCount()).isEqualTo(3);
        assertThat(manager.getState(StateType.TOOL, "t")).isEqualTo(Map.of("n", 2));
        assertThat(manager.getStateHistory(StateType.TOOL, "t", 10)).hasSize(2);
    }

    @Test
    void commit_중간_실패시_앞선_쓰기는_유지되고_이후_쓰기는_적용되지_않음() {
        // given
        StateTransaction tx = manager.createStateTransaction()
            .set(StateType.TOOL, "first", Map.of("n", 1))
            .set(StateType.WORKFLOW, "wf-1", WorkflowState.of("wf-1", "s-1", "build", "running", 150))
            .set(StateType.TOOL, "third", Map.of("n", 3));

        // when & then
        assertThatThrownBy(tx::commit).isInstanceOf(StateValidationException.class);
        assertThat(tx.status()).isEqualTo(TransactionStatus.FAILED);
        assertThat(tx.appliedCount()).isEqualTo(1);
        assertThat(tx.size()).isEqualTo(3);
        assertThat(manager.listStates(StateType.TOOL)).containsExactly("first");
        assertThat(manager.listStates(StateType.WORKFLOW)).isEmpty();
    }

    @Test
    void 종료된_트랜잭션은_재사용할_수_없음() {
        StateTransaction tx = manager.createStateTransaction().set(StateType.TOOL, "t", Map.of());
        tx.commit();

        assertThatThrownBy(() -> tx.set(StateType.TOOL, "u", Map.of()))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("Transaction already finished with status COMMITTED");
        assertThatThrownBy(tx::commit).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void 빈_트랜잭션_commit은_성공함() {
        StateTransaction tx = manager.createStateTransaction();

        tx.commit();

        assertThat(tx.status()).isEqualTo(TransactionStatus.COMMITTED);
        assertThat(tx.status().isTerminal()).isTrue();
        assertThat(TransactionStatus.PENDING.isTerminal()).isFalse();
    }
}

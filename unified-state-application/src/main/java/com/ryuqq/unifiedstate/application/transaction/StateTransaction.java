package com.ryuqq.unifiedstate.application.transaction;

import com.ryuqq.unifiedstate.application.manager.UnifiedStateManager;
import com.ryuqq.unifiedstate.core.model.StateType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 상태 쓰기 묶음.
 *
 * <p>{@link #set}으로 쓰기를 누적하고 {@link #commit()}에서 등록 순서대로
 * {@link UnifiedStateManager#setState}를 호출합니다. 각 쓰기는 개별적으로 검증/저장/이벤트 기록됩니다.</p>
 *
 * <p><strong>원자성 없음:</strong></p>
 * <ul>
 *   <li>첫 번째 실패에서 중단하고 해당 예외를 다시 던집니다.</li>
 *   <li>실패 이전에 적용된 쓰기는 되돌리지 않습니다. {@link #appliedCount()}로 적용된 개수를 확인할 수 있습니다.</li>
 *   <li>commit 이후(성공/실패 무관) 재사용은 {@link IllegalStateException}으로 거부됩니다.</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StateTransaction {

    private static final Logger log = LoggerFactory.getLogger(StateTransaction.class);

    private final UnifiedStateManager manager;
    private final List<PendingWrite> writes = new ArrayList<>();
    private TransactionStatus status = TransactionStatus.PENDING;
    private int appliedCount;

    /**
     * 생성자.
     *
     * @param manager 커밋 대상 매니저
     * @throws IllegalArgumentException manager가 null인 경우
     */
    public StateTransaction(UnifiedStateManager manager) {
        if (manager == null) {
            throw new IllegalArgumentException("manager cannot be null");
        }
        this.manager = manager;
    }

    /**
     * 쓰기 추가.
     *
     * @param stateType 상태 타입
     * @param stateId 상태 ID
     * @param value 저장할 값
     * @return this (체이닝용)
     * @throws IllegalStateException 이미 커밋된 경우
     */
    public synchronized StateTransaction set(StateType stateType, String stateId, Object value) {
        if (stateType == null) {
            throw new IllegalArgumentException("stateType cannot be null");
        }
        if (stateId == null) {
            throw new IllegalArgumentException("stateId cannot be null");
        }
        ensurePending();
        writes.add(new PendingWrite(stateType, stateId, value));
        return this;
    }

    /**
     * 누적된 쓰기를 순서대로 적용.
     *
     * @throws IllegalStateException 이미 커밋된 경우
     * @throws RuntimeException 첫 번째로 실패한 쓰기의 예외
     */
    public synchronized void commit() {
        ensurePending();
        for (PendingWrite write : writes) {
            try {
                manager.setState(write.stateType(), write.stateId(), write.value());
                appliedCount++;
            } catch (RuntimeException e) {
                status = TransactionStatus.FAILED;
                log.warn("Transaction failed at write {}/{} ({}:{}); {} write(s) already applied",
                    appliedCount + 1, writes.size(), write.stateType().id(), write.stateId(), appliedCount);
                throw e;
            }
        }
        status = TransactionStatus.COMMITTED;
        log.debug("Transaction committed {} write(s)", appliedCount);
    }

    /**
     * 현재 상태.
     */
    public synchronized TransactionStatus status() {
        return status;
    }

    /**
     * 누적된 쓰기 개수.
     */
    public synchronized int size() {
        return writes.size();
    }

    /**
     * 적용 완료된 쓰기 개수.
     */
    public synchronized int appliedCount() {
        return appliedCount;
    }

    private void ensurePending() {
        if (status.isTerminal()) {
            throw new IllegalStateException("Transaction already finished with status " + status);
        }
    }

    private record PendingWrite(StateType stateType, String stateId, Object value) {
    }
}

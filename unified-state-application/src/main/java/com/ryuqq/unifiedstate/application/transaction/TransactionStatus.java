package com.ryuqq.unifiedstate.application.transaction;

/**
 * 트랜잭션 상태.
 *
 * <pre>
 * PENDING ──commit() 성공──→ COMMITTED
 *    │
 *    └────commit() 실패──→ FAILED
 * </pre>
 *
 * <p>COMMITTED와 FAILED는 종료 상태이며 이후 set/commit 호출은 거부됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum TransactionStatus {

    /**
     * 쓰기 누적 중.
     */
    PENDING,

    /**
     * 모든 쓰기 적용 완료.
     */
    COMMITTED,

    /**
     * 일부 쓰기 적용 후 실패 (롤백 없음).
     */
    FAILED;

    /**
     * 종료 상태 여부.
     */
    public boolean isTerminal() {
        return this != PENDING;
    }
}

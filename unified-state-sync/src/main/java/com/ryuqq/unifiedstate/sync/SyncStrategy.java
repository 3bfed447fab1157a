package com.ryuqq.unifiedstate.sync;

/**
 * 동기화 전략.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum SyncStrategy {

    /**
     * 단발성 동기화 ({@code syncStates} 호출 1회).
     */
    ONE_SHOT,

    /**
     * 주기적 전체 재조정.
     *
     * <p>매 주기마다 원본 도메인의 모든 ID를 다시 매핑/저장합니다. 변경분만 전송하는 델타 동기화가 아닙니다.</p>
     */
    PERIODIC_FULL_RECONCILIATION
}

/**
 * 상태 도메인 간 동기화.
 *
 * <p><strong>핵심 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.unifiedstate.sync.StateSyncCoordinator} - 단발성/연속 동기화 실행</li>
 *   <li>{@link com.ryuqq.unifiedstate.sync.SyncSessionSnapshot} - 세션 관측용 불변 스냅샷</li>
 *   <li>{@link com.ryuqq.unifiedstate.sync.SyncCoordinatorConfig} - 스케줄러 설정</li>
 * </ul>
 *
 * <p>모든 패스는 best-effort이며, 연속 동기화는 주기적 전체 재조정입니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.unifiedstate.sync;

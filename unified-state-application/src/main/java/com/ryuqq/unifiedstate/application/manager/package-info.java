/**
 * 통합 상태 관리자 패키지.
 *
 * <p>StateType별 Provider/Validator/Migrator 레지스트리와 Observer 알림을 담당합니다.</p>
 *
 * <p><strong>핵심 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.unifiedstate.application.manager.UnifiedStateManager} - 상태 조회/변경 Facade</li>
 *   <li>{@link com.ryuqq.unifiedstate.application.manager.ObserverNotifier} - 제한된 스레드 풀 기반 알림 전파</li>
 *   <li>{@link com.ryuqq.unifiedstate.application.manager.StateManagerConfig} - 알림 풀 설정</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.ryuqq.unifiedstate.application.manager;

/**
 * 상태 식별 및 이벤트 모델 패키지.
 *
 * <p><strong>핵심 타입:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.unifiedstate.core.model.StateType} - 상태 도메인 (닫힌 집합)</li>
 *   <li>{@link com.ryuqq.unifiedstate.core.model.StateEventType} - 이벤트 종류</li>
 *   <li>{@link com.ryuqq.unifiedstate.core.model.StateEvent} - 불변 상태 변경 이벤트</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.ryuqq.unifiedstate.core.model;

/**
 * 상태 이벤트 저장소 패키지.
 *
 * <p>(stateType, stateId) 단위로 용량이 제한된 추가 전용 이벤트 로그와 보존 기간 기반 정리 작업을 제공합니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.unifiedstate.application.event;

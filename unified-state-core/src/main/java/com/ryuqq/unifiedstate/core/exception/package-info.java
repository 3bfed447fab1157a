/**
 * 상태 관리 예외 계층.
 *
 * <p>모든 예외는 {@link com.ryuqq.unifiedstate.core.exception.StateException}을 상속하며
 * 고정된 에러 코드(STATE-001 ~ STATE-008, STATE-404)를 가집니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.unifiedstate.core.exception;

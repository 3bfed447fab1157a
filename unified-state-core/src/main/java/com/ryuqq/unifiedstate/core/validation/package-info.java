/**
 * 도메인별 {@link com.ryuqq.unifiedstate.core.spi.StateValidator} 구현.
 *
 * <p>Validator는 순수 함수이며 상태를 변경하지 않습니다. 여러 규칙은
 * {@link com.ryuqq.unifiedstate.core.validation.CompositeValidator}로 순서대로 묶을 수 있습니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.unifiedstate.core.validation;

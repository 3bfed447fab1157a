/**
 * 순차 적용 트랜잭션 (롤백 없음).
 *
 * @since 1.0.0
 */
package com.ryuqq.unifiedstate.application.transaction;

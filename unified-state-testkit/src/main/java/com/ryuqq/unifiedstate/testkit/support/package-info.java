/**
 * 테스트용 Observer/CheckpointManager 기록 구현.
 *
 * @since 1.0.0
 */
package com.ryuqq.unifiedstate.testkit.support;

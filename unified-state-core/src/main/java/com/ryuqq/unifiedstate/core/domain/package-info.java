/**
 * 도메인별 상태 페이로드 (Session, Workflow, Conversation).
 *
 * <p>Tool/Global 도메인은 {@code Map<String, Object>} 문서를 그대로 저장합니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.unifiedstate.core.domain;

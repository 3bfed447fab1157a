package com.ryuqq.unifiedstate.core.validation;

import com.ryuqq.unifiedstate.core.domain.SessionState;
import com.ryuqq.unifiedstate.core.exception.StateValidationException;
import com.ryuqq.unifiedstate.core.model.StateType;
import com.ryuqq.unifiedstate.core.spi.StateValidator;

/**
 * 세션 상태 Validator.
 *
 * <p><strong>검증 규칙:</strong></p>
 * <ul>
 *   <li>sessionId: null 또는 빈 문자열 불가</li>
 *   <li>createdAt: null 불가</li>
 *   <li>diskUsage: 0 이상</li>
 *   <li>diskUsage: 세션의 maxDiskUsage 이하 (maxDiskUsage &gt; 0인 경우)</li>
 *   <li>diskUsage: 전역 상한 이하 (생성자에서 지정한 경우)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SessionStateValidator implements StateValidator<SessionState> {

    private final long globalMaxDiskUsage;

    /**
     * 전역 상한 없이 생성.
     */
    public SessionStateValidator() {
        this(0L);
    }

    /**
     * 전역 디스크 상한을 지정하여 생성.
     *
     * @param globalMaxDiskUsage 모든 세션에 적용할 최대 디스크 사용량 (0이면 미적용)
     * @throws IllegalArgumentException globalMaxDiskUsage가 음수인 경우
     */
    public SessionStateValidator(long globalMaxDiskUsage) {
        if (globalMaxDiskUsage < 0) {
            throw new IllegalArgumentException(
                "globalMaxDiskUsage cannot be negative (current: " + globalMaxDiskUsage + ")"
            );
        }
        this.globalMaxDiskUsage = globalMaxDiskUsage;
    }

    @Override
    public Class<SessionState> valueType() {
        return SessionState.class;
    }

    @Override
    public void validate(StateType stateType, SessionState state) {
        if (state.sessionId() == null || state.sessionId().isBlank()) {
            throw new StateValidationException("session ID is required");
        }
        if (state.createdAt() == null) {
            throw new StateValidationException("session creation time is required");
        }
        if (state.diskUsage() < 0) {
            throw new StateValidationException("disk usage cannot be negative");
        }
        if (state.hasExceededDiskQuota()) {
            throw new StateValidationException(String.format(
                "disk usage %d exceeds maximum allowed %d", state.diskUsage(), state.maxDiskUsage()));
        }
        if (globalMaxDiskUsage > 0 && state.diskUsage() > globalMaxDiskUsage) {
            throw new StateValidationException(String.format(
                "disk usage %d exceeds configured limit %d", state.diskUsage(), globalMaxDiskUsage));
        }
    }
}

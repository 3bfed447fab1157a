package com.ryuqq.unifiedstate.core.validation;

import com.ryuqq.unifiedstate.core.exception.StateValidationException;
import com.ryuqq.unifiedstate.core.model.Documents;
import com.ryuqq.unifiedstate.core.model.StateType;
import com.ryuqq.unifiedstate.core.spi.StateValidator;

import java.util.Map;

/**
 * 전역 상태 문서 Validator.
 *
 * <p>키는 null이거나 빈 문자열일 수 없습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class GlobalStateValidator implements StateValidator<Map<String, Object>> {

    @Override
    public Class<Map<String, Object>> valueType() {
        return Documents.TYPE;
    }

    @Override
    public void validate(StateType stateType, Map<String, Object> state) {
        for (Object key : state.keySet()) {
            if (!(key instanceof String name) || name.isBlank()) {
                throw new StateValidationException("global state keys must be non-blank strings, found: " + key);
            }
        }
    }
}

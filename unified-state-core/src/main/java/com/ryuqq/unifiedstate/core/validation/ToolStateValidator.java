package com.ryuqq.unifiedstate.core.validation;

import com.ryuqq.unifiedstate.core.exception.StateValidationException;
import com.ryuqq.unifiedstate.core.model.Documents;
import com.ryuqq.unifiedstate.core.model.StateType;
import com.ryuqq.unifiedstate.core.spi.StateValidator;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Predicate;

/**
 * 도구 결과 문서 Validator.
 *
 * <p>필드별 규칙을 등록하고, 문서에 해당 필드가 없거나 규칙을 만족하지 않으면 거부합니다.
 * 등록되지 않은 필드는 검사하지 않습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ToolStateValidator validator = new ToolStateValidator("build_image")
 *     .requireField("imageRef", v -&gt; v instanceof String s &amp;&amp; !s.isBlank(), "must be a non-blank string")
 *     .requireField("exitCode", v -&gt; v instanceof Integer, "must be an integer");
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ToolStateValidator implements StateValidator<Map<String, Object>> {

    private final String toolName;
    private final Map<String, FieldRule> rules = new LinkedHashMap<>();

    /**
     * 생성자.
     *
     * @param toolName 도구 이름 (오류 메시지에 사용)
     * @throws IllegalArgumentException toolName이 null이거나 빈 문자열인 경우
     */
    public ToolStateValidator(String toolName) {
        if (toolName == null || toolName.isBlank()) {
            throw new IllegalArgumentException("toolName cannot be null or blank");
        }
        this.toolName = toolName;
    }

    /**
     * 필드 규칙 등록 (같은 필드는 덮어씀).
     *
     * @param fieldName 필드 이름
     * @param rule 값 검사 조건
     * @param description 위반 시 메시지
     * @return this (체이닝)
     */
    public synchronized ToolStateValidator requireField(String fieldName, Predicate<Object> rule, String description) {
        if (fieldName == null || fieldName.isBlank()) {
            throw new IllegalArgumentException("fieldName cannot be null or blank");
        }
        if (rule == null) {
            throw new IllegalArgumentException("rule cannot be null");
        }
        rules.put(fieldName, new FieldRule(rule, description == null ? "is invalid" : description));
        return this;
    }

    @Override
    public Class<Map<String, Object>> valueType() {
        return Documents.TYPE;
    }

    @Override
    public synchronized void validate(StateType stateType, Map<String, Object> state) {
        for (Map.Entry<String, FieldRule> entry : rules.entrySet()) {
            String fieldName = entry.getKey();
            if (!state.containsKey(fieldName)) {
                throw new StateValidationException(
                    String.format("field %s not found in %s tool state", fieldName, toolName));
            }
            FieldRule rule = entry.getValue();
            if (!rule.condition().test(state.get(fieldName))) {
                throw new StateValidationException(
                    String.format("validation failed for field %s of %s: %s", fieldName, toolName, rule.description()));
            }
        }
    }

    private record FieldRule(Predicate<Object> condition, String description) {
    }
}

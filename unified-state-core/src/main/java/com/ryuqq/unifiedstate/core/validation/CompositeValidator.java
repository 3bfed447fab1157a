package com.ryuqq.unifiedstate.core.validation;

import com.ryuqq.unifiedstate.core.exception.StateValidationException;
import com.ryuqq.unifiedstate.core.model.StateType;
import com.ryuqq.unifiedstate.core.spi.StateValidator;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 여러 Validator를 순서대로 실행하는 Validator.
 *
 * <p>첫 번째 위반에서 즉시 실패하며 (fail-fast), 실패한 Validator의 순번을 메시지에 포함합니다.</p>
 *
 * @param <T> 검증 대상 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class CompositeValidator<T> implements StateValidator<T> {

    private final Class<T> valueType;
    private final List<StateValidator<? super T>> validators;

    private CompositeValidator(Class<T> valueType, List<StateValidator<? super T>> validators) {
        if (valueType == null) {
            throw new IllegalArgumentException("valueType cannot be null");
        }
        if (validators == null || validators.isEmpty()) {
            throw new IllegalArgumentException("validators cannot be null or empty");
        }
        for (StateValidator<? super T> validator : validators) {
            if (validator == null) {
                throw new IllegalArgumentException("validators cannot contain null");
            }
        }
        this.valueType = valueType;
        this.validators = List.copyOf(new ArrayList<>(validators));
    }

    /**
     * CompositeValidator 생성.
     *
     * @param valueType 검증 대상 클래스
     * @param validators 실행 순서대로 나열한 Validator
     * @return CompositeValidator 인스턴스
     */
    @SafeVarargs
    public static <T> CompositeValidator<T> of(Class<T> valueType, StateValidator<? super T>... validators) {
        return new CompositeValidator<>(valueType, validators == null ? null : Arrays.asList(validators));
    }

    @Override
    public Class<T> valueType() {
        return valueType;
    }

    @Override
    public void validate(StateType stateType, T value) {
        for (int i = 0; i < validators.size(); i++) {
            try {
                validators.get(i).validate(stateType, value);
            } catch (StateValidationException e) {
                throw new StateValidationException("validator " + i + " failed: " + e.getMessage(), e);
            }
        }
    }
}

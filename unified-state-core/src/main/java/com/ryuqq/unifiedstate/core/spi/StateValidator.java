package com.ryuqq.unifiedstate.core.spi;

import com.ryuqq.unifiedstate.core.model.StateType;

/**
 * Pure check run before a value is written.
 *
 * <p>Validators must not mutate the value or any shared state. A violation is reported
 * by throwing {@link com.ryuqq.unifiedstate.core.exception.StateValidationException};
 * returning normally means the value is accepted.</p>
 *
 * @param <T> validated value type
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface StateValidator<T> {

    /**
     * Returns the class of values this validator understands.
     *
     * @return value class
     */
    Class<T> valueType();

    /**
     * Validates {@code value} for {@code stateType}.
     *
     * @param stateType domain being written
     * @param value candidate value
     * @throws com.ryuqq.unifiedstate.core.exception.StateValidationException if the value is rejected
     */
    void validate(StateType stateType, T value);
}

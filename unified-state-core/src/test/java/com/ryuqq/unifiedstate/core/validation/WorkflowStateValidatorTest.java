package com.ryuqq.unifiedstate.core.validation;

import com.ryuqq.unifiedstate.core.domain.WorkflowState;
import com.ryuqq.unifiedstate.core.exception.StateValidationException;
import com.ryuqq.unifiedstate.core.model.StateType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * WorkflowStateValidator 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class WorkflowStateValidatorTest {

    private final WorkflowStateValidator validator = new WorkflowStateValidator();

    @Test
    void validate_ProgressWithinRange_Passes() {
        assertDoesNotThrow(() -> validator.validate(StateType.WORKFLOW, WorkflowState.of("wf", "s", "build", "running", 0)));
        assertDoesNotThrow(() -> validator.validate(StateType.WORKFLOW, WorkflowState.of("wf", "s", "build", "running", 100)));
    }

    @Test
    void validate_ProgressOver100_Fails() {
        StateValidationException exception = assertThrows(
            StateValidationException.class,
            () -> validator.validate(StateType.WORKFLOW, WorkflowState.of("wf", "s", "build", "running", 150))
        );
        assertTrue(exception.getMessage().contains("150"));
        assertEquals("STATE-002", exception.errorCode());
    }

    @Test
    void validate_NegativeOrNaNProgress_Fails() {
        assertThrows(StateValidationException.class,
            () -> validator.validate(StateType.WORKFLOW, WorkflowState.of("wf", "s", "build", "running", -1)));
        assertThrows(StateValidationException.class,
            () -> validator.validate(StateType.WORKFLOW, WorkflowState.of("wf", "s", "build", "running", Double.NaN)));
    }

    @Test
    void validate_MissingSessionOrStage_Fails() {
        assertThrows(StateValidationException.class,
            () -> validator.validate(StateType.WORKFLOW, WorkflowState.of("wf", "", "build", "running", 10)));
        assertThrows(StateValidationException.class,
            () -> validator.validate(StateType.WORKFLOW, WorkflowState.of("wf", "s", null, "running", 10)));
    }
}

package com.ryuqq.unifiedstate.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * StateType 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class StateTypeTest {

    @Test
    void id_ReturnsLowerCaseExternalId() {
        assertEquals("session", StateType.SESSION.id());
        assertEquals("workflow", StateType.WORKFLOW.id());
        assertEquals("conversation", StateType.CONVERSATION.id());
        assertEquals("tool", StateType.TOOL.id());
        assertEquals("global", StateType.GLOBAL.id());
    }

    @Test
    void fromId_KnownId_ReturnsType() {
        for (StateType type : StateType.values()) {
            assertEquals(type, StateType.fromId(type.id()));
        }
    }

    @Test
    void fromId_UnknownId_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> StateType.fromId("metrics")
        );
        assertTrue(exception.getMessage().contains("metrics"));
    }

    @Test
    void fromId_BlankId_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> StateType.fromId(" "));
        assertThrows(IllegalArgumentException.class, () -> StateType.fromId(null));
    }
}

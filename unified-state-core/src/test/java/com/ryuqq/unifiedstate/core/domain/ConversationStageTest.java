package com.ryuqq.unifiedstate.core.domain;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ConversationStage 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ConversationStageTest {

    @Test
    void fromName_IsCaseInsensitive() {
        assertEquals(ConversationStage.BUILDING, ConversationStage.fromName("building"));
        assertEquals(ConversationStage.DEPLOYING, ConversationStage.fromName(" Deploying "));
    }

    @Test
    void fromName_UnknownStage_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> ConversationStage.fromName("testing")
        );
        assertTrue(exception.getMessage().contains("testing"));
    }
}

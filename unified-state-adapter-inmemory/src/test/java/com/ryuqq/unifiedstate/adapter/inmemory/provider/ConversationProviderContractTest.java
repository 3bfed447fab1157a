package com.ryuqq.unifiedstate.adapter.inmemory.provider;

import com.ryuqq.unifiedstate.core.domain.ConversationStage;
import com.ryuqq.unifiedstate.core.domain.ConversationState;
import com.ryuqq.unifiedstate.core.model.StateType;
import com.ryuqq.unifiedstate.core.spi.StateProvider;
import com.ryuqq.unifiedstate.testkit.contract.AbstractStateProviderContractTest;

import java.time.Instant;
import java.util.Map;

/**
 * Contract Tests for {@link InMemoryStateProvider} serving CONVERSATION.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ConversationProviderContractTest extends AbstractStateProviderContractTest<ConversationState> {

    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

    @Override
    protected StateProvider<ConversationState> createProvider() {
        return new InMemoryStateProvider<>(StateType.CONVERSATION, ConversationState.class);
    }

    @Override
    protected ConversationState sampleValue(String id, int variant) {
        ConversationStage stage = ConversationStage.values()[variant % ConversationStage.values().length];
        return new ConversationState(id, "session-1", stage, Map.of("turn", variant), NOW);
    }
}

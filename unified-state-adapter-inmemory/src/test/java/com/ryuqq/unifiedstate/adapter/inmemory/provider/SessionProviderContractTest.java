package com.ryuqq.unifiedstate.adapter.inmemory.provider;

import com.ryuqq.unifiedstate.adapter.inmemory.session.InMemorySessionManager;
import com.ryuqq.unifiedstate.core.domain.SessionState;
import com.ryuqq.unifiedstate.core.spi.StateProvider;
import com.ryuqq.unifiedstate.testkit.contract.AbstractStateProviderContractTest;

import java.time.Instant;

/**
 * Contract Tests for {@link SessionStateProvider} backed by {@link InMemorySessionManager}.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class SessionProviderContractTest extends AbstractStateProviderContractTest<SessionState> {

    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

    @Override
    protected StateProvider<SessionState> createProvider() {
        return new SessionStateProvider(new InMemorySessionManager());
    }

    @Override
    protected SessionState sampleValue(String id, int variant) {
        return SessionState.create(id, "/workspaces/" + id, NOW).withDiskUsage(variant * 1024L);
    }
}

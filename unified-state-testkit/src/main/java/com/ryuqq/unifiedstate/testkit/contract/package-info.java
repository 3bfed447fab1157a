/**
 * Reusable contract tests for SPI implementations.
 *
 * <p>Adapter modules extend {@link com.ryuqq.unifiedstate.testkit.contract.AbstractStateProviderContractTest}
 * to verify their providers against the shared {@link com.ryuqq.unifiedstate.core.spi.StateProvider} contract.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.unifiedstate.testkit.contract;

/**
 * In-memory StateProvider implementations.
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.unifiedstate.adapter.inmemory.provider.InMemoryStateProvider}:
 *       Lock-guarded map provider for CONVERSATION, TOOL and GLOBAL</li>
 *   <li>{@link com.ryuqq.unifiedstate.adapter.inmemory.provider.SessionStateProvider}:
 *       Delegates to a {@link com.ryuqq.unifiedstate.core.spi.SessionManager}</li>
 *   <li>{@link com.ryuqq.unifiedstate.adapter.inmemory.provider.WorkflowStateProvider}:
 *       In-memory workflow state with checkpoint-on-write</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Suitable for tests, single-process deployments and contract tests</li>
 * </ul>
 *
 * @see com.ryuqq.unifiedstate.core.spi.StateProvider
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.unifiedstate.adapter.inmemory.provider;

/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the capability interfaces that state domains implement and the
 * boundary contracts of the collaborators outside this subsystem.</p>
 *
 * <h2>Capability Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.unifiedstate.core.spi.StateProvider} - Typed CRUD + list for one StateType</li>
 *   <li>{@link com.ryuqq.unifiedstate.core.spi.StateValidator} - Pure pre-write check</li>
 *   <li>{@link com.ryuqq.unifiedstate.core.spi.StateMigrator} - Schema version transformation</li>
 *   <li>{@link com.ryuqq.unifiedstate.core.spi.StateMapping} - Cross-domain transform used by sync</li>
 *   <li>{@link com.ryuqq.unifiedstate.core.spi.StateObserver} - Change notification sink</li>
 * </ul>
 *
 * <h2>Collaborator Contracts</h2>
 * <ul>
 *   <li>{@link com.ryuqq.unifiedstate.core.spi.SessionManager} - Session CRUD keyed by session ID</li>
 *   <li>{@link com.ryuqq.unifiedstate.core.spi.CheckpointManager} - Workflow snapshot persistence</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core defines interfaces, adapters provide implementations</li>
 *   <li><strong>Dependency Inversion:</strong> Core does not depend on infrastructure</li>
 *   <li><strong>Pluggability:</strong> One implementation per StateType, replaceable at startup</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.unifiedstate.core.spi;

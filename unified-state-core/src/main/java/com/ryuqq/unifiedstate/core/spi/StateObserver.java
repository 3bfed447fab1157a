package com.ryuqq.unifiedstate.core.spi;

import com.ryuqq.unifiedstate.core.model.StateEvent;

/**
 * Receives state change events after they have been persisted and logged.
 *
 * <p>Delivery is fire-and-forget: no acknowledgment, no retry, no ordering across
 * observers, and events in flight are lost if the process stops. Exceptions thrown
 * from {@link #onStateChange} are logged by the notifier and never reach the caller
 * that made the change.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface StateObserver {

    /**
     * Returns an identifier used in logs.
     *
     * @return observer ID
     */
    String getId();

    /**
     * Inactive observers are skipped during fan-out.
     *
     * @return true if the observer should receive events
     */
    default boolean isActive() {
        return true;
    }

    /**
     * Handles one event.
     *
     * @param event state event
     * @throws Exception any failure; logged and discarded
     */
    void onStateChange(StateEvent event) throws Exception;
}

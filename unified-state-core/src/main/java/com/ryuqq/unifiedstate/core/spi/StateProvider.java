package com.ryuqq.unifiedstate.core.spi;

import com.ryuqq.unifiedstate.core.model.StateType;

import java.util.List;

/**
 * Pluggable backing store for one {@link StateType}.
 *
 * <p>A provider exclusively owns its backing store and its own locking discipline.
 * The manager holds no per-ID lock above the provider, so concurrent calls for the
 * same ID are only as linearizable as the provider makes them.</p>
 *
 * <p><strong>Typed Values:</strong></p>
 * <p>{@link #valueType()} declares the class of values this provider stores. The manager
 * rejects any write whose value is not an instance of it before calling a validator or
 * the provider, so implementations never receive a value of the wrong type.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: all methods may be called concurrently</li>
 *   <li>{@link #getState} throws {@link com.ryuqq.unifiedstate.core.exception.StateNotFoundException} for unknown IDs</li>
 *   <li>{@link #deleteState} is idempotent for unknown IDs</li>
 *   <li>{@link #listStates} returns a snapshot, never a live view</li>
 * </ul>
 *
 * @param <T> stored value type
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface StateProvider<T> {

    /**
     * Returns the domain this provider serves.
     *
     * @return state type
     */
    StateType stateType();

    /**
     * Returns the class of values accepted by this provider.
     *
     * @return value class
     */
    Class<T> valueType();

    /**
     * Reads the value stored under {@code id}.
     *
     * @param id state ID
     * @return stored value, never null
     * @throws com.ryuqq.unifiedstate.core.exception.StateNotFoundException if nothing is stored under id
     */
    T getState(String id);

    /**
     * Stores {@code value} under {@code id}, replacing any previous value.
     *
     * @param id state ID
     * @param value value to store
     */
    void setState(String id, T value);

    /**
     * Removes the value stored under {@code id}.
     *
     * @param id state ID
     */
    void deleteState(String id);

    /**
     * Lists every ID currently stored.
     *
     * @return snapshot of IDs (may be empty)
     */
    List<String> listStates();
}

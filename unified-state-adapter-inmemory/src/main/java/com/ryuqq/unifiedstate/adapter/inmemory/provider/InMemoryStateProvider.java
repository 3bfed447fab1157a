package com.ryuqq.unifiedstate.adapter.inmemory.provider;

import com.ryuqq.unifiedstate.core.exception.StateNotFoundException;
import com.ryuqq.unifiedstate.core.model.Documents;
import com.ryuqq.unifiedstate.core.model.StateType;
import com.ryuqq.unifiedstate.core.spi.StateProvider;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.UnaryOperator;

/**
 * In-memory implementation of {@link StateProvider} for domains without an external owner.
 *
 * <p>Backs the CONVERSATION, TOOL and GLOBAL domains. Values are kept in insertion order so
 * {@link #listStates()} is deterministic.</p>
 *
 * <p>Each write passes through a snapshot function before it is stored. Document providers
 * created by {@link #documents(StateType)} store an immutable deep copy, so later changes to the
 * caller's map never reach the stored value and {@link #getState(String)} hands out read-only
 * documents.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>states:</strong> LinkedHashMap&lt;String, T&gt; guarded by a ReentrantReadWriteLock</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Non-document values are stored by reference; they are expected to be immutable records</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * manager.registerStateProvider(StateType.TOOL, InMemoryStateProvider.documents(StateType.TOOL));
 * manager.registerStateProvider(StateType.CONVERSATION,
 *     new InMemoryStateProvider&lt;&gt;(StateType.CONVERSATION, ConversationState.class));
 * </pre>
 *
 * @param <T> stored value type
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryStateProvider<T> implements StateProvider<T> {

    private final StateType stateType;
    private final Class<T> valueType;
    private final UnaryOperator<T> snapshot;
    private final Map<String, T> states;
    private final ReadWriteLock lock;

    /**
     * Creates an empty provider.
     *
     * @param stateType domain served by this provider
     * @param valueType class of stored values
     * @throws IllegalArgumentException if an argument is null
     */
    public InMemoryStateProvider(StateType stateType, Class<T> valueType) {
        this(stateType, valueType, UnaryOperator.identity());
    }

    /**
     * Creates an empty provider that stores {@code snapshot.apply(value)} on every write.
     *
     * @param stateType domain served by this provider
     * @param valueType class of stored values
     * @param snapshot copy applied to incoming values
     * @throws IllegalArgumentException if an argument is null
     */
    public InMemoryStateProvider(StateType stateType, Class<T> valueType, UnaryOperator<T> snapshot) {
        if (stateType == null) {
            throw new IllegalArgumentException("stateType cannot be null");
        }
        if (valueType == null) {
            throw new IllegalArgumentException("valueType cannot be null");
        }
        if (snapshot == null) {
            throw new IllegalArgumentException("snapshot cannot be null");
        }
        this.stateType = stateType;
        this.valueType = valueType;
        this.snapshot = snapshot;
        this.states = new LinkedHashMap<>();
        this.lock = new ReentrantReadWriteLock();
    }

    /**
     * Creates a provider storing {@code Map<String, Object>} documents (TOOL, GLOBAL).
     *
     * @param stateType domain served by this provider
     * @return document provider
     */
    public static InMemoryStateProvider<Map<String, Object>> documents(StateType stateType) {
        return new InMemoryStateProvider<>(stateType, Documents.TYPE, Documents::copyOf);
    }

    @Override
    public StateType stateType() {
        return stateType;
    }

    @Override
    public Class<T> valueType() {
        return valueType;
    }

    @Override
    public T getState(String id) {
        requireId(id);
        lock.readLock().lock();
        try {
            T value = states.get(id);
            if (value == null) {
                throw new StateNotFoundException(stateType, id);
            }
            return value;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void setState(String id, T value) {
        requireId(id);
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        T stored = snapshot.apply(value);
        lock.writeLock().lock();
        try {
            states.put(id, stored);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void deleteState(String id) {
        requireId(id);
        lock.writeLock().lock();
        try {
            states.remove(id);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<String> listStates() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(states.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns the number of stored values.
     */
    public int size() {
        lock.readLock().lock();
        try {
            return states.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Removes every stored value.
     */
    public void clear() {
        lock.writeLock().lock();
        try {
            states.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    private static void requireId(String id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
    }
}

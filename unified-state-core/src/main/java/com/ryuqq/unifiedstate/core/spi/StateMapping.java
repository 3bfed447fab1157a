package com.ryuqq.unifiedstate.core.spi;

/**
 * Pure transform from a value of one domain to a value of another.
 *
 * <p>Used by the sync coordinator to derive target state from source state.
 * Implementations must be side-effect free; a sync pass may call them any number of times.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface StateMapping {

    /**
     * Maps a source value to a target value.
     *
     * @param source source value
     * @return target value
     */
    Object mapState(Object source);

    /**
     * Reports whether {@link #reverseMap(Object)} is supported.
     *
     * @return true if the mapping can be reversed
     */
    boolean supportsReverse();

    /**
     * Maps a target value back to a source value.
     *
     * @param target target value
     * @return source value
     * @throws UnsupportedOperationException if {@link #supportsReverse()} is false
     */
    Object reverseMap(Object target);
}

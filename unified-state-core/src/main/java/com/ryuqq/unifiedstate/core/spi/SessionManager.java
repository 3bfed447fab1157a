package com.ryuqq.unifiedstate.core.spi;

import com.ryuqq.unifiedstate.core.domain.SessionState;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Session CRUD collaborator backing the SESSION domain.
 *
 * <p>The session manager lives outside this subsystem; the session provider delegates
 * every read and write to it.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface SessionManager {

    /**
     * Looks up a session.
     *
     * @param sessionId session ID
     * @return session snapshot, or empty if unknown
     */
    Optional<SessionState> getSession(String sessionId);

    /**
     * Registers a new session.
     *
     * @param session initial session snapshot
     * @throws IllegalStateException if a session with the same ID already exists
     */
    void createSession(SessionState session);

    /**
     * Applies {@code mutator} to an existing session.
     *
     * @param sessionId session ID
     * @param mutator function producing the next snapshot from the current one
     * @throws IllegalStateException if the session does not exist
     */
    void updateSession(String sessionId, UnaryOperator<SessionState> mutator);

    /**
     * Removes a session. Unknown IDs are ignored.
     *
     * @param sessionId session ID
     */
    void deleteSession(String sessionId);

    /**
     * Lists sessions matching {@code filter}.
     *
     * @param filter session filter
     * @return matching sessions
     */
    List<SessionState> listSessions(Predicate<SessionState> filter);
}

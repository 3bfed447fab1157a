package com.ryuqq.unifiedstate.adapter.inmemory.session;

import com.ryuqq.unifiedstate.core.domain.SessionState;
import com.ryuqq.unifiedstate.core.spi.SessionManager;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link SessionManager} for testing and reference purposes.
 *
 * <p>Sessions are kept in a {@link ConcurrentHashMap}; updates use
 * {@link ConcurrentHashMap#computeIfPresent} so concurrent mutators of one session are serialized.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemorySessionManager implements SessionManager {

    private final ConcurrentHashMap<String, SessionState> sessions = new ConcurrentHashMap<>();

    @Override
    public Optional<SessionState> getSession(String sessionId) {
        if (sessionId == null) {
            throw new IllegalArgumentException("sessionId cannot be null");
        }
        return Optional.ofNullable(sessions.get(sessionId));
    }

    @Override
    public void createSession(SessionState session) {
        if (session == null) {
            throw new IllegalArgumentException("session cannot be null");
        }
        if (session.sessionId() == null) {
            throw new IllegalArgumentException("session.sessionId cannot be null");
        }
        SessionState existing = sessions.putIfAbsent(session.sessionId(), session);
        if (existing != null) {
            throw new IllegalStateException("Session already exists: " + session.sessionId());
        }
    }

    @Override
    public void updateSession(String sessionId, UnaryOperator<SessionState> mutator) {
        if (sessionId == null) {
            throw new IllegalArgumentException("sessionId cannot be null");
        }
        if (mutator == null) {
            throw new IllegalArgumentException("mutator cannot be null");
        }
        SessionState updated = sessions.computeIfPresent(sessionId, (id, current) -> {
            SessionState next = mutator.apply(current);
            if (next == null) {
                throw new IllegalStateException("mutator returned null for session " + id);
            }
            return next;
        });
        if (updated == null) {
            throw new IllegalStateException("Session not found: " + sessionId);
        }
    }

    @Override
    public void deleteSession(String sessionId) {
        if (sessionId == null) {
            throw new IllegalArgumentException("sessionId cannot be null");
        }
        sessions.remove(sessionId);
    }

    @Override
    public List<SessionState> listSessions(Predicate<SessionState> filter) {
        if (filter == null) {
            throw new IllegalArgumentException("filter cannot be null");
        }
        return sessions.values().stream()
            .filter(filter)
            .sorted(Comparator.comparing(SessionState::sessionId))
            .collect(Collectors.toList());
    }
}

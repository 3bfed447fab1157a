package com.ryuqq.unifiedstate.adapter.inmemory.provider;

import com.ryuqq.unifiedstate.core.domain.SessionState;
import com.ryuqq.unifiedstate.core.exception.StateNotFoundException;
import com.ryuqq.unifiedstate.core.model.StateType;
import com.ryuqq.unifiedstate.core.spi.SessionManager;
import com.ryuqq.unifiedstate.core.spi.StateProvider;

import java.util.List;
import java.util.stream.Collectors;

/**
 * SESSION 도메인 Provider.
 *
 * <p>자체 저장소 없이 모든 읽기/쓰기를 {@link SessionManager}에 위임합니다.
 * 동시성은 SessionManager 구현이 책임집니다.</p>
 *
 * <p><strong>setState 동작:</strong></p>
 * <ul>
 *   <li>세션이 있으면 updateSession으로 스냅샷 교체</li>
 *   <li>세션이 없으면 createSession으로 신규 등록</li>
 *   <li>id와 state.sessionId()가 다르면 거부</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class SessionStateProvider implements StateProvider<SessionState> {

    private final SessionManager sessionManager;

    /**
     * 생성자.
     *
     * @param sessionManager 세션 관리자
     * @throws IllegalArgumentException sessionManager가 null인 경우
     */
    public SessionStateProvider(SessionManager sessionManager) {
        if (sessionManager == null) {
            throw new IllegalArgumentException("sessionManager cannot be null");
        }
        this.sessionManager = sessionManager;
    }

    @Override
    public StateType stateType() {
        return StateType.SESSION;
    }

    @Override
    public Class<SessionState> valueType() {
        return SessionState.class;
    }

    @Override
    public SessionState getState(String id) {
        return sessionManager.getSession(id)
            .orElseThrow(() -> new StateNotFoundException(StateType.SESSION, id));
    }

    @Override
    public void setState(String id, SessionState value) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        if (!id.equals(value.sessionId())) {
            throw new IllegalArgumentException(
                "session ID mismatch: key=" + id + ", value=" + value.sessionId()
            );
        }
        if (sessionManager.getSession(id).isPresent()) {
            sessionManager.updateSession(id, current -> value);
        } else {
            sessionManager.createSession(value);
        }
    }

    @Override
    public void deleteState(String id) {
        sessionManager.deleteSession(id);
    }

    @Override
    public List<String> listStates() {
        return sessionManager.listSessions(session -> true).stream()
            .map(SessionState::sessionId)
            .collect(Collectors.toList());
    }
}

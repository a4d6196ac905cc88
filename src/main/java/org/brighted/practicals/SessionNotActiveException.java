package org.brighted.practicals;

import org.brighted.runtime.decisions.EngineException;
import org.brighted.runtime.model.SessionState;

/**
 * Thrown when a request needs an active session but the session is paused or finished.
 */
public class SessionNotActiveException extends EngineException {

    private final String sessionId;
    private final SessionState state;

    public SessionNotActiveException(String sessionId, SessionState state) {
        super("Session " + sessionId + " is " + state.name().toLowerCase());
        this.sessionId = sessionId;
        this.state = state;
    }

    public String getSessionId() {
        return sessionId;
    }

    public SessionState getState() {
        return state;
    }
}

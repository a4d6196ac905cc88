package org.brighted.store.api;

/**
 * Thrown when a session does not exist or is not visible to the requesting user.
 */
public class SessionNotFoundException extends StoreException {

    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super("Session not found: " + sessionId);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}

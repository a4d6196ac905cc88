package org.brighted.runtime.model;

/**
 * Lifecycle of a play session. Finished sessions are archived, never deleted.
 */
public enum SessionState {
    ACTIVE,
    PAUSED,
    COMPLETED,
    FAILED;

    public boolean isFinished() {
        return this == COMPLETED || this == FAILED;
    }
}

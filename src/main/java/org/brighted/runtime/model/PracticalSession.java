package org.brighted.runtime.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A persisted play session of one user in one story.
 *
 * @param id           session id
 * @param userId       owning user
 * @param storySlug    story being played, e.g. {@code "business-financial-literacy"}
 * @param state        lifecycle state
 * @param snapshot     current simulation state
 * @param startedAt    creation instant
 * @param lastPlayedAt instant of the last decision or tick
 * @param completedAt  instant the session finished, or {@code null}
 */
public record PracticalSession(
        String id,
        String userId,
        String storySlug,
        SessionState state,
        SessionSnapshot snapshot,
        Instant startedAt,
        Instant lastPlayedAt,
        Instant completedAt
) {

    public PracticalSession {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(storySlug, "storySlug");
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(snapshot, "snapshot");
        Objects.requireNonNull(startedAt, "startedAt");
        Objects.requireNonNull(lastPlayedAt, "lastPlayedAt");
    }

    public boolean isOwnedBy(String candidateUserId) {
        return userId.equals(candidateUserId);
    }

    public PracticalSession withSnapshot(SessionSnapshot next, Instant playedAt) {
        return new PracticalSession(id, userId, storySlug, state, next, startedAt, playedAt, completedAt);
    }

    public PracticalSession finish(SessionState finalState, Instant at) {
        return new PracticalSession(id, userId, storySlug, finalState, snapshot, startedAt, at, at);
    }
}

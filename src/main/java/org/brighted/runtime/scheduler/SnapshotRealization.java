package org.brighted.runtime.scheduler;

import org.brighted.runtime.model.Consequence;
import org.brighted.runtime.model.SessionSnapshot;

import java.util.List;

/**
 * Outcome of realizing a batch of due consequences against a session snapshot.
 *
 * @param snapshot snapshot after every applied consequence
 * @param applied  consequences that were applied in this batch, in application order
 */
public record SnapshotRealization(SessionSnapshot snapshot, List<Consequence> applied) {

    public SnapshotRealization {
        applied = List.copyOf(applied);
    }
}

package org.brighted.practicals;

import org.brighted.runtime.model.Consequence;
import org.brighted.runtime.model.PracticalSession;

import java.util.List;
import java.util.OptionalInt;

/**
 * What a player sees of a session after it was brought up to date.
 *
 * @param session                        the stored session
 * @param registrationRemainingMinutes   minutes until a pending registration is processed, empty otherwise
 * @param pendingConsequences            consequences not yet applied, in creation order
 */
public record SessionView(PracticalSession session, OptionalInt registrationRemainingMinutes,
                          List<Consequence> pendingConsequences) {

    public SessionView {
        pendingConsequences = List.copyOf(pendingConsequences);
    }
}

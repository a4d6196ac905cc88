package org.brighted.runtime.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Per-user mission completion counter for one calendar day.
 *
 * @param dayKey               day the completions belong to, or {@code null} before the first completion
 * @param completedMissionIds  distinct missions completed that day, in completion order
 * @param cooldown             open cooldown window, or {@code null}
 */
public record MissionCooldownState(String dayKey, Set<String> completedMissionIds, CooldownWindow cooldown) {

    public MissionCooldownState {
        completedMissionIds = Collections.unmodifiableSet(new LinkedHashSet<>(completedMissionIds));
    }

    public static MissionCooldownState empty() {
        return new MissionCooldownState(null, Set.of(), null);
    }

    public int completedCount() {
        return completedMissionIds.size();
    }
}

package org.brighted.runtime.missions;

import org.brighted.runtime.model.CooldownWindow;
import org.brighted.runtime.model.MissionCooldownState;

import java.util.Optional;

/**
 * Outcome of {@link CooldownLimiter#register}.
 *
 * @param state      state to persist
 * @param dailyCount distinct missions completed today
 * @param opened     true when this completion opened the cooldown window
 */
public record MissionRegistration(MissionCooldownState state, int dailyCount, boolean opened) {

    public Optional<CooldownWindow> cooldown() {
        return Optional.ofNullable(state.cooldown());
    }
}

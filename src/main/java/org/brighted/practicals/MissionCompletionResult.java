package org.brighted.practicals;

import org.brighted.runtime.model.CooldownWindow;
import org.brighted.runtime.progression.XpUpdateResult;

import java.util.Optional;

/**
 * Result of a mission completion.
 *
 * @param rewarded   false when the completion was suppressed by an active cooldown
 * @param dailyCount distinct missions completed today
 * @param cooldown   the cooldown in force after this completion
 * @param xp         the award, empty when suppressed
 */
public record MissionCompletionResult(boolean rewarded, int dailyCount, Optional<CooldownWindow> cooldown,
                                      Optional<XpUpdateResult> xp) {
}

package org.brighted.runtime.progression;

/**
 * Outcome of a lab completion.
 *
 * @param alreadyCompleted true when the lab was completed earlier the same day; nothing is awarded
 * @param xp               the experience award, or {@code null} when already completed
 * @param coins            coins granted
 */
public record LabCompletionResult(boolean alreadyCompleted, XpUpdateResult xp, int coins) {

    public int xpGain() {
        return xp == null ? 0 : xp.xpGain();
    }

    public static LabCompletionResult repeat() {
        return new LabCompletionResult(true, null, 0);
    }
}

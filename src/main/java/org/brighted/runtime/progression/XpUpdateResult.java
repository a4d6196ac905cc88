package org.brighted.runtime.progression;

/**
 * Outcome of {@link ProgressionAccumulator#calculateXPUpdate}.
 *
 * @param xpGain   experience actually granted
 * @param xpToday  today's total after the award, never above the cap
 * @param isCapped true when the adjusted reward was truncated
 * @param updates  fields to write back
 */
public record XpUpdateResult(int xpGain, int xpToday, boolean isCapped, XpUpdateInstruction updates) {
}

package org.brighted.runtime.model;

/**
 * Registration progress of the practical's business.
 * <p>
 * {@code NONE -> PENDING -> {APPROVED, REJECTED}}; a rejected business may resubmit.
 */
public enum RegistrationStatus {
    NONE,
    PENDING,
    APPROVED,
    REJECTED;

    /**
     * Returns true when a registration may be (re)submitted from this status.
     */
    public boolean acceptsSubmission() {
        return this == NONE || this == REJECTED;
    }
}

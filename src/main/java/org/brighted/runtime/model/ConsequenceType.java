package org.brighted.runtime.model;

/**
 * Whether a consequence was applied at decision time or scheduled for later.
 */
public enum ConsequenceType {
    IMMEDIATE,
    DELAYED
}

package org.brighted.runtime.model;

import java.time.Instant;

/**
 * Tax assessed for one reporting period.
 *
 * @param period period label, e.g. {@code "2026-Q3"}
 * @param amount assessed amount
 * @param paid   amount paid so far
 * @param dueAt  payment deadline
 */
public record TaxObligation(String period, long amount, long paid, Instant dueAt) {
}

package org.brighted.runtime.model;

import java.time.Instant;

/**
 * A loan taken by the business.
 *
 * @param id        loan id
 * @param principal amount borrowed
 * @param rate      interest rate, e.g. 0.05
 * @param dueAt     repayment deadline
 * @param paid      amount repaid so far
 */
public record Loan(String id, long principal, double rate, Instant dueAt, long paid) {

    public long amountOwed() {
        return Math.max(0, Math.round(principal * (1 + rate)) - paid);
    }
}

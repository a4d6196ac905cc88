package org.brighted.runtime.business;

import org.brighted.runtime.Config;

import java.time.Duration;
import java.util.Objects;

/**
 * Tunables of the business practical.
 *
 * @param processingWindow time a submitted registration stays pending
 * @param initialCash      opening cash of a new business
 * @param loanRate         interest rate applied to new loans
 * @param loanTerm         time until a new loan is due
 * @param taxRate          default rate for {@link BusinessLifecycle#simpleTax(long, double)}
 * @param marketBias       centre of the market draw; below 0.5 drifts slightly upwards
 * @param marketRange      scale of the market draw relative to exposure
 */
public record BusinessConfig(
        Duration processingWindow,
        long initialCash,
        double loanRate,
        Duration loanTerm,
        double taxRate,
        double marketBias,
        double marketRange
) {

    public BusinessConfig {
        Objects.requireNonNull(processingWindow, "processingWindow");
        Objects.requireNonNull(loanTerm, "loanTerm");
        if (processingWindow.isNegative()) {
            throw new IllegalArgumentException("processingWindow cannot be negative");
        }
        if (initialCash < 0) {
            throw new IllegalArgumentException("initialCash cannot be negative");
        }
        if (marketRange < 0) {
            throw new IllegalArgumentException("marketRange cannot be negative");
        }
    }

    public static BusinessConfig defaults() {
        return new BusinessConfig(
                Duration.ofSeconds(Config.DEFAULT_REGISTRATION_WINDOW_SECONDS),
                Config.INITIAL_BUSINESS_CASH,
                0.05,
                Duration.ofDays(7),
                0.15,
                0.48,
                0.1);
    }

    public BusinessConfig withProcessingWindow(Duration window) {
        return new BusinessConfig(window, initialCash, loanRate, loanTerm, taxRate, marketBias, marketRange);
    }
}

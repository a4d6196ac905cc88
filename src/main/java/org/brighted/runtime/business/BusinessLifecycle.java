package org.brighted.runtime.business;

import org.brighted.runtime.Config;
import org.brighted.runtime.decisions.BusinessChoiceRules;
import org.brighted.runtime.decisions.InvalidChoiceException;
import org.brighted.runtime.model.BusinessSimState;
import org.brighted.runtime.model.Loan;
import org.brighted.runtime.model.RegistrationStatus;
import org.brighted.runtime.model.TaxObligation;
import org.brighted.runtime.spi.IRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.OptionalInt;

/**
 * Registration state machine and market perturbation of the business practical.
 * <p>
 * Transitions:
 * <ul>
 *   <li>{@code NONE|REJECTED -> PENDING} on {@link #submitRegistration}</li>
 *   <li>{@code PENDING -> APPROVED} on {@link #tickRegistration} once the processing window elapsed</li>
 *   <li>{@code PENDING -> REJECTED} on {@link #rejectRegistration}</li>
 * </ul>
 * Time only moves forward when the caller ticks, which happens on every read of the
 * session. All methods return new state and never mutate their input.
 */
public class BusinessLifecycle {

    private static final Logger log = LoggerFactory.getLogger(BusinessLifecycle.class);

    private final BusinessConfig config;

    public BusinessLifecycle(BusinessConfig config) {
        this.config = config;
    }

    public BusinessConfig getConfig() {
        return config;
    }

    /**
     * Submits (or resubmits) the business registration.
     *
     * @param state current state, or {@code null} when the session has no business yet
     * @param businessName validated business name
     * @param now submission instant
     * @return the pending state; cash is untouched
     * @throws InvalidChoiceException if a registration is already pending or approved
     */
    public BusinessSimState submitRegistration(BusinessSimState state, String businessName, Instant now) {
        BusinessSimState base = state != null ? state : BusinessSimState.initial(config.initialCash(), now);
        if (!base.registrationStatus().acceptsSubmission()) {
            throw new InvalidChoiceException(BusinessChoiceRules.REGISTER,
                    "Registration already " + base.registrationStatus().name().toLowerCase() + " for '"
                            + base.businessName() + "'");
        }
        return base.withRegistration(RegistrationStatus.PENDING, now, businessName);
    }

    /**
     * Rejects a pending registration. Any other status is returned unchanged.
     *
     * @param state current state
     * @param reason reason recorded in the log
     * @return the rejected state
     */
    public BusinessSimState rejectRegistration(BusinessSimState state, String reason) {
        if (state.registrationStatus() != RegistrationStatus.PENDING) {
            return state;
        }
        log.debug("Registration of '{}' rejected: {}", state.businessName(), reason);
        return state.withStatus(RegistrationStatus.REJECTED);
    }

    /**
     * Approves a pending registration once {@code now - submittedAt >= processingWindow}.
     *
     * @param state current state
     * @param config tunables providing the processing window
     * @param now evaluation instant
     * @return approved state, or the input unchanged
     */
    public static BusinessSimState tickRegistration(BusinessSimState state, BusinessConfig config, Instant now) {
        if (state.registrationStatus() != RegistrationStatus.PENDING || state.registrationSubmittedAt() == null) {
            return state;
        }
        Duration elapsed = Duration.between(state.registrationSubmittedAt(), now);
        if (elapsed.compareTo(config.processingWindow()) < 0) {
            return state;
        }
        return state.withStatus(RegistrationStatus.APPROVED);
    }

    /**
     * Whole minutes until a pending registration is processed, rounded up and floored at zero.
     *
     * @return the remaining minutes, or empty when no registration is pending
     */
    public static OptionalInt registrationRemainingMinutes(BusinessSimState state, BusinessConfig config, Instant now) {
        if (state.registrationStatus() != RegistrationStatus.PENDING || state.registrationSubmittedAt() == null) {
            return OptionalInt.empty();
        }
        long remainingMs = config.processingWindow().toMillis()
                - Duration.between(state.registrationSubmittedAt(), now).toMillis();
        if (remainingMs <= 0) {
            return OptionalInt.of(0);
        }
        return OptionalInt.of((int) Math.min(Integer.MAX_VALUE, (remainingMs + Config.MS_PER_MINUTE - 1) / Config.MS_PER_MINUTE));
    }

    /**
     * Draws a bounded market swing: {@code round(exposure * (u - bias) * range)} with {@code u} in [0, 1).
     * Higher exposure widens the swing in both directions.
     *
     * @param exposure risk weight, {@code >= 0}
     * @param random randomness source
     * @return signed cash delta
     */
    public static long marketFluctuation(double exposure, BusinessConfig config, IRandomProvider random) {
        if (exposure <= 0) {
            return 0;
        }
        double drift = (random.nextDouble() - config.marketBias()) * config.marketRange();
        return Math.round(exposure * drift);
    }

    /**
     * Advances the business by one observed instant: registration first, then market.
     * <p>
     * The market moves only when the business has left {@code NONE}, the session is active
     * and {@code now} is strictly after the last market update, so a repeated tick at the
     * same instant changes nothing. Cash never drops below zero.
     *
     * @param state current state
     * @param now observed instant
     * @param sessionActive whether the owning session is active
     * @param random randomness source for the market draw
     * @return the advanced state
     */
    public BusinessSimState tick(BusinessSimState state, Instant now, boolean sessionActive, IRandomProvider random) {
        BusinessSimState next = tickRegistration(state, config, now);
        if (next.registrationStatus() != state.registrationStatus()) {
            log.debug("Registration of '{}' moved {} -> {}", state.businessName(),
                    state.registrationStatus(), next.registrationStatus());
        }
        if (next.registrationStatus() == RegistrationStatus.NONE || !sessionActive
                || !now.isAfter(next.lastMarketUpdate())) {
            return next;
        }
        long delta = marketFluctuation(next.marketExposure(), config, random);
        return next.withCash(Math.max(0, next.cashBalance() + delta), now);
    }

    /**
     * Records a new loan on the business.
     *
     * @param loanId id for the loan
     * @param principal borrowed amount
     * @param now instant the loan was taken
     * @return state with the loan appended
     */
    public BusinessSimState recordLoan(BusinessSimState state, String loanId, long principal, Instant now) {
        return state.withLoan(new Loan(loanId, principal, config.loanRate(), now.plus(config.loanTerm()), 0));
    }

    /**
     * Tax due on a profit at the given rate; losses owe nothing.
     */
    public static long simpleTax(long profit, double rate) {
        return Math.max(0, Math.round(profit * rate));
    }

    /**
     * Appends a tax obligation for a period at the configured rate.
     */
    public BusinessSimState assessTax(BusinessSimState state, String period, long profit, Instant dueAt) {
        return state.withTaxObligation(new TaxObligation(period, simpleTax(profit, config.taxRate()), 0, dueAt));
    }
}

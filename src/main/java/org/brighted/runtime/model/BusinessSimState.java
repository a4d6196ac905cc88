package org.brighted.runtime.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * State of the "start a business" practical. Owned by exactly one session and
 * mutated only through {@link org.brighted.runtime.business.BusinessLifecycle}.
 *
 * @param registrationStatus      registration progress
 * @param registrationSubmittedAt when the current registration was submitted, or {@code null}
 * @param businessName            registered name, or {@code null} before submission
 * @param cashBalance             business cash, never negative
 * @param inventory               business stock by item id
 * @param loans                   outstanding and repaid loans
 * @param taxObligations          assessed taxes
 * @param marketExposure          risk weight scaling market swings, {@code >= 0}
 * @param lastMarketUpdate        instant of the last applied market fluctuation
 */
public record BusinessSimState(
        RegistrationStatus registrationStatus,
        Instant registrationSubmittedAt,
        String businessName,
        long cashBalance,
        Map<String, Integer> inventory,
        List<Loan> loans,
        List<TaxObligation> taxObligations,
        double marketExposure,
        Instant lastMarketUpdate
) {

    public BusinessSimState {
        Objects.requireNonNull(registrationStatus, "registrationStatus");
        Objects.requireNonNull(lastMarketUpdate, "lastMarketUpdate");
        if (cashBalance < 0) {
            throw new IllegalArgumentException("cashBalance cannot be negative: " + cashBalance);
        }
        if (marketExposure < 0 || Double.isNaN(marketExposure)) {
            throw new IllegalArgumentException("marketExposure must be >= 0: " + marketExposure);
        }
        inventory = Collections.unmodifiableMap(new LinkedHashMap<>(inventory));
        loans = List.copyOf(loans);
        taxObligations = List.copyOf(taxObligations);
    }

    /**
     * Creates the state a new business practical starts with.
     *
     * @param cash opening cash balance
     * @param now  creation instant, used as the market baseline
     * @return an unregistered business
     */
    public static BusinessSimState initial(long cash, Instant now) {
        return new BusinessSimState(RegistrationStatus.NONE, null, null, cash,
                Map.of(), List.of(), List.of(), 0.0, now);
    }

    public BusinessSimState withRegistration(RegistrationStatus status, Instant submittedAt, String name) {
        return new BusinessSimState(status, submittedAt, name, cashBalance, inventory, loans,
                taxObligations, marketExposure, lastMarketUpdate);
    }

    public BusinessSimState withStatus(RegistrationStatus status) {
        return withRegistration(status, registrationSubmittedAt, businessName);
    }

    public BusinessSimState withCash(long cash, Instant marketUpdate) {
        return new BusinessSimState(registrationStatus, registrationSubmittedAt, businessName, cash,
                inventory, loans, taxObligations, marketExposure, marketUpdate);
    }

    public BusinessSimState withMarketExposure(double exposure) {
        return new BusinessSimState(registrationStatus, registrationSubmittedAt, businessName, cashBalance,
                inventory, loans, taxObligations, exposure, lastMarketUpdate);
    }

    public BusinessSimState withLoan(Loan loan) {
        List<Loan> next = new ArrayList<>(loans);
        next.add(loan);
        return new BusinessSimState(registrationStatus, registrationSubmittedAt, businessName, cashBalance,
                inventory, next, taxObligations, marketExposure, lastMarketUpdate);
    }

    public BusinessSimState withTaxObligation(TaxObligation obligation) {
        List<TaxObligation> next = new ArrayList<>(taxObligations);
        next.add(obligation);
        return new BusinessSimState(registrationStatus, registrationSubmittedAt, businessName, cashBalance,
                inventory, loans, next, marketExposure, lastMarketUpdate);
    }
}

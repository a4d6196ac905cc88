package org.brighted.runtime.decisions;

import org.brighted.runtime.model.ChoiceResolution;
import org.brighted.runtime.model.DelayedConsequenceSpec;
import org.brighted.runtime.model.ResourceEffect;

import java.util.List;
import java.util.Map;

/**
 * Rules of the "business and financial literacy" practical.
 * <p>
 * Start a business, register it (a processing delay, driven by ticks), manage staff,
 * taxes and loans. Shortcuts pay off now and cost more later.
 */
public final class BusinessChoiceRules {

    public static final String STORY_SLUG = "business-financial-literacy";

    public static final String REGISTER = "business_register";
    public static final String UNDERPAY_STAFF = "business_underpay_staff";
    public static final String IGNORE_TAXES = "business_ignore_taxes";
    public static final String TAKE_LOAN = "business_take_loan";

    public static final String FIELD_BUSINESS_NAME = "businessName";
    public static final String FIELD_PRINCIPAL = "principal";
    public static final String FIELD_DELAY_MINUTES = "delayMinutes";

    public static final int MAX_BUSINESS_NAME_LENGTH = 80;
    public static final int DEFAULT_LOAN_PRINCIPAL = 200;
    public static final int MAX_LOAN_PRINCIPAL = 10_000;

    private BusinessChoiceRules() {}

    /**
     * Registers every business rule.
     *
     * @param registry target registry
     * @return the same registry
     */
    public static ChoiceRuleRegistry registerAll(ChoiceRuleRegistry registry) {
        return registry
                .register(REGISTER, BusinessChoiceRules::register)
                .register(UNDERPAY_STAFF, BusinessChoiceRules::underpayStaff)
                .register(IGNORE_TAXES, BusinessChoiceRules::ignoreTaxes)
                .register(TAKE_LOAN, BusinessChoiceRules::takeLoan);
    }

    /**
     * Returns true for choices that create or change the session's business, which only
     * the business story has.
     */
    public static boolean changesBusiness(String choiceId) {
        return REGISTER.equals(choiceId) || TAKE_LOAN.equals(choiceId);
    }

    /**
     * Reads and validates the business name of a registration payload.
     */
    public static String businessName(ChoiceContext ctx) {
        return ctx.requireText(FIELD_BUSINESS_NAME, MAX_BUSINESS_NAME_LENGTH);
    }

    /**
     * Reads and validates the loan principal of a loan payload.
     */
    public static int loanPrincipal(ChoiceContext ctx) {
        return ctx.optionalPositiveInt(FIELD_PRINCIPAL, DEFAULT_LOAN_PRINCIPAL, MAX_LOAN_PRINCIPAL);
    }

    // Registration has no resource effect; the state machine moves it along on the
    // configured processing window, which a payload cannot shorten.
    private static ChoiceResolution register(ChoiceContext ctx) {
        businessName(ctx);
        if (ctx.has(FIELD_DELAY_MINUTES)) {
            throw new InvalidPayloadException(ctx.choiceId(), FIELD_DELAY_MINUTES,
                    "processing time is fixed by configuration");
        }
        return ChoiceResolution.none();
    }

    private static ChoiceResolution underpayStaff(ChoiceContext ctx) {
        return new ChoiceResolution(
                List.of(ResourceEffect.currency(20)),
                List.of(DelayedConsequenceSpec.inMinutes("morale_drop_productivity", 3,
                        List.of(ResourceEffect.currency(-50)))));
    }

    private static ChoiceResolution ignoreTaxes(ChoiceContext ctx) {
        return new ChoiceResolution(
                List.of(),
                List.of(DelayedConsequenceSpec.inMinutes("audit_risk", 5,
                        List.of(ResourceEffect.currency(-100), ResourceEffect.reputation("regulator", -20)))));
    }

    private static ChoiceResolution takeLoan(ChoiceContext ctx) {
        return ChoiceResolution.immediateOnly(List.of(ResourceEffect.currency(loanPrincipal(ctx))));
    }

    /**
     * Convenience for callers building a registration payload.
     */
    public static Map<String, Object> registrationPayload(String businessName) {
        return Map.of(FIELD_BUSINESS_NAME, businessName);
    }
}

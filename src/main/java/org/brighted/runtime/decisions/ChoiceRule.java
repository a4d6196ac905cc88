package org.brighted.runtime.decisions;

import org.brighted.runtime.model.ChoiceResolution;

/**
 * Maps one choice, in context, to its consequences. Implementations must be pure.
 */
@FunctionalInterface
public interface ChoiceRule {

    /**
     * @param context the choice and its surroundings
     * @return immediate effects and delayed consequence specs
     * @throws InvalidPayloadException if the payload does not satisfy the rule
     */
    ChoiceResolution resolve(ChoiceContext context);
}

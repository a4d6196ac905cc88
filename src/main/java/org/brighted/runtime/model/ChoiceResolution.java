package org.brighted.runtime.model;

import java.util.List;

/**
 * Outcome of resolving one choice: effects to apply now and consequences to schedule.
 *
 * @param immediate effects applied synchronously by the caller
 * @param delayed   consequences the caller persists with a due time
 */
public record ChoiceResolution(List<ResourceEffect> immediate, List<DelayedConsequenceSpec> delayed) {

    public ChoiceResolution {
        immediate = List.copyOf(immediate);
        delayed = List.copyOf(delayed);
    }

    public static ChoiceResolution none() {
        return new ChoiceResolution(List.of(), List.of());
    }

    public static ChoiceResolution immediateOnly(List<ResourceEffect> effects) {
        return new ChoiceResolution(effects, List.of());
    }
}

package com.gillianbc.lifeplan.model.comparison;

import lombok.NonNull;
import lombok.Value;

/**
 * How a change moves retirement readiness. {@code monthsEarlier} is only present when both
 * scenarios reach retirement; it is negative when the change delays it.
 */
@Value
public class RetirementImpact {

    public enum Outcome {
        BOTH_ACHIEVED,
        NEITHER_ACHIEVED,
        ENABLED_BY_CHANGE,
        DISABLED_BY_CHANGE
    }

    @NonNull Outcome outcome;
    Integer monthsEarlier;

    public static RetirementImpact of(Integer baselineYear, Integer alternateYear) {
        if (baselineYear != null && alternateYear != null) {
            return new RetirementImpact(Outcome.BOTH_ACHIEVED, (baselineYear - alternateYear) * 12);
        }
        if (baselineYear == null && alternateYear == null) {
            return new RetirementImpact(Outcome.NEITHER_ACHIEVED, null);
        }
        return new RetirementImpact(alternateYear != null ? Outcome.ENABLED_BY_CHANGE : Outcome.DISABLED_BY_CHANGE, null);
    }
}

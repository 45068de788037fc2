package com.gillianbc.lifeplan.model.comparison;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Sums of the yearly deltas over an inclusive range of calendar years.
 */
@Value
@Builder
public class CumulativeImpact {

    int startYear;
    int endYear;
    int years;
    @NonNull BigDecimal incomeDelta;
    @NonNull BigDecimal taxesDelta;
    /** Net worth delta in the last year of the range. */
    @NonNull BigDecimal netWorthDelta;
    /** {@code netWorthDelta} spread evenly over the years in range. */
    @NonNull BigDecimal averageYearlyBenefit;
}

package com.gillianbc.lifeplan.model.comparison;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class ComparisonSummary {

    @NonNull RetirementImpact retirementImpact;
    /** Alternate minus baseline; negative means the change saves interest. */
    @NonNull BigDecimal lifetimeInterestDelta;
    @NonNull BigDecimal netWorthAtRetirementDelta;
    @NonNull BigDecimal totalWorkHoursDelta;
    @NonNull BigDecimal netWorthAtEndDelta;
    @NonNull String keyInsight;
}

package com.gillianbc.lifeplan.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class TrajectorySummary {

    int totalYears;
    /** Calendar year of retirement readiness, or null when never reached. */
    Integer retirementYear;
    Integer retirementAge;
    @NonNull BigDecimal totalLifetimeIncome;
    @NonNull BigDecimal totalLifetimeTaxes;
    @NonNull BigDecimal totalLifetimeInterest;
    /** Zero when retirement readiness is never reached. */
    @NonNull BigDecimal netWorthAtRetirement;
    @NonNull BigDecimal netWorthAtEnd;
    @NonNull BigDecimal totalLifetimeWorkHours;
    @NonNull BigDecimal averageEffectiveHourlyRate;
    int goalsAchieved;
    int goalsMissed;

    public boolean isRetirementReached() {
        return retirementYear != null;
    }
}

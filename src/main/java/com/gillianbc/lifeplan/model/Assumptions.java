package com.gillianbc.lifeplan.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Simulation-wide settings. A different set of assumptions gives a different trajectory;
 * an existing trajectory is never changed by them.
 */
@Value
@Builder(toBuilder = true)
public class Assumptions {

    @NonNull @Builder.Default BigDecimal inflationRate = new BigDecimal("0.03");
    @NonNull @Builder.Default BigDecimal marketReturn = new BigDecimal("0.07");
    @NonNull @Builder.Default BigDecimal homeAppreciation = new BigDecimal("0.03");
    @NonNull @Builder.Default BigDecimal salaryGrowth = new BigDecimal("0.02");
    @NonNull @Builder.Default BigDecimal retirementWithdrawalRate = new BigDecimal("0.04");
    @NonNull @Builder.Default BigDecimal incomeReplacementRatio = new BigDecimal("0.80");
    @Builder.Default int lifeExpectancy = 85;
    @Builder.Default int currentAge = 30;
    @NonNull @Builder.Default FilingStatus taxFilingStatus = FilingStatus.SINGLE;
    @NonNull @Builder.Default String state = "CA";
    /** Tax year of the snapshot, also the calendar year of the first projected year. */
    @Builder.Default int taxYear = 2024;
}

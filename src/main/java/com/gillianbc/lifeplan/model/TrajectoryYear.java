package com.gillianbc.lifeplan.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Immutable snapshot of one projected year.
 * <p>
 * {@code netWorth} always equals {@code totalAssets - totalDebt}, including when it is negative.
 */
@Value
@Builder
public class TrajectoryYear {

    int year;
    int age;

    // Income and taxes
    @NonNull BigDecimal grossIncome;
    @NonNull BigDecimal earnedIncome;
    @NonNull BigDecimal netIncome;
    @NonNull BigDecimal taxFederal;
    @NonNull BigDecimal taxState;
    @NonNull BigDecimal taxFica;
    @NonNull BigDecimal totalTax;
    @NonNull BigDecimal effectiveTaxRate;
    @NonNull BigDecimal pretaxContributions;

    @Singular List<DebtState> debts;
    @Singular List<AssetState> assets;

    // Totals
    @NonNull BigDecimal totalDebt;
    @NonNull BigDecimal totalAssets;
    @NonNull BigDecimal netWorth;
    @NonNull BigDecimal totalDebtPayment;
    @NonNull BigDecimal totalInterestPaid;
    @NonNull BigDecimal totalContributions;

    // Cash flow
    @NonNull BigDecimal totalObligations;
    @NonNull BigDecimal discretionaryIncome;
    @NonNull BigDecimal savingsRate;

    // Work
    @NonNull BigDecimal totalWorkHours;
    @NonNull BigDecimal effectiveHourlyRate;

    // Housing
    @NonNull BigDecimal homeEquity;
    @NonNull BigDecimal ltvRatio;
    boolean payingPmi;
}

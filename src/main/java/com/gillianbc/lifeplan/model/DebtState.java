package com.gillianbc.lifeplan.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.math.BigDecimal;

/**
 * End-of-year state of one debt.
 */
@Value
@Builder(toBuilder = true)
public class DebtState {

    @NonNull String debtId;
    @NonNull BigDecimal remainingPrincipal;
    int monthsRemaining;
    @NonNull BigDecimal interestPaidThisYear;
    @NonNull BigDecimal principalPaidThisYear;
    /** Principal and interest plus any PMI and escrow paid this year. */
    @NonNull BigDecimal paymentsThisYear;
    boolean paidOff;
    /** Month (1-12) in which the debt was cleared this year, or null. */
    Integer payoffMonth;
    /** Appreciated property value at year end; null for non-mortgage debts. */
    BigDecimal propertyValue;
    BigDecimal ltv;
    boolean payingPmi;
}

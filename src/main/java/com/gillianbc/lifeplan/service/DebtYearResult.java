package com.gillianbc.lifeplan.service;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class DebtYearResult {

    @NonNull BigDecimal startingBalance;
    @NonNull BigDecimal endBalance;
    @NonNull BigDecimal interestPaid;
    @NonNull BigDecimal principalPaid;
    @NonNull BigDecimal totalPaid;
    boolean paidOff;
    /** Month (1-12) of payoff within this year, null if not paid off this year. */
    Integer payoffMonth;
    /** Term months left after this year; 0 for open-ended debts. */
    int monthsRemaining;
}

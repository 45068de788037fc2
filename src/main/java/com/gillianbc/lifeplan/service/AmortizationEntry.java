package com.gillianbc.lifeplan.service;

import lombok.NonNull;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One month of an amortization schedule.
 */
@Value
public class AmortizationEntry {

    int month;
    @NonNull BigDecimal payment;
    @NonNull BigDecimal principal;
    @NonNull BigDecimal interest;
    @NonNull BigDecimal balance;
}

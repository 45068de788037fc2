package com.gillianbc.lifeplan.service;

import lombok.NonNull;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Low, expected and high annual amounts for one income in one year.
 */
@Value
public class IncomeRange {

    @NonNull BigDecimal low;
    @NonNull BigDecimal expected;
    @NonNull BigDecimal high;
}

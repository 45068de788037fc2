package com.gillianbc.lifeplan.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.math.BigDecimal;

/**
 * A source of income. For {@link IncomeType#HOURLY} the amount is the hourly rate,
 * otherwise it is the annual amount.
 */
@Value
@Builder(toBuilder = true)
public class Income {

    @NonNull String id;
    @NonNull String name;
    @NonNull @Builder.Default IncomeType type = IncomeType.SALARY;
    @NonNull BigDecimal amount;
    @NonNull @Builder.Default BigDecimal weeklyHours = new BigDecimal("40");
    /**
     * Spread of a variable income around its expected value, between 0 and 1.
     */
    @NonNull @Builder.Default BigDecimal variability = BigDecimal.ZERO;
    /**
     * Annual growth rate; null means the profile's default salary growth applies.
     */
    BigDecimal expectedGrowth;
    /**
     * Last month in which the income is received; null for open-ended income.
     */
    MonthYear endDate;
}

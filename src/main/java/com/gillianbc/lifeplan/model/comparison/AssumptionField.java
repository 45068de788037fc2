package com.gillianbc.lifeplan.model.comparison;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Assumptions that a scenario can vary, with how their values are displayed.
 */
@Getter
@RequiredArgsConstructor
public enum AssumptionField {
    INFLATION_RATE("Inflation", true),
    MARKET_RETURN("Market return", true),
    HOME_APPRECIATION("Home appreciation", true),
    SALARY_GROWTH("Salary growth", true),
    RETIREMENT_WITHDRAWAL_RATE("Withdrawal rate", true),
    INCOME_REPLACEMENT_RATIO("Income replacement", true),
    LIFE_EXPECTANCY("Life expectancy", false),
    CURRENT_AGE("Current age", false);

    private final String label;
    private final boolean rate;
}

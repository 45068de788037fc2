package com.gillianbc.lifeplan.model.comparison;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Alternate minus baseline for one calendar year.
 */
@Value
@Builder
public class YearDelta {

    int year;
    int age;
    @NonNull BigDecimal netWorthDelta;
    @NonNull BigDecimal incomeDelta;
    @NonNull BigDecimal taxesDelta;
    @NonNull BigDecimal debtDelta;
    @NonNull BigDecimal assetsDelta;
}

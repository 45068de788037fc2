package com.gillianbc.lifeplan.tax;

import lombok.NonNull;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One band of a progressive table. {@code max} is null for the top band.
 */
@Value
public class TaxBracket {

    @NonNull BigDecimal min;
    BigDecimal max;
    @NonNull BigDecimal rate;

    public boolean contains(BigDecimal taxableIncome) {
        return taxableIncome.compareTo(min) >= 0 && (max == null || taxableIncome.compareTo(max) < 0);
    }

    public boolean isTopBracket() {
        return max == null;
    }
}

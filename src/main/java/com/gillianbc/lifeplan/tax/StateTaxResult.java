package com.gillianbc.lifeplan.tax;

import lombok.NonNull;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class StateTaxResult {

    @NonNull BigDecimal taxableIncome;
    @NonNull BigDecimal tax;
    @NonNull BigDecimal effectiveRate;
}

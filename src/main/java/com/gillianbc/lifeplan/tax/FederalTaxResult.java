package com.gillianbc.lifeplan.tax;

import lombok.NonNull;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class FederalTaxResult {

    @NonNull BigDecimal taxableIncome;
    @NonNull BigDecimal tax;
    /** Rate of the band holding the last taxable dollar; zero when nothing is taxable. */
    @NonNull BigDecimal marginalRate;
    @NonNull BigDecimal effectiveRate;
}

package com.gillianbc.lifeplan.tax;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Federal, state and FICA tax for one year of income.
 */
@Value
@Builder
public class TaxSummary {

    @NonNull BigDecimal grossIncome;
    @NonNull BigDecimal federalTax;
    @NonNull BigDecimal stateTax;
    @NonNull BigDecimal socialSecurity;
    @NonNull BigDecimal medicare;
    @NonNull BigDecimal totalFica;
    @NonNull BigDecimal totalTax;
    @NonNull BigDecimal netIncome;
    @NonNull BigDecimal effectiveRate;
    @NonNull BigDecimal marginalRate;
}

package com.gillianbc.lifeplan.tax;

import lombok.NonNull;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Annual contribution limits published with a tax year.
 */
@Value
public class RetirementLimits {

    @NonNull BigDecimal limit401k;
    @NonNull BigDecimal limit401kCatchUp;
    @NonNull BigDecimal limitIra;
    @NonNull BigDecimal limitIraCatchUp;
}

package com.gillianbc.lifeplan.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.math.BigDecimal;

/**
 * A recurring non-debt expense such as rent, insurance or childcare.
 */
@Value
@Builder(toBuilder = true)
public class Obligation {

    @NonNull String id;
    @NonNull String name;
    @NonNull BigDecimal monthlyAmount;
    @Builder.Default boolean inflationAdjusted = true;
    MonthYear endDate;
}

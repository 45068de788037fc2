package com.gillianbc.lifeplan.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder(toBuilder = true)
public class Goal {

    @NonNull String id;
    @NonNull String name;
    @NonNull GoalType type;
    /** Ignored for {@link GoalType#DEBT_FREE}. */
    @NonNull @Builder.Default BigDecimal targetAmount = BigDecimal.ZERO;
    @NonNull MonthYear targetDate;
}

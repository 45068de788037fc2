package com.gillianbc.lifeplan.model.comparison;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;

import java.math.BigDecimal;

/**
 * A refinance: the same debt at a different annual interest rate.
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public class DebtRateChange extends Change {

    private final String debtId;
    private final String debtName;
    private final BigDecimal oldRate;
    private final BigDecimal newRate;

    public DebtRateChange(@NonNull String debtId, @NonNull String debtName,
                          @NonNull BigDecimal oldRate, @NonNull BigDecimal newRate) {
        this.debtId = debtId;
        this.debtName = debtName;
        this.oldRate = oldRate;
        this.newRate = newRate;
    }

    @Override
    public ChangeKind getKind() {
        return ChangeKind.DEBT_RATE;
    }

    @Override
    public String describe() {
        return debtName + " rate: " + percent(oldRate) + " → " + percent(newRate);
    }
}

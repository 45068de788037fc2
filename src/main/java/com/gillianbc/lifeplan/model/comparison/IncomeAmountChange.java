package com.gillianbc.lifeplan.model.comparison;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;

import java.math.BigDecimal;

@Getter
@EqualsAndHashCode(callSuper = false)
public class IncomeAmountChange extends Change {

    private final String incomeId;
    private final String incomeName;
    private final BigDecimal oldAmount;
    private final BigDecimal newAmount;

    public IncomeAmountChange(@NonNull String incomeId, @NonNull String incomeName,
                              @NonNull BigDecimal oldAmount, @NonNull BigDecimal newAmount) {
        this.incomeId = incomeId;
        this.incomeName = incomeName;
        this.oldAmount = oldAmount;
        this.newAmount = newAmount;
    }

    @Override
    public ChangeKind getKind() {
        return ChangeKind.INCOME_AMOUNT;
    }

    @Override
    public String describe() {
        return incomeName + ": " + dollars(oldAmount) + " → " + dollars(newAmount);
    }
}

package com.gillianbc.lifeplan.model.comparison;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;

import java.math.BigDecimal;

@Getter
@EqualsAndHashCode(callSuper = false)
public class DebtPaymentChange extends Change {

    private final String debtId;
    private final String debtName;
    private final BigDecimal oldPayment;
    private final BigDecimal newPayment;

    public DebtPaymentChange(@NonNull String debtId, @NonNull String debtName,
                             @NonNull BigDecimal oldPayment, @NonNull BigDecimal newPayment) {
        this.debtId = debtId;
        this.debtName = debtName;
        this.oldPayment = oldPayment;
        this.newPayment = newPayment;
    }

    @Override
    public ChangeKind getKind() {
        return ChangeKind.DEBT_PAYMENT;
    }

    @Override
    public String describe() {
        return debtName + " payment: " + dollars(oldPayment) + "/mo → " + dollars(newPayment) + "/mo";
    }
}

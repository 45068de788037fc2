package com.gillianbc.lifeplan.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.math.BigDecimal;

/**
 * A single debt. The mortgage fields are only read when {@code propertyValue} is set.
 */
@Value
@Builder(toBuilder = true)
public class Debt {

    @NonNull String id;
    @NonNull String name;
    @NonNull @Builder.Default DebtType type = DebtType.OTHER;
    @NonNull BigDecimal principal;
    @NonNull BigDecimal interestRate;
    @NonNull @Builder.Default BigDecimal minimumPayment = BigDecimal.ZERO;
    @NonNull @Builder.Default BigDecimal actualPayment = BigDecimal.ZERO;
    @Builder.Default int termMonths = 0;
    /**
     * Months left on the term; 0 means the whole {@code termMonths}, or open-ended (e.g. a credit
     * card) when there is no term either.
     */
    @Builder.Default int monthsRemaining = 0;

    BigDecimal propertyValue;
    @NonNull @Builder.Default BigDecimal pmiThreshold = new BigDecimal("0.80");
    @NonNull @Builder.Default BigDecimal monthlyPmi = BigDecimal.ZERO;
    @NonNull @Builder.Default BigDecimal monthlyEscrow = BigDecimal.ZERO;

    /**
     * @return the payment applied each month: the larger of the actual and minimum payments
     */
    public BigDecimal effectivePayment() {
        return actualPayment.max(minimumPayment);
    }

    /**
     * @return months left at the start of the projection, falling back to the full term when
     * {@code monthsRemaining} is unset; 0 for an open-ended debt
     */
    public int remainingTerm() {
        return monthsRemaining > 0 ? monthsRemaining : termMonths;
    }

    public boolean hasProperty() {
        return propertyValue != null && propertyValue.signum() > 0;
    }
}

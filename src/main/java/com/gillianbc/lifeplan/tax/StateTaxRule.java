package com.gillianbc.lifeplan.tax;

import lombok.NonNull;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Income tax rule for one state. For progressive states {@code rate} is the top marginal rate,
 * which is applied to the whole taxable base.
 */
@Value
public class StateTaxRule {

    @NonNull String code;
    @NonNull String name;
    @NonNull StateTaxType type;
    @NonNull BigDecimal rate;
    @NonNull BigDecimal standardDeduction;

    public boolean hasIncomeTax() {
        return type != StateTaxType.NONE;
    }
}

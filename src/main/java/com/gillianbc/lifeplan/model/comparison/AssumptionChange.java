package com.gillianbc.lifeplan.model.comparison;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;

import java.math.BigDecimal;

@Getter
@EqualsAndHashCode(callSuper = false)
public class AssumptionChange extends Change {

    private final AssumptionField field;
    private final BigDecimal oldValue;
    private final BigDecimal newValue;

    public AssumptionChange(@NonNull AssumptionField field, @NonNull BigDecimal oldValue, @NonNull BigDecimal newValue) {
        this.field = field;
        this.oldValue = oldValue;
        this.newValue = newValue;
    }

    @Override
    public ChangeKind getKind() {
        return ChangeKind.ASSUMPTION;
    }

    @Override
    public String describe() {
        return field.getLabel() + ": " + format(oldValue) + " → " + format(newValue);
    }

    private String format(BigDecimal value) {
        return field.isRate() ? percent(value) : value.stripTrailingZeros().toPlainString();
    }
}

package com.gillianbc.lifeplan.model.comparison;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;

/**
 * One edit that turns the baseline profile into the alternate. Each variant carries its own
 * typed old and new values.
 */
public abstract class Change {

    public abstract ChangeKind getKind();

    /** Human-readable summary, e.g. "Salary: $80,000 → $90,000". */
    public abstract String describe();

    @Override
    public String toString() {
        return describe();
    }

    static String dollars(BigDecimal amount) {
        return String.format(Locale.ROOT, "$%,.2f", amount.setScale(2, RoundingMode.HALF_UP));
    }

    static String percent(BigDecimal rate) {
        return rate.movePointRight(2).setScale(2, RoundingMode.HALF_UP).stripTrailingZeros().toPlainString() + "%";
    }
}

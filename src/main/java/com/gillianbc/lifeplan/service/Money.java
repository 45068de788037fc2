package com.gillianbc.lifeplan.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;

/**
 * Display formatting for dollar amounts in milestone and insight text.
 */
final class Money {

    private static final BigDecimal THOUSAND = new BigDecimal("1000");
    private static final BigDecimal MILLION = new BigDecimal("1000000");

    private Money() {
    }

    /** Whole dollars with grouping, e.g. {@code $250,000}. */
    static String format(BigDecimal amount) {
        return String.format(Locale.ROOT, "$%,d", amount.setScale(0, RoundingMode.HALF_UP).toBigInteger());
    }

    /** Short form for summaries, e.g. {@code $1.2M}, {@code $150K}, {@code $950}. */
    static String compact(BigDecimal amount) {
        BigDecimal abs = amount.abs();
        String sign = amount.signum() < 0 ? "-" : "";
        if (abs.compareTo(MILLION) >= 0) {
            return sign + "$" + abs.divide(MILLION, 1, RoundingMode.HALF_UP).stripTrailingZeros().toPlainString() + "M";
        }
        if (abs.compareTo(THOUSAND) >= 0) {
            return sign + "$" + abs.divide(THOUSAND, 0, RoundingMode.HALF_UP).toPlainString() + "K";
        }
        return sign + "$" + abs.setScale(0, RoundingMode.HALF_UP).toPlainString();
    }
}

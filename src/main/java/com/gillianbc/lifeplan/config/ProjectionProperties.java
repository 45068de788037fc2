package com.gillianbc.lifeplan.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Tunables for the projection and comparison engines, bound from {@code lifeplan.projection.*}.
 * The field defaults apply when the class is created directly.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "lifeplan.projection")
public class ProjectionProperties {

    /**
     * Net worth levels that raise a milestone when first exceeded. Must be strictly increasing.
     */
    private List<BigDecimal> netWorthThresholds = new ArrayList<>(List.of(
            new BigDecimal("100000"),
            new BigDecimal("250000"),
            new BigDecimal("500000"),
            new BigDecimal("1000000"),
            new BigDecimal("2500000"),
            new BigDecimal("5000000"),
            new BigDecimal("10000000")));

    /** Years in a quick preview trajectory. */
    private int quickYears = 10;

    /** Worker threads used by the background dispatcher. */
    private int dispatcherThreads = 2;

    private Insight insight = new Insight();

    /**
     * Materiality thresholds for the comparison key insight.
     */
    @Getter
    @Setter
    public static class Insight {
        private BigDecimal netWorthThreshold = new BigDecimal("100000");
        private BigDecimal interestThreshold = new BigDecimal("1000");
        /** One full-time work year. */
        private BigDecimal workHoursThreshold = new BigDecimal("2080");
    }
}

package com.gillianbc.lifeplan.service;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One year of compounding for a single balance.
 */
@Value
@Builder
public class GrowthResult {

    @NonNull BigDecimal startingBalance;
    @NonNull BigDecimal endingBalance;
    /** Holder's own contributions. */
    @NonNull BigDecimal contributions;
    @NonNull BigDecimal employerMatch;
    /** Amount actually deposited over the year, own contributions plus match. */
    @NonNull BigDecimal totalContributions;
    /** Investment return: ending balance less starting balance and deposits. */
    @NonNull BigDecimal growth;
}

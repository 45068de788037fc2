package com.gillianbc.lifeplan.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder(toBuilder = true)
public class Asset {

    @NonNull String id;
    @NonNull String name;
    @NonNull @Builder.Default AssetType type = AssetType.SAVINGS;
    @NonNull BigDecimal balance;
    @NonNull @Builder.Default BigDecimal monthlyContribution = BigDecimal.ZERO;
    /**
     * Expected annual return; null falls back to the market return
     * (or home appreciation for property).
     */
    BigDecimal expectedReturn;
    /** Employer match rate, e.g. 0.50 for 50 cents per dollar. */
    BigDecimal employerMatch;
    /** Share of salary the employer will match, e.g. 0.06. */
    BigDecimal matchLimit;

    public boolean hasEmployerMatch() {
        return employerMatch != null && matchLimit != null;
    }
}

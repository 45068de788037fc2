package com.gillianbc.lifeplan.model;

public enum AssetType {
    RETIREMENT_PRETAX,
    RETIREMENT_ROTH,
    SAVINGS,
    INVESTMENT,
    PROPERTY,
    OTHER;

    /** Balances that count towards retirement readiness. */
    public boolean isRetirementEligible() {
        return this == RETIREMENT_PRETAX || this == RETIREMENT_ROTH || this == INVESTMENT;
    }

    /** Balances that count towards a savings goal. */
    public boolean isLiquid() {
        return this == SAVINGS || this == INVESTMENT;
    }
}

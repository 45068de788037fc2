package com.gillianbc.lifeplan.model.comparison;

public enum ChangeKind {
    INCOME_AMOUNT,
    DEBT_RATE,
    DEBT_PAYMENT,
    ASSET_CONTRIBUTION,
    ASSUMPTION
}

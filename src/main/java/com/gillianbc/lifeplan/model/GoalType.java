package com.gillianbc.lifeplan.model;

public enum GoalType {
    NET_WORTH,
    SAVINGS,
    DEBT_FREE,
    RETIREMENT
}

package com.gillianbc.lifeplan.model;

public enum MilestoneType {
    DEBT_PAYOFF,
    GOAL_ACHIEVED,
    GOAL_MISSED,
    RETIREMENT_READY,
    PMI_REMOVED,
    NET_WORTH_MILESTONE
}

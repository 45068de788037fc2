package com.gillianbc.lifeplan.model;

public enum IncomeType {
    SALARY,
    HOURLY,
    VARIABLE,
    PASSIVE
}

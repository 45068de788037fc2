package com.gillianbc.lifeplan.model;

public enum DebtType {
    MORTGAGE,
    STUDENT,
    AUTO,
    CREDIT,
    PERSONAL,
    OTHER
}

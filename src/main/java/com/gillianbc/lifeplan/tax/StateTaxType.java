package com.gillianbc.lifeplan.tax;

public enum StateTaxType {
    NONE,
    FLAT,
    PROGRESSIVE
}

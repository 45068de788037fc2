package com.gillianbc.lifeplan.model;

public enum FilingStatus {
    SINGLE,
    MARRIED_JOINT,
    MARRIED_SEPARATE,
    HEAD_OF_HOUSEHOLD
}

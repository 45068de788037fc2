package com.gillianbc.lifeplan.model;

import lombok.Value;

/**
 * A calendar month, used for income end dates, obligation end dates and goal targets.
 */
@Value
public class MonthYear {

    int month;
    int year;

    public MonthYear(int month, int year) {
        if (month < 1 || month > 12) {
            throw new IllegalArgumentException("month must be between 1 and 12");
        }
        this.month = month;
        this.year = year;
    }

    public static MonthYear of(int month, int year) {
        return new MonthYear(month, year);
    }
}

package com.gillianbc.lifeplan;

import lombok.Getter;

/**
 * Raised when an input violates a basic precondition, e.g. a negative principal.
 * Carries the path of the offending field so callers can point at it.
 */
@Getter
public class InvalidInputException extends IllegalArgumentException {

    private final String field;
    private final String rule;

    public InvalidInputException(String field, String rule) {
        super(field + " " + rule);
        this.field = field;
        this.rule = rule;
    }
}

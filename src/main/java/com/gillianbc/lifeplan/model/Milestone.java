package com.gillianbc.lifeplan.model;

import lombok.NonNull;
import lombok.Value;

@Value
public class Milestone {

    @NonNull MilestoneType type;
    int year;
    int month;
    @NonNull String description;
    /** Id of the debt, goal or other entity the milestone is about; may be null. */
    String relatedId;
}

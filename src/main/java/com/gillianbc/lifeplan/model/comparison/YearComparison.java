package com.gillianbc.lifeplan.model.comparison;

import com.gillianbc.lifeplan.model.TrajectoryYear;
import lombok.NonNull;
import lombok.Value;

/**
 * Both scenarios side by side for one calendar year.
 */
@Value
public class YearComparison {

    @NonNull TrajectoryYear baseline;
    @NonNull TrajectoryYear alternate;
    @NonNull YearDelta delta;
}

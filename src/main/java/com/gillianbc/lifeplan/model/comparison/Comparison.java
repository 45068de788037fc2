package com.gillianbc.lifeplan.model.comparison;

import com.gillianbc.lifeplan.model.Trajectory;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A baseline and an alternate trajectory with their year-by-year differences.
 */
@Value
public class Comparison {

    String name;
    Instant createdAt;
    Trajectory baseline;
    Trajectory alternate;
    List<Change> changes;
    List<YearDelta> deltas;
    ComparisonSummary summary;

    public Comparison(String name, Instant createdAt, Trajectory baseline, Trajectory alternate,
                      List<Change> changes, List<YearDelta> deltas, ComparisonSummary summary) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt must not be null");
        this.baseline = Objects.requireNonNull(baseline, "baseline must not be null");
        this.alternate = Objects.requireNonNull(alternate, "alternate must not be null");
        this.changes = List.copyOf(changes);
        this.deltas = List.copyOf(deltas);
        this.summary = Objects.requireNonNull(summary, "summary must not be null");
    }
}

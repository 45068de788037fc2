package com.gillianbc.lifeplan.dispatch;

import com.gillianbc.lifeplan.model.Trajectory;
import com.gillianbc.lifeplan.model.comparison.Change;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

import java.util.List;

/**
 * Compares two trajectories the caller has already projected.
 */
@Getter
@ToString
@EqualsAndHashCode(callSuper = false)
public class CompareRequest extends ProjectionRequest {

    private final Trajectory baseline;
    private final Trajectory alternate;
    private final List<Change> changes;
    private final String name;

    public CompareRequest(@NonNull Trajectory baseline, @NonNull Trajectory alternate, @NonNull List<Change> changes, String name) {
        this.baseline = baseline;
        this.alternate = alternate;
        this.changes = List.copyOf(changes);
        this.name = name;
    }

    public CompareRequest(Trajectory baseline, Trajectory alternate, List<Change> changes) {
        this(baseline, alternate, changes, null);
    }
}

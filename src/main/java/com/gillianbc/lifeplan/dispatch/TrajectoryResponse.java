package com.gillianbc.lifeplan.dispatch;

import com.gillianbc.lifeplan.model.Trajectory;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

@Getter
@ToString
@EqualsAndHashCode(callSuper = false)
public class TrajectoryResponse extends ProjectionResponse {

    private final Trajectory trajectory;

    public TrajectoryResponse(@NonNull Trajectory trajectory) {
        this.trajectory = trajectory;
    }
}

package com.gillianbc.lifeplan.dispatch;

import com.gillianbc.lifeplan.model.comparison.Comparison;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

@Getter
@ToString
@EqualsAndHashCode(callSuper = false)
public class ComparisonResponse extends ProjectionResponse {

    private final Comparison comparison;

    public ComparisonResponse(@NonNull Comparison comparison) {
        this.comparison = comparison;
    }
}

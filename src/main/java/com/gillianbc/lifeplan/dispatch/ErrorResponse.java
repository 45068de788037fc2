package com.gillianbc.lifeplan.dispatch;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

@Getter
@ToString
@EqualsAndHashCode(callSuper = false)
public class ErrorResponse extends ProjectionResponse {

    private final String message;

    public ErrorResponse(@NonNull String message) {
        this.message = message;
    }

    @Override
    public boolean isError() {
        return true;
    }
}

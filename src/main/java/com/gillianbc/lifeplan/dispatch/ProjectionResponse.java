package com.gillianbc.lifeplan.dispatch;

/**
 * Result of a dispatched request. Failures arrive as {@link ErrorResponse}.
 */
public abstract class ProjectionResponse {

    ProjectionResponse() {
    }

    public boolean isError() {
        return false;
    }
}

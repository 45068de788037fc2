package com.gillianbc.lifeplan.dispatch;

/**
 * Work handed to the {@link ProjectionDispatcher}.
 */
public abstract class ProjectionRequest {

    ProjectionRequest() {
    }
}

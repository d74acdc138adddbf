package com.architecture.migration.impact.service.graph;

/**
 * Thrown when a root input cannot be opened, so there is nothing to enumerate.
 */
public class GraphBuildException extends RuntimeException {

    public GraphBuildException(String message, Throwable cause) {
        super(message, cause);
    }
}

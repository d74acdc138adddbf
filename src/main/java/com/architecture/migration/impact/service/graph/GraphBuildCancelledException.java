package com.architecture.migration.impact.service.graph;

import com.architecture.migration.impact.model.graph.DependencyGraph;
import lombok.Getter;

/**
 * Thrown when a build observes cancellation. Carries the graph as populated so far, which
 * must not be treated as complete.
 */
@Getter
public class GraphBuildCancelledException extends RuntimeException {

    private final transient DependencyGraph partialGraph;

    public GraphBuildCancelledException(DependencyGraph partialGraph) {
        super("Graph build cancelled");
        this.partialGraph = partialGraph;
    }
}

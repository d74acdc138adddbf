package com.architecture.migration.impact.model.graph.nodes;

import com.architecture.migration.impact.model.graph.NodeKind;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Root of one codebase tree. A single-project input is wrapped in a virtual solution.
 */
@Value
@Builder
public class SolutionNode implements GraphNode {

    @NonNull
    String id;

    @NonNull
    String path;

    @NonNull
    String name;

    boolean virtual;

    @Override
    public String getDisplayName() {
        return name;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.SOLUTION;
    }
}

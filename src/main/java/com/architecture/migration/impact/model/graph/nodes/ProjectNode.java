package com.architecture.migration.impact.model.graph.nodes;

import com.architecture.migration.impact.model.graph.GraphPaths;
import com.architecture.migration.impact.model.graph.NodeKind;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A buildable unit, identified by the path of its manifest.
 */
@Value
@Builder
public class ProjectNode implements GraphNode {

    @NonNull
    String id;

    @NonNull
    String path;

    @NonNull
    String name;

    String rootNamespace;

    String targetFramework;

    @Builder.Default
    ProjectKind projectKind = ProjectKind.LIBRARY;

    /**
     * Directory holding the project manifest.
     */
    public String getDirectory() {
        return GraphPaths.directoryOf(path);
    }

    @Override
    public String getDisplayName() {
        return name;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.PROJECT;
    }
}

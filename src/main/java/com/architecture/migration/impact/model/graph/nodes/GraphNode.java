package com.architecture.migration.impact.model.graph.nodes;

import com.architecture.migration.impact.model.graph.NodeKind;

/**
 * Common contract of every node stored in the dependency graph.
 */
public interface GraphNode {

    String getId();

    String getDisplayName();

    NodeKind getKind();
}

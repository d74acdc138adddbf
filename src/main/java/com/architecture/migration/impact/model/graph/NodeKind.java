package com.architecture.migration.impact.model.graph;

/**
 * Node kinds stored in the dependency graph. Declaration order is the lookup order
 * used by {@link DependencyGraph#getNode(String)}.
 */
public enum NodeKind {
    SOLUTION,
    PROJECT,
    FILE,
    TYPE,
    PACKAGE,
    NAMESPACE
}

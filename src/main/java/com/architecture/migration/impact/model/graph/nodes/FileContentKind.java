package com.architecture.migration.impact.model.graph.nodes;

public enum FileContentKind {
    SOURCE,
    MARKUP,
    DATA,
    OTHER
}

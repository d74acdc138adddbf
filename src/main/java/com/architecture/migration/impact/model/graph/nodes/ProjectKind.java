package com.architecture.migration.impact.model.graph.nodes;

public enum ProjectKind {
    LIBRARY,
    EXECUTABLE,
    GUI,
    WEB_API,
    TEST,
    OTHER
}

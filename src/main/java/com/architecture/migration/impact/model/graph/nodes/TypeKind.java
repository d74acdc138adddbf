package com.architecture.migration.impact.model.graph.nodes;

public enum TypeKind {
    CLASS,
    INTERFACE,
    RECORD,
    STRUCT,
    ENUM,
    DELEGATE,
    ANNOTATION
}

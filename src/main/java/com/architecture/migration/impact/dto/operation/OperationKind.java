package com.architecture.migration.impact.dto.operation;

public enum OperationKind {
    MOVE,
    RENAME_NAMESPACE,
    DELETE,
    MOVE_TYPE
}

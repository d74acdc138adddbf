package com.architecture.migration.impact.dto.impact;

public enum AffectedTypeReason {
    DIRECTLY_MOVED,
    DIRECTLY_DELETED,
    NAMESPACE_CHANGED,
    REFERENCES_MOVED_TYPE,
    INHERITS_FROM_MOVED_TYPE,
    IMPLEMENTS_MOVED_INTERFACE
}

package com.architecture.migration.impact.dto.impact;

/**
 * Advisory conditions. They never block an operation.
 */
public enum WarningCode {
    PARTIAL_CLASS,
    LARGE_FOLDER_MOVE,
    BROKEN_REFERENCE,
    NAMESPACE_EMPTY
}

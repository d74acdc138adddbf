package com.architecture.migration.impact.dto.impact;

/**
 * Conditions that block an operation.
 */
public enum ErrorCode {
    FILE_NOT_FOUND,
    TARGET_EXISTS,
    TYPE_NOT_FOUND,
    TYPE_IN_USE
}

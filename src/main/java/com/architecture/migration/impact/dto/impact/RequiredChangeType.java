package com.architecture.migration.impact.dto.impact;

public enum RequiredChangeType {
    UPDATE_USING_DIRECTIVE,
    ADD_USING_DIRECTIVE,
    REMOVE_USING_DIRECTIVE,
    UPDATE_FULLY_QUALIFIED_NAME,
    UPDATE_NAMESPACE,
    UPDATE_PROJECT_REFERENCE,
    MOVE_FILE,
    DELETE_FILE
}

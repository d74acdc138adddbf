package com.architecture.migration.impact.dto.operation;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Move a single type to another namespace, optionally into a new file.
 */
@Value
@Builder
public class MoveTypeOperation implements MigrationOperation {

    @NonNull
    String typeFullName;

    @NonNull
    String newNamespace;

    String newFilePath;

    @Override
    public OperationKind getKind() {
        return OperationKind.MOVE_TYPE;
    }

    @Override
    public String getDescription() {
        return "Move type " + typeFullName + " to " + newNamespace;
    }
}

package com.architecture.migration.impact.dto.operation;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Value
@Builder
public class RenameNamespaceOperation implements MigrationOperation {

    @NonNull
    String oldNamespace;

    @NonNull
    String newNamespace;

    @Override
    public OperationKind getKind() {
        return OperationKind.RENAME_NAMESPACE;
    }

    @Override
    public String getDescription() {
        return "Rename namespace " + oldNamespace + " to " + newNamespace;
    }
}

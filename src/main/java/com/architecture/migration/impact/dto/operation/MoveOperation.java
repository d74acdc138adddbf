package com.architecture.migration.impact.dto.operation;

import com.architecture.migration.impact.model.graph.GraphPaths;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Move a file, or every file below a folder, to a new location.
 */
@Value
@Builder
public class MoveOperation implements MigrationOperation {

    @NonNull
    String sourcePath;

    @NonNull
    String targetPath;

    // Namespace the moved file will declare; null keeps the current one
    String newNamespace;

    boolean folder;

    @Override
    public OperationKind getKind() {
        return OperationKind.MOVE;
    }

    @Override
    public String getDescription() {
        return "Move " + GraphPaths.fileNameOf(sourcePath) + " to " + targetPath;
    }
}

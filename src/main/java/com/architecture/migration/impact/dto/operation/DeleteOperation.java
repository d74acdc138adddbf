package com.architecture.migration.impact.dto.operation;

import com.architecture.migration.impact.model.graph.GraphPaths;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Delete a file or folder. With {@code force} set, references to the deleted types are
 * reported as warnings instead of errors.
 */
@Value
@Builder
public class DeleteOperation implements MigrationOperation {

    @NonNull
    String path;

    boolean force;

    boolean folder;

    @Override
    public OperationKind getKind() {
        return OperationKind.DELETE;
    }

    @Override
    public String getDescription() {
        return "Delete " + GraphPaths.fileNameOf(path);
    }
}

package com.architecture.migration.impact.model.graph.nodes;

import com.architecture.migration.impact.model.graph.GraphPaths;
import com.architecture.migration.impact.model.graph.NodeKind;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Value
@Builder
public class FileNode implements GraphNode {

    @NonNull
    String id;

    @NonNull
    String path;

    // null when the file declares no namespace
    String namespace;

    @Builder.Default
    FileContentKind contentKind = FileContentKind.SOURCE;

    public String getFileName() {
        return GraphPaths.fileNameOf(path);
    }

    public String getDirectory() {
        return GraphPaths.directoryOf(path);
    }

    @Override
    public String getDisplayName() {
        return getFileName();
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.FILE;
    }
}

package com.architecture.migration.impact.model.graph;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Directed edge between two node ids. Only {@link EdgeKind#FILE_USES_NAMESPACE}
 * carries a line number.
 */
@Value
@Builder
public class GraphEdge {

    @NonNull
    EdgeKind kind;

    @NonNull
    String sourceId;

    @NonNull
    String targetId;

    Integer lineNumber;

    public static GraphEdge of(EdgeKind kind, String sourceId, String targetId) {
        return GraphEdge.builder()
                .kind(kind)
                .sourceId(sourceId)
                .targetId(targetId)
                .build();
    }

    public static GraphEdge namespaceUsage(String fileId, String namespaceId, int lineNumber) {
        return GraphEdge.builder()
                .kind(EdgeKind.FILE_USES_NAMESPACE)
                .sourceId(fileId)
                .targetId(namespaceId)
                .lineNumber(lineNumber)
                .build();
    }

    @Override
    public String toString() {
        return sourceId + " -[" + kind + "]-> " + targetId;
    }
}

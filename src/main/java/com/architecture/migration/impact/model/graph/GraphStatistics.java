package com.architecture.migration.impact.model.graph;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Node and edge counts of a graph, used for build-completion reporting.
 */
@Value
@Builder
public class GraphStatistics {

    // Breakdown by kind, e.g. {PROJECT: 4, FILE: 120}
    @Singular("nodeCount")
    Map<NodeKind, Integer> nodeCounts;

    @Singular("edgeCount")
    Map<EdgeKind, Integer> edgeCounts;

    public int nodeCount(NodeKind kind) {
        return nodeCounts.getOrDefault(kind, 0);
    }

    public int edgeCount(EdgeKind kind) {
        return edgeCounts.getOrDefault(kind, 0);
    }

    public int getTotalNodes() {
        return nodeCounts.values().stream().mapToInt(Integer::intValue).sum();
    }

    public int getTotalEdges() {
        return edgeCounts.values().stream().mapToInt(Integer::intValue).sum();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("Graph Statistics:\n");
        sb.append("  Solutions:  ").append(nodeCount(NodeKind.SOLUTION)).append('\n');
        sb.append("  Projects:   ").append(nodeCount(NodeKind.PROJECT)).append('\n');
        sb.append("  Files:      ").append(nodeCount(NodeKind.FILE)).append('\n');
        sb.append("  Types:      ").append(nodeCount(NodeKind.TYPE)).append('\n');
        sb.append("  Packages:   ").append(nodeCount(NodeKind.PACKAGE)).append('\n');
        sb.append("  Namespaces: ").append(nodeCount(NodeKind.NAMESPACE)).append('\n');
        sb.append("  Total Edges: ").append(getTotalEdges());
        for (EdgeKind kind : EdgeKind.values()) {
            int count = edgeCount(kind);
            if (count > 0) {
                sb.append("\n    ").append(kind).append(": ").append(count);
            }
        }
        return sb.toString();
    }
}

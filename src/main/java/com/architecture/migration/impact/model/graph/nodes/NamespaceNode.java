package com.architecture.migration.impact.model.graph.nodes;

import com.architecture.migration.impact.model.graph.NodeKind;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Value
@Builder
public class NamespaceNode implements GraphNode {

    @NonNull
    String id;

    @NonNull
    String name;

    @Override
    public String getDisplayName() {
        return name;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.NAMESPACE;
    }
}

package com.architecture.migration.impact.model.graph.nodes;

import com.architecture.migration.impact.model.graph.NodeKind;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * External dependency of a project. Not code owned by the analyzed tree.
 */
@Value
@Builder
public class PackageNode implements GraphNode {

    @NonNull
    String id;

    @NonNull
    String packageId;

    String version;

    @Override
    public String getDisplayName() {
        return version == null ? packageId : packageId + " " + version;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.PACKAGE;
    }
}

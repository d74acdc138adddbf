package com.architecture.migration.impact.model.graph.nodes;

import com.architecture.migration.impact.model.graph.NodeKind;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A declared type, owned by exactly one file.
 */
@Value
@Builder
public class TypeNode implements GraphNode {

    @NonNull
    String id;

    @NonNull
    String fullName;

    @Builder.Default
    String namespace = "";

    @NonNull
    String simpleName;

    @Builder.Default
    TypeKind typeKind = TypeKind.CLASS;

    @NonNull
    String fileId;

    boolean publicType;
    boolean partial;
    boolean staticType;
    boolean abstractType;

    @Override
    public String getDisplayName() {
        return fullName;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.TYPE;
    }
}

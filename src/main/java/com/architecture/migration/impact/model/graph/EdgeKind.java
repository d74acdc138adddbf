package com.architecture.migration.impact.model.graph;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Relationship kinds between graph nodes.
 */
@Getter
@RequiredArgsConstructor
public enum EdgeKind {
    SOLUTION_CONTAINS_PROJECT("Solution contains project"),
    PROJECT_CONTAINS_FILE("Project contains file"),
    PROJECT_REFERENCE("Project references project"),
    PACKAGE_REFERENCE("Project references package"),
    FILE_CONTAINS_TYPE("File contains type"),
    FILE_USES_NAMESPACE("File uses namespace"),
    TYPE_IN_NAMESPACE("Type in namespace"),
    TYPE_INHERITS("Type inherits from"),
    TYPE_IMPLEMENTS("Type implements"),
    TYPE_USAGE("Type uses");

    private final String description;

    /**
     * Edge kinds that mean "the source type depends on the target type".
     */
    public boolean isTypeReference() {
        return this == TYPE_USAGE || this == TYPE_INHERITS || this == TYPE_IMPLEMENTS;
    }
}

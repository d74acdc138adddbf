package com.architecture.migration.impact.model.graph;

import java.util.Objects;

/**
 * Deterministic node identifiers. The same input always yields the same id, so a
 * file processed twice maps onto the node inserted the first time.
 */
public final class GraphIds {

    public static final String SOLUTION_PREFIX = "sln:";
    public static final String PROJECT_PREFIX = "proj:";
    public static final String FILE_PREFIX = "file:";
    public static final String TYPE_PREFIX = "type:";
    public static final String PACKAGE_PREFIX = "pkg:";
    public static final String NAMESPACE_PREFIX = "ns:";

    private GraphIds() {
    }

    public static String solutionId(String path) {
        return SOLUTION_PREFIX + Objects.requireNonNull(path, "path");
    }

    public static String projectId(String path) {
        return PROJECT_PREFIX + Objects.requireNonNull(path, "path");
    }

    public static String fileId(String path) {
        return FILE_PREFIX + Objects.requireNonNull(path, "path");
    }

    public static String typeId(String fullName) {
        return TYPE_PREFIX + Objects.requireNonNull(fullName, "fullName");
    }

    /**
     * Id of one part of a type split across several files. Each part is its own node.
     */
    public static String partialTypeId(String fullName, String filePath) {
        return typeId(fullName) + "#" + Objects.requireNonNull(filePath, "filePath");
    }

    public static String packageId(String packageName) {
        return PACKAGE_PREFIX + Objects.requireNonNull(packageName, "packageName");
    }

    public static String namespaceId(String namespace) {
        return NAMESPACE_PREFIX + Objects.requireNonNull(namespace, "namespace");
    }
}

package com.architecture.migration.impact.service.graph;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Immutable settings for one graph build.
 */
@Value
@Builder(toBuilder = true)
public class GraphBuildOptions {

    @Builder.Default
    boolean analyzeTypeUsages = true;

    @Builder.Default
    boolean analyzeUsingDirectives = true;

    boolean includePrivateTypes;

    boolean includeGeneratedFiles;

    @Singular("excludePattern")
    List<String> excludePatterns;

    @Singular("generatedFileSuffix")
    List<String> generatedFileSuffixes;

    @Singular("generatedFilePattern")
    List<String> generatedFilePatterns;

    @Builder.Default
    int maxTypeUsageDepth = 3;

    // Worker threads for the project phase; 1 processes projects sequentially
    @Builder.Default
    int parallelism = 4;

    public static GraphBuildOptions defaults() {
        return withStandardFilters(GraphBuildOptions.builder()).build();
    }

    /**
     * Structure only: no usage resolution and no import edges.
     */
    public static GraphBuildOptions fast() {
        return withStandardFilters(GraphBuildOptions.builder())
                .analyzeTypeUsages(false)
                .analyzeUsingDirectives(false)
                .build();
    }

    /**
     * Everything, including private types and generated files.
     */
    public static GraphBuildOptions full() {
        return withStandardFilters(GraphBuildOptions.builder())
                .includePrivateTypes(true)
                .includeGeneratedFiles(true)
                .maxTypeUsageDepth(5)
                .build();
    }

    private static GraphBuildOptionsBuilder withStandardFilters(GraphBuildOptionsBuilder builder) {
        return builder
                .excludePattern("**/target/**")
                .excludePattern("**/build/**")
                .excludePattern("**/.git/**")
                .excludePattern("**/.idea/**")
                .generatedFileSuffix(".g.java")
                .generatedFileSuffix(".generated.java")
                .generatedFilePattern("**/generated-sources/**");
    }
}

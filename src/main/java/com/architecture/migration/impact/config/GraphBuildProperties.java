package com.architecture.migration.impact.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Graph build settings bound from {@code migration.graph.*}.
 */
@Data
@ConfigurationProperties(prefix = "migration.graph")
public class GraphBuildProperties {

    private boolean analyzeTypeUsages = true;

    private boolean analyzeUsingDirectives = true;

    private boolean includePrivateTypes = false;

    private boolean includeGeneratedFiles = false;

    private int maxTypeUsageDepth = 3;

    private int parallelism = 4;

    private List<String> excludePatterns = new ArrayList<>(List.of(
            "**/target/**", "**/build/**", "**/.git/**", "**/.idea/**"));

    private List<String> generatedFileSuffixes = new ArrayList<>(List.of(".g.java", ".generated.java"));

    private List<String> generatedFilePatterns = new ArrayList<>(List.of("**/generated-sources/**"));
}

package com.architecture.migration.impact.config;

import com.architecture.migration.impact.service.graph.GraphBuildOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(GraphBuildProperties.class)
@Slf4j
public class GraphBuildConfig {

    /**
     * Options used when a build is started without explicit options.
     */
    @Bean
    public GraphBuildOptions defaultGraphBuildOptions(GraphBuildProperties properties) {
        GraphBuildOptions options = GraphBuildOptions.builder()
                .analyzeTypeUsages(properties.isAnalyzeTypeUsages())
                .analyzeUsingDirectives(properties.isAnalyzeUsingDirectives())
                .includePrivateTypes(properties.isIncludePrivateTypes())
                .includeGeneratedFiles(properties.isIncludeGeneratedFiles())
                .maxTypeUsageDepth(properties.getMaxTypeUsageDepth())
                .parallelism(Math.max(1, properties.getParallelism()))
                .excludePatterns(properties.getExcludePatterns())
                .generatedFileSuffixes(properties.getGeneratedFileSuffixes())
                .generatedFilePatterns(properties.getGeneratedFilePatterns())
                .build();
        log.info("[graph-config] Default build options: usages={}, imports={}, depth={}, parallelism={}",
                options.isAnalyzeTypeUsages(), options.isAnalyzeUsingDirectives(),
                options.getMaxTypeUsageDepth(), options.getParallelism());
        return options;
    }
}

package com.architecture.migration.impact.service.graph;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class GraphBuildOptionsTest {

    @Test
    void defaults_analyzeUsagesAndImports() {
        GraphBuildOptions options = GraphBuildOptions.defaults();

        assertThat(options.isAnalyzeTypeUsages()).isTrue();
        assertThat(options.isAnalyzeUsingDirectives()).isTrue();
        assertThat(options.isIncludePrivateTypes()).isFalse();
        assertThat(options.isIncludeGeneratedFiles()).isFalse();
        assertThat(options.getMaxTypeUsageDepth()).isEqualTo(3);
        assertThat(options.getExcludePatterns())
                .containsExactly("**/target/**", "**/build/**", "**/.git/**", "**/.idea/**");
    }

    @Test
    void fast_skipsUsageAnalysis() {
        GraphBuildOptions options = GraphBuildOptions.fast();

        assertThat(options.isAnalyzeTypeUsages()).isFalse();
        assertThat(options.isAnalyzeUsingDirectives()).isFalse();
        assertThat(options.getExcludePatterns()).hasSize(4);
    }

    @Test
    void full_includesEverything() {
        GraphBuildOptions options = GraphBuildOptions.full();

        assertThat(options.isIncludePrivateTypes()).isTrue();
        assertThat(options.isIncludeGeneratedFiles()).isTrue();
        assertThat(options.getMaxTypeUsageDepth()).isEqualTo(5);
    }
}

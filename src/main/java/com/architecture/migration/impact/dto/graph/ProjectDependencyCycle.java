package com.architecture.migration.impact.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A cycle in the project reference graph.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProjectDependencyCycle {

    private String description;

    // e.g. ["proj:a/pom.xml", "proj:b/pom.xml", "proj:a/pom.xml"]
    @Builder.Default
    private List<String> projectIds = new ArrayList<>();

    @Builder.Default
    private List<String> projectNames = new ArrayList<>();
}

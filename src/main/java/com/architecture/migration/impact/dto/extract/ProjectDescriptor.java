package com.architecture.migration.impact.dto.extract;

import com.architecture.migration.impact.model.graph.nodes.ProjectKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A project as loaded from its manifest, before it becomes a graph node.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProjectDescriptor {

    private String path;            // path of the manifest file
    private String name;
    private String rootNamespace;
    private String targetFramework;

    @Builder.Default
    private ProjectKind kind = ProjectKind.LIBRARY;

    // Manifest paths of referenced projects
    @Builder.Default
    private List<String> projectReferences = new ArrayList<>();

    @Builder.Default
    private List<PackageDescriptor> packageReferences = new ArrayList<>();

    // Source files that belong to the project
    @Builder.Default
    private List<String> files = new ArrayList<>();
}

package com.architecture.migration.impact.dto.extract;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of loading one input path: a real multi-project grouping, or a virtual one wrapping a
 * single project.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SolutionDescriptor {

    private String path;
    private String name;
    private boolean virtual;

    @Builder.Default
    private List<ProjectDescriptor> projects = new ArrayList<>();
}

package com.architecture.migration.impact.dto.extract;

import com.architecture.migration.impact.model.graph.nodes.FileContentKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything the graph builder needs to know about one file.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SourceFileFacts {

    private String namespace;

    @Builder.Default
    private FileContentKind contentKind = FileContentKind.SOURCE;

    @Builder.Default
    private List<ImportDirective> imports = new ArrayList<>();

    @Builder.Default
    private List<DeclaredType> types = new ArrayList<>();
}

package com.architecture.migration.impact.dto.extract;

import com.architecture.migration.impact.model.graph.nodes.TypeKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A top-level type declaration found in a source file.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeclaredType {

    @Builder.Default
    private TypeKind kind = TypeKind.CLASS;

    private String fullName;
    private String simpleName;
    private String namespace;

    @Builder.Default
    private Accessibility accessibility = Accessibility.PUBLIC;

    private boolean partial;
    private boolean staticType;
    private boolean abstractType;

    // Full name of the superclass; null for the root object type
    private String baseType;

    @Builder.Default
    private List<String> interfaces = new ArrayList<>();

    // Full names of every type used in the declaration's body and signatures
    @Builder.Default
    private List<String> referencedTypes = new ArrayList<>();
}

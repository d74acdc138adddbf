package com.architecture.migration.impact.service.extract;

import com.architecture.migration.impact.dto.extract.Accessibility;
import com.architecture.migration.impact.dto.extract.DeclaredType;
import com.architecture.migration.impact.dto.extract.ImportDirective;
import com.architecture.migration.impact.dto.extract.ProjectDescriptor;
import com.architecture.migration.impact.dto.extract.SourceFileFacts;
import com.architecture.migration.impact.model.graph.nodes.FileContentKind;
import com.architecture.migration.impact.model.graph.nodes.TypeKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import spoon.Launcher;
import spoon.experimental.CtUnresolvedImport;
import spoon.reflect.cu.CompilationUnit;
import spoon.reflect.cu.SourcePosition;
import spoon.reflect.declaration.CtAnnotationType;
import spoon.reflect.declaration.CtImport;
import spoon.reflect.declaration.CtPackage;
import spoon.reflect.declaration.CtRecord;
import spoon.reflect.declaration.CtType;
import spoon.reflect.reference.CtExecutableReference;
import spoon.reflect.reference.CtFieldReference;
import spoon.reflect.reference.CtPackageReference;
import spoon.reflect.reference.CtReference;
import spoon.reflect.reference.CtTypeMemberWildcardImportReference;
import spoon.reflect.reference.CtTypeReference;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Extracts source facts from Java files with Spoon.
 *
 * One Spoon model is built per project, on the first file requested for it, and kept until
 * {@link #release(ProjectDescriptor)}. Java packages are reported as namespaces and import
 * declarations as using directives. Non-Java files are classified by extension only.
 */
@Component
@Slf4j
public class SpoonSourceFactExtractor implements SourceFactExtractor {

    private static final String ROOT_OBJECT_TYPE = "java.lang.Object";

    private final int complianceLevel;
    private final Map<String, ProjectModel> models = new ConcurrentHashMap<>();

    public SpoonSourceFactExtractor(@Value("${migration.spoon.compliance-level:17}") int complianceLevel) {
        this.complianceLevel = complianceLevel;
    }

    @Override
    public SourceFileFacts extract(ProjectDescriptor project, String filePath) {
        Objects.requireNonNull(project, "project");
        Objects.requireNonNull(filePath, "filePath");

        FileContentKind contentKind = classify(filePath);
        if (!isJava(filePath)) {
            return SourceFileFacts.builder().contentKind(contentKind).build();
        }

        ProjectModel model = modelFor(project);
        if (model.failure() != null) {
            throw new FactExtractionException("Spoon model unavailable for " + project.getName()
                    + ": " + model.failure().getMessage(), model.failure());
        }

        CompilationUnit unit = model.units().get(normalize(filePath));
        if (unit == null) {
            throw new FactExtractionException("File is not part of the Spoon model: " + filePath);
        }

        try {
            return SourceFileFacts.builder()
                    .namespace(packageName(unit.getDeclaredPackage()))
                    .contentKind(contentKind)
                    .imports(extractImports(unit))
                    .types(unit.getDeclaredTypes().stream().map(this::toDeclaredType).collect(Collectors.toList()))
                    .build();
        } catch (RuntimeException e) {
            throw new FactExtractionException("Failed to read " + filePath + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void release(ProjectDescriptor project) {
        if (models.remove(project.getPath()) != null) {
            log.debug("Released Spoon model for {}", project.getName());
        }
    }

    // ========================= SPOON MODEL =========================

    /**
     * The model is built outside the map. Workers racing on the same project may both build;
     * the first model stored wins.
     */
    private ProjectModel modelFor(ProjectDescriptor project) {
        ProjectModel cached = models.get(project.getPath());
        if (cached != null) {
            return cached;
        }
        ProjectModel built = buildModel(project);
        ProjectModel existing = models.putIfAbsent(project.getPath(), built);
        return existing != null ? existing : built;
    }

    private ProjectModel buildModel(ProjectDescriptor project) {
        List<String> javaFiles = project.getFiles().stream().filter(SpoonSourceFactExtractor::isJava).collect(Collectors.toList());
        log.info("Building Spoon model for {} ({} Java file(s))", project.getName(), javaFiles.size());
        try {
            Launcher launcher = new Launcher();
            javaFiles.forEach(launcher::addInputResource);
            launcher.getEnvironment().setNoClasspath(true);
            launcher.getEnvironment().setComplianceLevel(complianceLevel);
            launcher.getEnvironment().setIgnoreDuplicateDeclarations(true);
            launcher.getEnvironment().setCommentEnabled(false);
            launcher.buildModel();

            Map<String, CompilationUnit> units = new HashMap<>();
            for (CompilationUnit unit : launcher.getFactory().CompilationUnit().getMap().values()) {
                File file = unit.getFile();
                if (file != null) {
                    units.put(normalize(file.getPath()), unit);
                }
            }
            return new ProjectModel(units, null);
        } catch (RuntimeException e) {
            log.warn("Spoon could not build a model for {}: {}", project.getName(), e.getMessage());
            return new ProjectModel(Map.of(), e);
        }
    }

    // ========================= IMPORTS =========================

    private List<ImportDirective> extractImports(CompilationUnit unit) {
        List<ImportDirective> imports = new ArrayList<>();
        for (CtImport ctImport : unit.getImports()) {
            String namespace = importedNamespace(ctImport);
            if (namespace == null || namespace.isEmpty()) {
                continue;
            }
            imports.add(ImportDirective.builder()
                    .namespace(namespace)
                    .line(lineOf(ctImport.getPosition()))
                    .build());
        }
        // getImports() is a set; report in source order
        imports.sort(Comparator.comparingInt(ImportDirective::getLine));
        return imports;
    }

    /**
     * The package an import statement pulls names from.
     */
    private String importedNamespace(CtImport ctImport) {
        CtReference reference = ctImport.getReference();
        return switch (ctImport.getImportKind()) {
            case TYPE -> typePackage((CtTypeReference<?>) reference);
            case ALL_TYPES -> ((CtPackageReference) reference).getQualifiedName();
            case ALL_STATIC_MEMBERS -> typePackage(((CtTypeMemberWildcardImportReference) reference).getTypeReference());
            case FIELD -> typePackage(((CtFieldReference<?>) reference).getDeclaringType());
            case METHOD -> typePackage(((CtExecutableReference<?>) reference).getDeclaringType());
            case UNRESOLVED -> unresolvedPackage(((CtUnresolvedImport) ctImport).getUnresolvedReference(),
                    ((CtUnresolvedImport) ctImport).isStatic());
            default -> null;
        };
    }

    private String typePackage(CtTypeReference<?> type) {
        if (type == null) {
            return null;
        }
        CtPackageReference pkg = type.getPackage();
        if (pkg != null) {
            return pkg.getQualifiedName();
        }
        return parentName(type.getQualifiedName());
    }

    /**
     * Best effort for imports Spoon could not resolve, e.g. {@code a.b.*} or {@code a.b.C}.
     */
    private String unresolvedPackage(String reference, boolean isStatic) {
        if (reference == null) {
            return null;
        }
        String name = reference.endsWith(".*") ? reference.substring(0, reference.length() - 2) : parentName(reference);
        // static imports name a type (a.b.C.* or a.b.C.member), so drop one more segment
        return isStatic ? parentName(name) : name;
    }

    // ========================= TYPES =========================

    private DeclaredType toDeclaredType(CtType<?> type) {
        CtTypeReference<?> superclass = type.getSuperclass();
        String baseType = superclass == null ? null : superclass.getQualifiedName();
        if (ROOT_OBJECT_TYPE.equals(baseType)) {
            baseType = null;
        }

        List<String> interfaces = type.getSuperInterfaces().stream()
                .map(CtTypeReference::getQualifiedName)
                .sorted()
                .collect(Collectors.toList());

        List<String> referenced = type.getUsedTypes(true).stream()
                .filter(ref -> !ref.isPrimitive())
                .map(CtTypeReference::getQualifiedName)
                .filter(name -> name.contains("."))
                .distinct()
                .sorted()
                .collect(Collectors.toList());

        return DeclaredType.builder()
                .kind(kindOf(type))
                .fullName(type.getQualifiedName())
                .simpleName(type.getSimpleName())
                .namespace(packageName(type.getPackage()) == null ? "" : packageName(type.getPackage()))
                .accessibility(accessibilityOf(type))
                .partial(false)
                .staticType(type.isStatic())
                .abstractType(type.isAbstract())
                .baseType(baseType)
                .interfaces(interfaces)
                .referencedTypes(referenced)
                .build();
    }

    private TypeKind kindOf(CtType<?> type) {
        if (type instanceof CtAnnotationType) {
            return TypeKind.ANNOTATION;
        }
        if (type.isInterface()) {
            return TypeKind.INTERFACE;
        }
        if (type instanceof CtRecord) {
            return TypeKind.RECORD;
        }
        if (type.isEnum()) {
            return TypeKind.ENUM;
        }
        return TypeKind.CLASS;
    }

    private Accessibility accessibilityOf(CtType<?> type) {
        if (type.isPublic()) return Accessibility.PUBLIC;
        if (type.isProtected()) return Accessibility.PROTECTED;
        if (type.isPrivate()) return Accessibility.PRIVATE;
        return Accessibility.PACKAGE_PRIVATE;
    }

    // ========================= HELPERS =========================

    private static String packageName(CtPackage pkg) {
        if (pkg == null || pkg.isUnnamedPackage()) {
            return null;
        }
        return pkg.getQualifiedName();
    }

    private static int lineOf(SourcePosition position) {
        return position != null && position.isValidPosition() ? position.getLine() : 0;
    }

    private static String parentName(String qualifiedName) {
        if (qualifiedName == null) {
            return null;
        }
        int dot = qualifiedName.lastIndexOf('.');
        return dot > 0 ? qualifiedName.substring(0, dot) : null;
    }

    private static FileContentKind classify(String filePath) {
        String name = filePath.toLowerCase(Locale.ROOT);
        if (name.endsWith(".java")) {
            return FileContentKind.SOURCE;
        }
        if (name.endsWith(".xml") || name.endsWith(".fxml") || name.endsWith(".html")) {
            return FileContentKind.MARKUP;
        }
        if (name.endsWith(".properties") || name.endsWith(".yml") || name.endsWith(".yaml") || name.endsWith(".json")) {
            return FileContentKind.DATA;
        }
        return FileContentKind.OTHER;
    }

    private static boolean isJava(String filePath) {
        return filePath.toLowerCase(Locale.ROOT).endsWith(".java");
    }

    /**
     * Key for the unit index. Symlinked workspaces resolve to the same key as their target.
     */
    private static String normalize(String filePath) {
        Path path = Path.of(filePath).toAbsolutePath().normalize();
        try {
            return Files.exists(path) ? path.toRealPath().toString() : path.toString();
        } catch (IOException e) {
            log.debug("Cannot resolve real path of {}: {}", path, e.getMessage());
            return path.toString();
        }
    }

    private record ProjectModel(Map<String, CompilationUnit> units, RuntimeException failure) {
    }
}

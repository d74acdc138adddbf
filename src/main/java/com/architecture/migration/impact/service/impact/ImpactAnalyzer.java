package com.architecture.migration.impact.service.impact;

import com.architecture.migration.impact.dto.impact.AffectedFileReason;
import com.architecture.migration.impact.dto.impact.AffectedTypeReason;
import com.architecture.migration.impact.dto.impact.ErrorCode;
import com.architecture.migration.impact.dto.impact.ImpactReport;
import com.architecture.migration.impact.dto.impact.ImpactReport.AffectedFile;
import com.architecture.migration.impact.dto.impact.ImpactReport.AffectedType;
import com.architecture.migration.impact.dto.impact.ImpactReport.RequiredChange;
import com.architecture.migration.impact.dto.impact.ImpactReport.RequiredProjectReference;
import com.architecture.migration.impact.dto.impact.RequiredChangeType;
import com.architecture.migration.impact.dto.impact.WarningCode;
import com.architecture.migration.impact.dto.operation.DeleteOperation;
import com.architecture.migration.impact.dto.operation.MigrationOperation;
import com.architecture.migration.impact.dto.operation.MoveOperation;
import com.architecture.migration.impact.dto.operation.MoveTypeOperation;
import com.architecture.migration.impact.dto.operation.RenameNamespaceOperation;
import com.architecture.migration.impact.model.graph.DependencyGraph;
import com.architecture.migration.impact.model.graph.EdgeKind;
import com.architecture.migration.impact.model.graph.GraphEdge;
import com.architecture.migration.impact.model.graph.GraphPaths;
import com.architecture.migration.impact.model.graph.nodes.FileNode;
import com.architecture.migration.impact.model.graph.nodes.ProjectNode;
import com.architecture.migration.impact.model.graph.nodes.TypeNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Computes the impact of a proposed migration operation on a built dependency graph.
 *
 * The analyzer never mutates the graph and keeps no state between calls, so one graph can
 * serve any number of concurrent what-if analyses. Expected problems (missing source,
 * existing target, type still in use) become report errors or warnings; a report is
 * always returned.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ImpactAnalyzer {

    static final int LARGE_FOLDER_THRESHOLD = 10;

    private final ComplexityScorer complexityScorer;

    /**
     * Analyze any operation kind.
     */
    public ImpactReport analyze(DependencyGraph graph, MigrationOperation operation) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(operation, "operation");
        return switch (operation.getKind()) {
            case MOVE -> analyzeMove(graph, (MoveOperation) operation);
            case RENAME_NAMESPACE -> analyzeRenameNamespace(graph, (RenameNamespaceOperation) operation);
            case DELETE -> analyzeDelete(graph, (DeleteOperation) operation);
            case MOVE_TYPE -> analyzeMoveType(graph, (MoveTypeOperation) operation);
        };
    }

    // ========================= MOVE =========================

    /**
     * Analyze moving a file, or all files of a folder, to a new location.
     */
    public ImpactReport analyzeMove(DependencyGraph graph, MoveOperation operation) {
        log.info("Analyzing move: {} -> {}", operation.getSourcePath(), operation.getTargetPath());
        ImpactReport report = ImpactReport.builder().operation(operation).build();

        if (operation.isFolder()) {
            analyzeFolderMove(graph, operation, report);
            return finish(report);
        }

        Optional<FileNode> found = graph.findFileByPath(operation.getSourcePath());
        if (found.isEmpty()) {
            report.addError(ErrorCode.FILE_NOT_FOUND,
                    "Source file not found in graph: " + operation.getSourcePath(), operation.getSourcePath());
            return finish(report);
        }
        FileNode source = found.get();

        if (graph.findFileByPath(operation.getTargetPath()).isPresent()) {
            report.addError(ErrorCode.TARGET_EXISTS,
                    "Target file already exists: " + operation.getTargetPath(), operation.getTargetPath());
        }

        String oldNamespace = source.getNamespace();
        String newNamespace = operation.getNewNamespace();

        List<RequiredChange> moveChanges = new ArrayList<>();
        moveChanges.add(moveFileChange(source.getPath(), operation.getTargetPath()));
        if (namespaceChanges(oldNamespace, newNamespace)) {
            moveChanges.add(RequiredChange.builder()
                    .type(RequiredChangeType.UPDATE_NAMESPACE)
                    .currentValue(oldNamespace)
                    .newValue(newNamespace)
                    .description("Update namespace from " + oldNamespace + " to " + newNamespace)
                    .build());
        }
        report.getAffectedFiles().add(affectedFile(graph, source, AffectedFileReason.DIRECTLY_MOVED, moveChanges));

        List<TypeNode> movedTypes = graph.typesInFile(source.getId());
        Set<FileNode> referencingFiles = new LinkedHashSet<>();
        for (TypeNode type : movedTypes) {
            report.getAffectedTypes().add(affectedType(type.getFullName(), source.getPath(), AffectedTypeReason.DIRECTLY_MOVED));
            referencingFiles.addAll(recordReferencingFiles(graph, report, type, source, oldNamespace, newNamespace));
            recordDerivedTypes(graph, report, type, source);
        }

        checkPartialParts(graph, report, movedTypes, source.getPath());
        checkCrossProjectReferences(graph, report, source, operation.getTargetPath(), referencingFiles);

        return finish(report);
    }

    private void analyzeFolderMove(DependencyGraph graph, MoveOperation operation, ImpactReport report) {
        List<FileNode> filesInFolder = graph.filesUnderFolder(operation.getSourcePath());
        log.debug("Folder move covers {} file(s)", filesInFolder.size());

        for (FileNode file : filesInFolder) {
            String newPath = GraphPaths.rebase(file.getPath(), operation.getSourcePath(), operation.getTargetPath());
            if (graph.findFileByPath(newPath).isPresent()) {
                report.addError(ErrorCode.TARGET_EXISTS, "Target file already exists: " + newPath, newPath);
            }
            report.getAffectedFiles().add(affectedFile(graph, file, AffectedFileReason.DIRECTLY_MOVED,
                    List.of(moveFileChange(file.getPath(), newPath))));
        }

        if (filesInFolder.size() > LARGE_FOLDER_THRESHOLD) {
            report.addWarning(WarningCode.LARGE_FOLDER_MOVE,
                    "Moving " + filesInFolder.size() + " files. Consider reviewing the impact carefully.",
                    operation.getSourcePath());
        }
    }

    // ========================= RENAME NAMESPACE =========================

    /**
     * Analyze renaming a namespace: declaring files change their declaration, importing files
     * change their import.
     */
    public ImpactReport analyzeRenameNamespace(DependencyGraph graph, RenameNamespaceOperation operation) {
        log.info("Analyzing namespace rename: {} -> {}", operation.getOldNamespace(), operation.getNewNamespace());
        ImpactReport report = ImpactReport.builder().operation(operation).build();

        List<TypeNode> typesInNamespace = graph.typesInNamespace(operation.getOldNamespace());
        if (typesInNamespace.isEmpty()) {
            report.addWarning(WarningCode.NAMESPACE_EMPTY,
                    "No types found in namespace " + operation.getOldNamespace(), null);
        }

        Map<String, FileNode> declaringFiles = new LinkedHashMap<>();
        for (TypeNode type : typesInNamespace) {
            Optional<FileNode> file = owningFile(graph, type);
            file.ifPresent(f -> declaringFiles.putIfAbsent(f.getId(), f));
            report.getAffectedTypes().add(affectedType(type.getFullName(),
                    file.map(FileNode::getPath).orElse(null), AffectedTypeReason.NAMESPACE_CHANGED));
        }

        for (FileNode file : declaringFiles.values()) {
            report.getAffectedFiles().add(affectedFile(graph, file, AffectedFileReason.DECLARES_NAMESPACE,
                    List.of(RequiredChange.builder()
                            .type(RequiredChangeType.UPDATE_NAMESPACE)
                            .currentValue(operation.getOldNamespace())
                            .newValue(operation.getNewNamespace())
                            .description("Update namespace declaration")
                            .build())));
        }

        for (FileNode file : graph.filesUsingNamespace(operation.getOldNamespace())) {
            if (declaringFiles.containsKey(file.getId())) {
                continue;
            }
            Integer line = graph.namespaceUsage(file.getId(), operation.getOldNamespace())
                    .map(GraphEdge::getLineNumber)
                    .orElse(null);
            report.getAffectedFiles().add(affectedFile(graph, file, AffectedFileReason.CONTAINS_USING_DIRECTIVE,
                    List.of(RequiredChange.builder()
                            .type(RequiredChangeType.UPDATE_USING_DIRECTIVE)
                            .lineNumber(line)
                            .currentValue(operation.getOldNamespace())
                            .newValue(operation.getNewNamespace())
                            .description("Update using directive")
                            .build())));
        }

        return finish(report);
    }

    // ========================= DELETE =========================

    /**
     * Analyze deleting a file or folder. Remaining references to deleted types are errors,
     * or warnings when the operation is forced.
     */
    public ImpactReport analyzeDelete(DependencyGraph graph, DeleteOperation operation) {
        log.info("Analyzing delete: {} (force={}, folder={})",
                operation.getPath(), operation.isForce(), operation.isFolder());
        ImpactReport report = ImpactReport.builder().operation(operation).build();

        List<FileNode> deleted;
        if (operation.isFolder()) {
            deleted = graph.filesUnderFolder(operation.getPath());
        } else {
            Optional<FileNode> file = graph.findFileByPath(operation.getPath());
            if (file.isEmpty()) {
                report.addError(ErrorCode.FILE_NOT_FOUND,
                        "File not found in graph: " + operation.getPath(), operation.getPath());
                return finish(report);
            }
            deleted = List.of(file.get());
        }

        Set<String> deletedIds = deleted.stream().map(FileNode::getId).collect(Collectors.toSet());
        for (FileNode file : deleted) {
            report.getAffectedFiles().add(affectedFile(graph, file, AffectedFileReason.DIRECTLY_DELETED,
                    List.of(RequiredChange.builder()
                            .type(RequiredChangeType.DELETE_FILE)
                            .currentValue(file.getPath())
                            .description("Delete file")
                            .build())));

            for (TypeNode type : graph.typesInFile(file.getId())) {
                report.getAffectedTypes().add(affectedType(type.getFullName(), file.getPath(), AffectedTypeReason.DIRECTLY_DELETED));

                for (FileNode referencing : graph.filesReferencingType(type.getId())) {
                    if (deletedIds.contains(referencing.getId())) {
                        continue;
                    }
                    if (operation.isForce()) {
                        report.addWarning(WarningCode.BROKEN_REFERENCE,
                                "Deleting " + type.getSimpleName() + " will break references in " + referencing.getPath(),
                                referencing.getPath());
                    } else {
                        report.addError(ErrorCode.TYPE_IN_USE,
                                "Type " + type.getSimpleName() + " is referenced in " + referencing.getPath()
                                        + ". Use force to delete anyway.",
                                referencing.getPath());
                    }
                }
            }
        }

        return finish(report);
    }

    // ========================= MOVE TYPE =========================

    /**
     * Analyze moving a single type to another namespace and optionally another file.
     */
    public ImpactReport analyzeMoveType(DependencyGraph graph, MoveTypeOperation operation) {
        log.info("Analyzing move type: {} -> {}", operation.getTypeFullName(), operation.getNewNamespace());
        ImpactReport report = ImpactReport.builder().operation(operation).build();

        Optional<TypeNode> found = graph.findType(operation.getTypeFullName());
        if (found.isEmpty()) {
            report.addError(ErrorCode.TYPE_NOT_FOUND, "Type not found: " + operation.getTypeFullName(), null);
            return finish(report);
        }
        TypeNode type = found.get();

        Optional<FileNode> owner = owningFile(graph, type);
        if (owner.isEmpty()) {
            log.warn("Type {} has no owning file in the graph", type.getFullName());
            report.addError(ErrorCode.FILE_NOT_FOUND,
                    "Source file not found for type: " + operation.getTypeFullName(), null);
            return finish(report);
        }
        FileNode source = owner.get();

        String oldNamespace = type.getNamespace();
        String newNamespace = operation.getNewNamespace();

        List<RequiredChange> changes = new ArrayList<>();
        changes.add(RequiredChange.builder()
                .type(RequiredChangeType.UPDATE_NAMESPACE)
                .currentValue(oldNamespace)
                .newValue(newNamespace)
                .description("Update namespace for " + type.getSimpleName())
                .build());
        if (operation.getNewFilePath() != null) {
            changes.add(moveFileChange(source.getPath(), operation.getNewFilePath()));
            if (graph.findFileByPath(operation.getNewFilePath()).isPresent()) {
                report.addError(ErrorCode.TARGET_EXISTS,
                        "Target file already exists: " + operation.getNewFilePath(), operation.getNewFilePath());
            }
        }
        report.getAffectedFiles().add(affectedFile(graph, source, AffectedFileReason.DIRECTLY_MOVED, changes));
        report.getAffectedTypes().add(affectedType(type.getFullName(), source.getPath(), AffectedTypeReason.DIRECTLY_MOVED));

        Set<FileNode> referencingFiles = recordReferencingFiles(graph, report, type, source, oldNamespace, newNamespace);
        recordDerivedTypes(graph, report, type, source);

        if (operation.getNewFilePath() != null) {
            checkPartialParts(graph, report, List.of(type), source.getPath());
            checkCrossProjectReferences(graph, report, source, operation.getNewFilePath(), referencingFiles);
        }

        return finish(report);
    }

    // ========================= SHARED ANALYSIS =========================

    /**
     * Record an import change for every other file referencing {@code type}.
     *
     * @return every other file referencing the type, whether or not it needs an edit
     */
    private Set<FileNode> recordReferencingFiles(DependencyGraph graph, ImpactReport report, TypeNode type,
                                                 FileNode declaringFile, String oldNamespace, String newNamespace) {
        Set<FileNode> referencing = new LinkedHashSet<>();
        for (FileNode file : graph.filesReferencingType(type.getId())) {
            if (file.getId().equals(declaringFile.getId())) {
                continue;
            }
            referencing.add(file);
            if (!namespaceChanges(oldNamespace, newNamespace)) {
                continue;
            }

            Optional<GraphEdge> existingImport = graph.namespaceUsage(file.getId(), oldNamespace);
            RequiredChange change;
            if (existingImport.isPresent()) {
                change = RequiredChange.builder()
                        .type(RequiredChangeType.UPDATE_USING_DIRECTIVE)
                        .lineNumber(existingImport.get().getLineNumber())
                        .currentValue(oldNamespace)
                        .newValue(newNamespace)
                        .description("Update using directive for " + type.getSimpleName())
                        .build();
            } else if (newNamespace.equals(file.getNamespace())) {
                // Same namespace as the new home, no import needed
                continue;
            } else {
                change = RequiredChange.builder()
                        .type(RequiredChangeType.ADD_USING_DIRECTIVE)
                        .newValue(newNamespace)
                        .description("Add using directive for " + type.getSimpleName())
                        .build();
            }

            report.getAffectedFiles().add(affectedFile(graph, file, AffectedFileReason.CONTAINS_USING_DIRECTIVE,
                    new ArrayList<>(List.of(change))));
            report.getAffectedTypes().add(affectedType(type.getFullName(), file.getPath(), AffectedTypeReason.REFERENCES_MOVED_TYPE));
        }
        return referencing;
    }

    /**
     * Types in other files extending or implementing a moved type. Informational only.
     */
    private void recordDerivedTypes(DependencyGraph graph, ImpactReport report, TypeNode type, FileNode declaringFile) {
        for (GraphEdge edge : graph.incomingEdges(type.getId())) {
            AffectedTypeReason reason;
            if (edge.getKind() == EdgeKind.TYPE_INHERITS) {
                reason = AffectedTypeReason.INHERITS_FROM_MOVED_TYPE;
            } else if (edge.getKind() == EdgeKind.TYPE_IMPLEMENTS) {
                reason = AffectedTypeReason.IMPLEMENTS_MOVED_INTERFACE;
            } else {
                continue;
            }
            graph.getType(edge.getSourceId()).ifPresent(derived -> owningFile(graph, derived)
                    .filter(file -> !file.getId().equals(declaringFile.getId()))
                    .ifPresent(file -> report.getAffectedTypes().add(affectedType(derived.getFullName(), file.getPath(), reason))));
        }
    }

    private void checkPartialParts(DependencyGraph graph, ImpactReport report, List<TypeNode> movedTypes, String sourcePath) {
        for (TypeNode type : movedTypes) {
            if (!type.isPartial()) {
                continue;
            }
            long otherParts = graph.getTypes().stream()
                    .filter(t -> t.getFullName().equals(type.getFullName()) && !t.getId().equals(type.getId()))
                    .count();
            if (otherParts > 0) {
                report.addWarning(WarningCode.PARTIAL_CLASS,
                        "Type " + type.getSimpleName() + " is a partial class with " + otherParts
                                + " other part(s). Consider moving all parts together.",
                        sourcePath);
            }
        }
    }

    /**
     * When the destination belongs to another project, every project still referencing the
     * moved types needs a reference to that project.
     */
    private void checkCrossProjectReferences(DependencyGraph graph, ImpactReport report, FileNode source,
                                             String targetPath, Collection<FileNode> referencingFiles) {
        Optional<ProjectNode> sourceProject = graph.projectContainingFile(source.getId());
        Optional<ProjectNode> targetProject = graph.findProjectOwningPath(targetPath);
        if (sourceProject.isEmpty() || targetProject.isEmpty()
                || sourceProject.get().getId().equals(targetProject.get().getId())) {
            return;
        }
        ProjectNode target = targetProject.get();
        log.debug("Move crosses project boundary: {} -> {}", sourceProject.get().getName(), target.getName());

        Map<String, ProjectNode> referencingProjects = new LinkedHashMap<>();
        for (FileNode file : referencingFiles) {
            graph.projectContainingFile(file.getId()).ifPresent(p -> referencingProjects.putIfAbsent(p.getId(), p));
        }

        for (ProjectNode project : referencingProjects.values()) {
            if (project.getId().equals(target.getId()) || graph.hasProjectReference(project.getId(), target.getId())) {
                continue;
            }
            report.getRequiredProjectReferences().add(RequiredProjectReference.builder()
                    .projectPath(project.getPath())
                    .referencePath(target.getPath())
                    .reason("Required for access to moved type(s)")
                    .build());
        }
    }

    // ========================= HELPERS =========================

    /**
     * Merge duplicate entries and score the report.
     */
    private ImpactReport finish(ImpactReport report) {
        Map<String, AffectedFile> byPath = new LinkedHashMap<>();
        for (AffectedFile file : report.getAffectedFiles()) {
            AffectedFile merged = byPath.get(file.getFilePath());
            if (merged == null) {
                byPath.put(file.getFilePath(), AffectedFile.builder()
                        .filePath(file.getFilePath())
                        .projectPath(file.getProjectPath())
                        .reason(file.getReason())
                        .requiredChanges(new ArrayList<>(file.getRequiredChanges()))
                        .build());
                continue;
            }
            for (RequiredChange change : file.getRequiredChanges()) {
                if (!merged.getRequiredChanges().contains(change)) {
                    merged.getRequiredChanges().add(change);
                }
            }
        }
        report.setAffectedFiles(new ArrayList<>(byPath.values()));

        Map<String, AffectedType> byTypeAndFile = new LinkedHashMap<>();
        for (AffectedType type : report.getAffectedTypes()) {
            byTypeAndFile.putIfAbsent(type.getTypeFullName() + "|" + type.getFilePath(), type);
        }
        report.setAffectedTypes(new ArrayList<>(byTypeAndFile.values()));

        report.setRequiredProjectReferences(report.getRequiredProjectReferences().stream()
                .distinct()
                .collect(Collectors.toCollection(ArrayList::new)));

        report.setComplexity(complexityScorer.score(report));
        log.info("Impact of '{}': {} file(s), {} type(s), {} error(s), {} warning(s), complexity {}",
                report.getOperation().getDescription(), report.getAffectedFileCount(), report.getAffectedTypeCount(),
                report.getErrors().size(), report.getWarnings().size(), report.getComplexity());
        return report;
    }

    private AffectedFile affectedFile(DependencyGraph graph, FileNode file, AffectedFileReason reason,
                                      List<RequiredChange> changes) {
        return AffectedFile.builder()
                .filePath(file.getPath())
                .projectPath(graph.projectContainingFile(file.getId()).map(ProjectNode::getPath).orElse(null))
                .reason(reason)
                .requiredChanges(new ArrayList<>(changes))
                .build();
    }

    private AffectedType affectedType(String typeFullName, String filePath, AffectedTypeReason reason) {
        return AffectedType.builder()
                .typeFullName(typeFullName)
                .filePath(filePath)
                .reason(reason)
                .build();
    }

    private RequiredChange moveFileChange(String from, String to) {
        return RequiredChange.builder()
                .type(RequiredChangeType.MOVE_FILE)
                .currentValue(from)
                .newValue(to)
                .description("Move file to " + to)
                .build();
    }

    private Optional<FileNode> owningFile(DependencyGraph graph, TypeNode type) {
        Optional<FileNode> viaEdge = graph.fileContainingType(type.getId());
        return viaEdge.isPresent() ? viaEdge : graph.getFile(type.getFileId());
    }

    private static boolean namespaceChanges(String oldNamespace, String newNamespace) {
        return oldNamespace != null && newNamespace != null && !oldNamespace.equals(newNamespace);
    }
}

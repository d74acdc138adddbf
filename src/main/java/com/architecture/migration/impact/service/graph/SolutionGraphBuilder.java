package com.architecture.migration.impact.service.graph;

import com.architecture.migration.impact.dto.extract.Accessibility;
import com.architecture.migration.impact.dto.extract.DeclaredType;
import com.architecture.migration.impact.dto.extract.ImportDirective;
import com.architecture.migration.impact.dto.extract.PackageDescriptor;
import com.architecture.migration.impact.dto.extract.ProjectDescriptor;
import com.architecture.migration.impact.dto.extract.SolutionDescriptor;
import com.architecture.migration.impact.dto.extract.SourceFileFacts;
import com.architecture.migration.impact.dto.graph.ProjectDependencyCycle;
import com.architecture.migration.impact.model.graph.DependencyGraph;
import com.architecture.migration.impact.model.graph.EdgeKind;
import com.architecture.migration.impact.model.graph.GraphEdge;
import com.architecture.migration.impact.model.graph.GraphIds;
import com.architecture.migration.impact.model.graph.GraphPaths;
import com.architecture.migration.impact.model.graph.nodes.FileNode;
import com.architecture.migration.impact.model.graph.nodes.ProjectNode;
import com.architecture.migration.impact.model.graph.nodes.SolutionNode;
import com.architecture.migration.impact.model.graph.nodes.TypeNode;
import com.architecture.migration.impact.service.extract.FactExtractionException;
import com.architecture.migration.impact.service.extract.SourceFactExtractor;
import com.architecture.migration.impact.service.extract.WorkspaceLoader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Builds a {@link DependencyGraph} from one or more workspaces.
 *
 * Build steps:
 *   1. Load every input through the {@link WorkspaceLoader} and register its solution
 *   2. Process projects on a bounded worker pool: project, reference, file and type nodes
 *   3. Resolve type usages reported by the {@link SourceFactExtractor} into TYPE_USAGE edges
 *
 * A project or file that cannot be read is skipped with a warning. Only a root input that
 * cannot be opened fails the build.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SolutionGraphBuilder {

    static final String ROOT_OBJECT_TYPE = "java.lang.Object";
    static final int USAGE_PROGRESS_INTERVAL = 100;

    private final WorkspaceLoader workspaceLoader;
    private final SourceFactExtractor factExtractor;
    private final ProjectCycleDetector cycleDetector;
    private final GraphBuildOptions defaultOptions;

    /**
     * Build a graph for a single input with the configured default options.
     */
    public DependencyGraph build(Path input) {
        return build(List.of(input), defaultOptions, null, BuildCancellationToken.none());
    }

    public DependencyGraph build(List<Path> inputs, GraphBuildOptions options) {
        return build(inputs, options, null, BuildCancellationToken.none());
    }

    /**
     * Build a graph for several inputs.
     *
     * @param listener     progress sink, may be null
     * @param cancellation polled between inputs, projects and files
     * @throws GraphBuildException          if an input cannot be opened
     * @throws GraphBuildCancelledException if cancellation was requested; carries the partial graph
     */
    public DependencyGraph build(List<Path> inputs, GraphBuildOptions options,
                                 GraphBuildProgressListener listener, BuildCancellationToken cancellation) {
        GraphBuildOptions effective = options == null ? defaultOptions : options;
        BuildCancellationToken token = cancellation == null ? BuildCancellationToken.none() : cancellation;
        ProgressReporter progress = new ProgressReporter(listener);
        DependencyGraph graph = new DependencyGraph();

        log.info("[graph-builder] Building graph for {} input(s)", inputs.size());

        // Step 1: Load solutions and index every project by manifest path
        List<ProjectTask> tasks = new ArrayList<>();
        Map<String, String> projectIdsByPath = new HashMap<>();
        for (int i = 0; i < inputs.size(); i++) {
            checkCancelled(token, graph);
            Path input = inputs.get(i);
            progress.report(GraphBuildPhase.LOADING_SOLUTION, input.toString(), percent(i, inputs.size()), i, inputs.size());

            SolutionDescriptor solution = loadRoot(input);
            String solutionId = GraphIds.solutionId(solution.getPath());
            graph.addSolution(SolutionNode.builder()
                    .id(solutionId)
                    .path(solution.getPath())
                    .name(solution.getName())
                    .virtual(solution.isVirtual())
                    .build());

            for (ProjectDescriptor project : solution.getProjects()) {
                projectIdsByPath.put(pathKey(project.getPath()), GraphIds.projectId(project.getPath()));
                tasks.add(new ProjectTask(solutionId, project));
            }
            log.info("[graph-builder] Loaded {} ({} project(s), virtual={})",
                    solution.getName(), solution.getProjects().size(), solution.isVirtual());
        }

        // Step 2: Process projects
        FileExclusionFilter filter = new FileExclusionFilter(effective);
        Map<String, List<String>> referencedTypeNames = new ConcurrentHashMap<>();
        processProjects(graph, tasks, projectIdsByPath, effective, filter, referencedTypeNames, progress, token);
        checkCancelled(token, graph);

        // Step 3: Type usages
        if (effective.isAnalyzeTypeUsages()) {
            analyzeTypeUsages(graph, referencedTypeNames, effective, progress, token);
        }

        progress.report(GraphBuildPhase.COMPLETED, "Graph built", 100, tasks.size(), tasks.size());
        log.info("[graph-builder] Graph built.\n{}", graph.statistics());

        for (ProjectDependencyCycle cycle : cycleDetector.detectCycles(graph)) {
            log.warn("[graph-builder] {}", cycle.getDescription());
        }
        return graph;
    }

    private SolutionDescriptor loadRoot(Path input) {
        try {
            return workspaceLoader.load(input);
        } catch (IOException | UncheckedIOException e) {
            throw new GraphBuildException("Cannot open input " + input + ": " + e.getMessage(), e);
        }
    }

    // ========================= PROJECT PHASE =========================

    private void processProjects(DependencyGraph graph, List<ProjectTask> tasks, Map<String, String> projectIdsByPath,
                                 GraphBuildOptions options, FileExclusionFilter filter,
                                 Map<String, List<String>> referencedTypeNames, ProgressReporter progress,
                                 BuildCancellationToken token) {
        int total = tasks.size();
        AtomicInteger processed = new AtomicInteger();
        progress.report(GraphBuildPhase.ANALYZING_PROJECTS, "Starting", 0, 0, total);

        Runnable[] work = tasks.stream()
                .map(task -> (Runnable) () -> {
                    if (token.isCancelled()) {
                        return;
                    }
                    try {
                        processProject(graph, task, projectIdsByPath, options, filter, referencedTypeNames, token);
                    } catch (RuntimeException e) {
                        log.warn("[graph-builder] Skipping project {}: {}", task.project().getPath(), e.getMessage(), e);
                    }
                    int done = processed.incrementAndGet();
                    progress.report(GraphBuildPhase.ANALYZING_PROJECTS, task.project().getName(),
                            percent(done, total), done, total);
                })
                .toArray(Runnable[]::new);

        if (options.getParallelism() <= 1 || total <= 1) {
            for (Runnable runnable : work) {
                runnable.run();
            }
            return;
        }

        ExecutorService executor = Executors.newFixedThreadPool(Math.min(options.getParallelism(), total));
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (Runnable runnable : work) {
                futures.add(executor.submit(runnable));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            token.cancel();
            throw new GraphBuildCancelledException(graph);
        } catch (ExecutionException e) {
            throw new GraphBuildException("Project processing failed: " + e.getCause().getMessage(), e.getCause());
        } finally {
            executor.shutdownNow();
        }
    }

    private void processProject(DependencyGraph graph, ProjectTask task, Map<String, String> projectIdsByPath,
                                GraphBuildOptions options, FileExclusionFilter filter,
                                Map<String, List<String>> referencedTypeNames, BuildCancellationToken token) {
        ProjectDescriptor project = task.project();
        String projectId = GraphIds.projectId(project.getPath());

        graph.addEdge(GraphEdge.of(EdgeKind.SOLUTION_CONTAINS_PROJECT, task.solutionId(), projectId));
        boolean added = graph.addProject(ProjectNode.builder()
                .id(projectId)
                .path(project.getPath())
                .name(project.getName())
                .rootNamespace(project.getRootNamespace())
                .targetFramework(project.getTargetFramework())
                .projectKind(project.getKind())
                .build());
        if (!added) {
            log.debug("[graph-builder] Project {} already processed", project.getPath());
            return;
        }

        for (String reference : project.getProjectReferences()) {
            String referencedId = projectIdsByPath.get(pathKey(reference));
            if (referencedId == null) {
                log.warn("[graph-builder] {}: cannot resolve project reference {}", project.getName(), reference);
                continue;
            }
            graph.addEdge(GraphEdge.of(EdgeKind.PROJECT_REFERENCE, projectId, referencedId));
        }

        for (PackageDescriptor pkg : project.getPackageReferences()) {
            String packageNodeId = graph.ensurePackage(pkg.getPackageId(), pkg.getVersion()).getId();
            graph.addEdge(GraphEdge.of(EdgeKind.PACKAGE_REFERENCE, projectId, packageNodeId));
        }

        try {
            int skipped = 0;
            for (String filePath : project.getFiles()) {
                if (token.isCancelled()) {
                    return;
                }
                if (filter.isExcluded(filePath)) {
                    skipped++;
                    continue;
                }
                processFile(graph, project, projectId, filePath, options, referencedTypeNames);
            }
            log.debug("[graph-builder] {}: {} file(s), {} excluded", project.getName(), project.getFiles().size(), skipped);
        } finally {
            factExtractor.release(project);
        }
    }

    private void processFile(DependencyGraph graph, ProjectDescriptor project, String projectId, String filePath,
                             GraphBuildOptions options, Map<String, List<String>> referencedTypeNames) {
        SourceFileFacts facts;
        try {
            facts = factExtractor.extract(project, filePath);
        } catch (FactExtractionException e) {
            log.warn("[graph-builder] Skipping file {}: {}", filePath, e.getMessage());
            return;
        }

        String fileId = GraphIds.fileId(filePath);
        boolean added = graph.addFile(FileNode.builder()
                .id(fileId)
                .path(filePath)
                .namespace(facts.getNamespace())
                .contentKind(facts.getContentKind())
                .build());
        if (!added) {
            log.debug("[graph-builder] File {} already processed", filePath);
            return;
        }
        graph.addEdge(GraphEdge.of(EdgeKind.PROJECT_CONTAINS_FILE, projectId, fileId));

        if (options.isAnalyzeUsingDirectives()) {
            for (ImportDirective directive : facts.getImports()) {
                if (isBlank(directive.getNamespace())) {
                    continue;
                }
                String namespaceId = graph.ensureNamespace(directive.getNamespace()).getId();
                graph.addEdge(GraphEdge.namespaceUsage(fileId, namespaceId, directive.getLine()));
            }
        }

        for (DeclaredType declared : facts.getTypes()) {
            if (declared.getAccessibility() == Accessibility.PRIVATE && !options.isIncludePrivateTypes()) {
                continue;
            }
            addType(graph, fileId, filePath, declared, referencedTypeNames);
        }
    }

    private void addType(DependencyGraph graph, String fileId, String filePath, DeclaredType declared,
                         Map<String, List<String>> referencedTypeNames) {
        String typeId = declared.isPartial()
                ? GraphIds.partialTypeId(declared.getFullName(), filePath)
                : GraphIds.typeId(declared.getFullName());
        String namespace = declared.getNamespace() == null ? "" : declared.getNamespace();

        boolean added = graph.addType(TypeNode.builder()
                .id(typeId)
                .fullName(declared.getFullName())
                .namespace(namespace)
                .simpleName(declared.getSimpleName())
                .typeKind(declared.getKind())
                .fileId(fileId)
                .publicType(declared.getAccessibility() == Accessibility.PUBLIC)
                .partial(declared.isPartial())
                .staticType(declared.isStaticType())
                .abstractType(declared.isAbstractType())
                .build());
        if (!added) {
            log.debug("[graph-builder] Type {} declared more than once, keeping first declaration", declared.getFullName());
            return;
        }

        graph.addEdge(GraphEdge.of(EdgeKind.FILE_CONTAINS_TYPE, fileId, typeId));
        if (!namespace.isEmpty()) {
            graph.addEdge(GraphEdge.of(EdgeKind.TYPE_IN_NAMESPACE, typeId, graph.ensureNamespace(namespace).getId()));
        }
        if (!isBlank(declared.getBaseType()) && !ROOT_OBJECT_TYPE.equals(declared.getBaseType())) {
            graph.addEdge(GraphEdge.of(EdgeKind.TYPE_INHERITS, typeId, GraphIds.typeId(declared.getBaseType())));
        }
        for (String iface : declared.getInterfaces()) {
            graph.addEdge(GraphEdge.of(EdgeKind.TYPE_IMPLEMENTS, typeId, GraphIds.typeId(iface)));
        }
        if (!declared.getReferencedTypes().isEmpty()) {
            referencedTypeNames.put(typeId, List.copyOf(declared.getReferencedTypes()));
        }
    }

    // ========================= USAGE PHASE =========================

    /**
     * Resolve referenced type names to type nodes and add one TYPE_USAGE edge per distinct
     * pair. A name that does not resolve is walked outward to its enclosing type, at most
     * {@code maxTypeUsageDepth} times.
     */
    private void analyzeTypeUsages(DependencyGraph graph, Map<String, List<String>> referencedTypeNames,
                                   GraphBuildOptions options, ProgressReporter progress, BuildCancellationToken token) {
        Map<String, String> typeIdsByName = new HashMap<>();
        graph.getTypes().stream()
                .sorted(Comparator.comparing(TypeNode::getId))
                .forEach(t -> typeIdsByName.putIfAbsent(t.getFullName(), t.getId()));

        Set<String> existing = graph.getEdges().stream()
                .filter(e -> e.getKind() == EdgeKind.TYPE_USAGE)
                .map(e -> e.getSourceId() + "|" + e.getTargetId())
                .collect(Collectors.toCollection(HashSet::new));

        List<String> sourceIds = graph.getTypes().stream()
                .map(TypeNode::getId)
                .sorted()
                .collect(Collectors.toList());
        int total = sourceIds.size();
        int processed = 0;
        int added = 0;

        progress.report(GraphBuildPhase.ANALYZING_USAGES, "Starting", 0, 0, total);
        for (String sourceId : sourceIds) {
            checkCancelled(token, graph);
            for (String name : referencedTypeNames.getOrDefault(sourceId, List.of())) {
                String targetId = resolveTypeName(name, typeIdsByName, options.getMaxTypeUsageDepth());
                if (targetId == null || targetId.equals(sourceId)) {
                    continue;
                }
                if (existing.add(sourceId + "|" + targetId)) {
                    graph.addEdge(GraphEdge.of(EdgeKind.TYPE_USAGE, sourceId, targetId));
                    added++;
                }
            }
            processed++;
            if (processed % USAGE_PROGRESS_INTERVAL == 0) {
                progress.report(GraphBuildPhase.ANALYZING_USAGES, sourceId, percent(processed, total), processed, total);
            }
        }
        log.info("[graph-builder] Resolved {} type usage edge(s) across {} type(s)", added, total);
    }

    static String resolveTypeName(String name, Map<String, String> typeIdsByName, int maxDepth) {
        if (isBlank(name)) {
            return null;
        }
        String candidate = name.replace('$', '.');
        for (int depth = 0; depth <= maxDepth; depth++) {
            String id = typeIdsByName.get(candidate);
            if (id != null) {
                return id;
            }
            int dot = candidate.lastIndexOf('.');
            if (dot <= 0) {
                return null;
            }
            candidate = candidate.substring(0, dot);
        }
        return null;
    }

    // ========================= HELPERS =========================

    private static void checkCancelled(BuildCancellationToken token, DependencyGraph graph) {
        if (token.isCancelled()) {
            log.info("[graph-builder] Build cancelled");
            throw new GraphBuildCancelledException(graph);
        }
    }

    private static int percent(int processed, int total) {
        return total == 0 ? 100 : (int) ((long) processed * 100 / total);
    }

    private static String pathKey(String path) {
        return GraphPaths.normalize(path).toLowerCase(Locale.ROOT);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private record ProjectTask(String solutionId, ProjectDescriptor project) {
    }

    /**
     * Forwards progress to the listener. A failing listener never breaks the build.
     */
    private static final class ProgressReporter {

        private final GraphBuildProgressListener listener;

        private ProgressReporter(GraphBuildProgressListener listener) {
            this.listener = listener;
        }

        void report(GraphBuildPhase phase, String item, int percent, int processed, int total) {
            GraphBuildProgress progress = GraphBuildProgress.builder()
                    .phase(phase)
                    .currentItem(item)
                    .progressPercent(percent)
                    .processedCount(processed)
                    .totalCount(total)
                    .build();
            log.debug("[graph-builder] {}", progress.getMessage());
            if (listener == null) {
                return;
            }
            try {
                listener.onProgress(progress);
            } catch (RuntimeException e) {
                log.warn("[graph-builder] Progress listener failed: {}", e.getMessage());
            }
        }
    }
}

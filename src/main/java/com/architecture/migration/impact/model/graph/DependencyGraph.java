package com.architecture.migration.impact.model.graph;

import com.architecture.migration.impact.model.graph.nodes.FileNode;
import com.architecture.migration.impact.model.graph.nodes.GraphNode;
import com.architecture.migration.impact.model.graph.nodes.NamespaceNode;
import com.architecture.migration.impact.model.graph.nodes.PackageNode;
import com.architecture.migration.impact.model.graph.nodes.ProjectNode;
import com.architecture.migration.impact.model.graph.nodes.SolutionNode;
import com.architecture.migration.impact.model.graph.nodes.TypeNode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * In-memory dependency graph of a set of codebases.
 *
 * Nodes live in one concurrent map per node kind; edges are appended to a concurrent queue
 * and indexed by source and target id on insert. Nodes and edges are immutable, so the
 * only race to guard against is two inserts of the same id, which {@code putIfAbsent}
 * resolves in favour of the first.
 */
public class DependencyGraph {

    private final Map<String, SolutionNode> solutions = new ConcurrentHashMap<>();
    private final Map<String, ProjectNode> projects = new ConcurrentHashMap<>();
    private final Map<String, FileNode> files = new ConcurrentHashMap<>();
    private final Map<String, TypeNode> types = new ConcurrentHashMap<>();
    private final Map<String, PackageNode> packages = new ConcurrentHashMap<>();
    private final Map<String, NamespaceNode> namespaces = new ConcurrentHashMap<>();

    private final Queue<GraphEdge> edges = new ConcurrentLinkedQueue<>();
    private final Map<String, Queue<GraphEdge>> outgoing = new ConcurrentHashMap<>();
    private final Map<String, Queue<GraphEdge>> incoming = new ConcurrentHashMap<>();

    // ========================= MUTATION =========================

    /**
     * Insert a node into the map of its kind. A node whose id is already present is ignored.
     *
     * @return true if the node was new
     */
    public boolean addNode(GraphNode node) {
        Objects.requireNonNull(node, "node");
        return switch (node.getKind()) {
            case SOLUTION -> addSolution((SolutionNode) node);
            case PROJECT -> addProject((ProjectNode) node);
            case FILE -> addFile((FileNode) node);
            case TYPE -> addType((TypeNode) node);
            case PACKAGE -> addPackage((PackageNode) node);
            case NAMESPACE -> addNamespace((NamespaceNode) node);
        };
    }

    public boolean addSolution(SolutionNode node) {
        return solutions.putIfAbsent(node.getId(), node) == null;
    }

    public boolean addProject(ProjectNode node) {
        return projects.putIfAbsent(node.getId(), node) == null;
    }

    public boolean addFile(FileNode node) {
        return files.putIfAbsent(node.getId(), node) == null;
    }

    public boolean addType(TypeNode node) {
        return types.putIfAbsent(node.getId(), node) == null;
    }

    public boolean addPackage(PackageNode node) {
        return packages.putIfAbsent(node.getId(), node) == null;
    }

    public boolean addNamespace(NamespaceNode node) {
        return namespaces.putIfAbsent(node.getId(), node) == null;
    }

    /**
     * Return the namespace node for {@code namespace}, creating it on first use.
     */
    public NamespaceNode ensureNamespace(String namespace) {
        String id = GraphIds.namespaceId(namespace);
        return namespaces.computeIfAbsent(id, key -> NamespaceNode.builder().id(key).name(namespace).build());
    }

    /**
     * Return the package node for {@code packageId}, creating it on first use.
     */
    public PackageNode ensurePackage(String packageId, String version) {
        String id = GraphIds.packageId(packageId);
        return packages.computeIfAbsent(id, key -> PackageNode.builder()
                .id(key)
                .packageId(packageId)
                .version(version)
                .build());
    }

    /**
     * Append an edge. Duplicates are kept.
     */
    public void addEdge(GraphEdge edge) {
        Objects.requireNonNull(edge, "edge");
        edges.add(edge);
        outgoing.computeIfAbsent(edge.getSourceId(), k -> new ConcurrentLinkedQueue<>()).add(edge);
        incoming.computeIfAbsent(edge.getTargetId(), k -> new ConcurrentLinkedQueue<>()).add(edge);
    }

    // ========================= LOOKUP =========================

    /**
     * Look a node up by id across all node kinds, in {@link NodeKind} order.
     */
    public Optional<GraphNode> getNode(String id) {
        if (id == null) {
            return Optional.empty();
        }
        GraphNode node = solutions.get(id);
        if (node == null) {
            node = projects.get(id);
        }
        if (node == null) {
            node = files.get(id);
        }
        if (node == null) {
            node = types.get(id);
        }
        if (node == null) {
            node = packages.get(id);
        }
        if (node == null) {
            node = namespaces.get(id);
        }
        return Optional.ofNullable(node);
    }

    public Optional<SolutionNode> getSolution(String id) {
        return Optional.ofNullable(id == null ? null : solutions.get(id));
    }

    public Optional<ProjectNode> getProject(String id) {
        return Optional.ofNullable(id == null ? null : projects.get(id));
    }

    public Optional<FileNode> getFile(String id) {
        return Optional.ofNullable(id == null ? null : files.get(id));
    }

    public Optional<TypeNode> getType(String id) {
        return Optional.ofNullable(id == null ? null : types.get(id));
    }

    public Optional<PackageNode> getPackage(String id) {
        return Optional.ofNullable(id == null ? null : packages.get(id));
    }

    public Optional<NamespaceNode> getNamespace(String id) {
        return Optional.ofNullable(id == null ? null : namespaces.get(id));
    }

    public Collection<SolutionNode> getSolutions() {
        return Collections.unmodifiableCollection(solutions.values());
    }

    public Collection<ProjectNode> getProjects() {
        return Collections.unmodifiableCollection(projects.values());
    }

    public Collection<FileNode> getFiles() {
        return Collections.unmodifiableCollection(files.values());
    }

    public Collection<TypeNode> getTypes() {
        return Collections.unmodifiableCollection(types.values());
    }

    public Collection<PackageNode> getPackages() {
        return Collections.unmodifiableCollection(packages.values());
    }

    public Collection<NamespaceNode> getNamespaces() {
        return Collections.unmodifiableCollection(namespaces.values());
    }

    /**
     * All nodes of one kind.
     */
    public List<GraphNode> nodes(NodeKind kind) {
        Collection<? extends GraphNode> source = switch (kind) {
            case SOLUTION -> solutions.values();
            case PROJECT -> projects.values();
            case FILE -> files.values();
            case TYPE -> types.values();
            case PACKAGE -> packages.values();
            case NAMESPACE -> namespaces.values();
        };
        return new ArrayList<>(source);
    }

    public List<GraphEdge> getEdges() {
        return new ArrayList<>(edges);
    }

    public List<GraphEdge> outgoingEdges(String nodeId) {
        Queue<GraphEdge> found = outgoing.get(nodeId);
        return found == null ? List.of() : new ArrayList<>(found);
    }

    public List<GraphEdge> incomingEdges(String nodeId) {
        Queue<GraphEdge> found = incoming.get(nodeId);
        return found == null ? List.of() : new ArrayList<>(found);
    }

    /**
     * Nodes reached by any outgoing edge. Dangling targets are left out.
     */
    public List<GraphNode> dependenciesOf(String nodeId) {
        return distinctNodes(outgoingEdges(nodeId).stream().map(GraphEdge::getTargetId).collect(Collectors.toList()));
    }

    /**
     * Nodes with any edge pointing at {@code nodeId}. Dangling sources are left out.
     */
    public List<GraphNode> dependentsOf(String nodeId) {
        return distinctNodes(incomingEdges(nodeId).stream().map(GraphEdge::getSourceId).collect(Collectors.toList()));
    }

    // ========================= TYPE QUERIES =========================

    /**
     * Types declared in {@code namespace}, ordered by full name.
     */
    public List<TypeNode> typesInNamespace(String namespace) {
        return types.values().stream()
                .filter(t -> Objects.equals(t.getNamespace(), namespace))
                .sorted(Comparator.comparing(TypeNode::getFullName))
                .collect(Collectors.toList());
    }

    /**
     * Types that use, extend or implement the given type.
     */
    public List<TypeNode> typesReferencing(String typeId) {
        Map<String, TypeNode> result = new LinkedHashMap<>();
        for (GraphEdge edge : incomingEdges(typeId)) {
            if (edge.getKind().isTypeReference()) {
                getType(edge.getSourceId()).ifPresent(t -> result.putIfAbsent(t.getId(), t));
            }
        }
        return new ArrayList<>(result.values());
    }

    /**
     * Types the given type uses, extends or implements.
     */
    public List<TypeNode> typesReferencedBy(String typeId) {
        Map<String, TypeNode> result = new LinkedHashMap<>();
        for (GraphEdge edge : outgoingEdges(typeId)) {
            if (edge.getKind().isTypeReference()) {
                getType(edge.getTargetId()).ifPresent(t -> result.putIfAbsent(t.getId(), t));
            }
        }
        return new ArrayList<>(result.values());
    }

    /**
     * Types declared in a file, in the order they were added.
     */
    public List<TypeNode> typesInFile(String fileId) {
        return outgoingEdges(fileId).stream()
                .filter(e -> e.getKind() == EdgeKind.FILE_CONTAINS_TYPE)
                .map(e -> getType(e.getTargetId()))
                .flatMap(Optional::stream)
                .distinct()
                .collect(Collectors.toList());
    }

    public Optional<TypeNode> findType(String fullName) {
        if (fullName == null) {
            return Optional.empty();
        }
        TypeNode direct = types.get(GraphIds.typeId(fullName));
        if (direct != null) {
            return Optional.of(direct);
        }
        return types.values().stream().filter(t -> t.getFullName().equals(fullName)).findFirst();
    }

    // ========================= FILE QUERIES =========================

    /**
     * Distinct files owning a type that references {@code typeId}, in first-seen order.
     */
    public List<FileNode> filesReferencingType(String typeId) {
        Map<String, FileNode> result = new LinkedHashMap<>();
        for (TypeNode referencing : typesReferencing(typeId)) {
            fileContainingType(referencing.getId()).ifPresent(f -> result.putIfAbsent(f.getId(), f));
        }
        return new ArrayList<>(result.values());
    }

    /**
     * Files importing {@code namespace}.
     */
    public List<FileNode> filesUsingNamespace(String namespace) {
        Map<String, FileNode> result = new LinkedHashMap<>();
        for (GraphEdge edge : incomingEdges(GraphIds.namespaceId(namespace))) {
            if (edge.getKind() == EdgeKind.FILE_USES_NAMESPACE) {
                getFile(edge.getSourceId()).ifPresent(f -> result.putIfAbsent(f.getId(), f));
            }
        }
        return new ArrayList<>(result.values());
    }

    /**
     * The import edge from a file to a namespace, if the file imports it.
     */
    public Optional<GraphEdge> namespaceUsage(String fileId, String namespace) {
        String namespaceId = GraphIds.namespaceId(namespace);
        return outgoingEdges(fileId).stream()
                .filter(e -> e.getKind() == EdgeKind.FILE_USES_NAMESPACE && e.getTargetId().equals(namespaceId))
                .findFirst();
    }

    public Optional<FileNode> fileContainingType(String typeId) {
        return incomingEdges(typeId).stream()
                .filter(e -> e.getKind() == EdgeKind.FILE_CONTAINS_TYPE)
                .map(e -> getFile(e.getSourceId()))
                .flatMap(Optional::stream)
                .findFirst();
    }

    public Optional<FileNode> findFileByPath(String path) {
        if (path == null) {
            return Optional.empty();
        }
        FileNode direct = files.get(GraphIds.fileId(path));
        if (direct != null) {
            return Optional.of(direct);
        }
        return files.values().stream().filter(f -> GraphPaths.samePath(f.getPath(), path)).findFirst();
    }

    /**
     * Files located below {@code folder}, ordered by path.
     */
    public List<FileNode> filesUnderFolder(String folder) {
        return files.values().stream()
                .filter(f -> GraphPaths.isUnder(f.getPath(), folder))
                .sorted(Comparator.comparing(FileNode::getPath))
                .collect(Collectors.toList());
    }

    // ========================= PROJECT QUERIES =========================

    public Optional<ProjectNode> projectContainingFile(String fileId) {
        return incomingEdges(fileId).stream()
                .filter(e -> e.getKind() == EdgeKind.PROJECT_CONTAINS_FILE)
                .map(e -> getProject(e.getSourceId()))
                .flatMap(Optional::stream)
                .findFirst();
    }

    /**
     * Projects referenced by the given project.
     */
    public List<ProjectNode> projectDependencies(String projectId) {
        return projectNeighbours(outgoingEdges(projectId), GraphEdge::getTargetId);
    }

    /**
     * Projects that reference the given project.
     */
    public List<ProjectNode> projectsDependingOn(String projectId) {
        return projectNeighbours(incomingEdges(projectId), GraphEdge::getSourceId);
    }

    public boolean hasProjectReference(String fromProjectId, String toProjectId) {
        return outgoingEdges(fromProjectId).stream()
                .anyMatch(e -> e.getKind() == EdgeKind.PROJECT_REFERENCE && e.getTargetId().equals(toProjectId));
    }

    /**
     * The project whose directory is the longest prefix of {@code path}.
     */
    public Optional<ProjectNode> findProjectOwningPath(String path) {
        return projects.values().stream()
                .filter(p -> GraphPaths.isUnder(path, p.getDirectory()))
                .max(Comparator.comparingInt(p -> GraphPaths.normalize(p.getDirectory()).length()));
    }

    /**
     * Whether a project-reference cycle is reachable from {@code projectId}.
     */
    public boolean hasCyclicDependency(String projectId) {
        return hasCycle(projectId, new HashSet<>(), new HashSet<>());
    }

    private boolean hasCycle(String projectId, Set<String> visited, Set<String> onStack) {
        if (onStack.contains(projectId)) {
            return true;
        }
        if (!visited.add(projectId)) {
            return false;
        }
        onStack.add(projectId);
        for (GraphEdge edge : outgoingEdges(projectId)) {
            if (edge.getKind() == EdgeKind.PROJECT_REFERENCE && hasCycle(edge.getTargetId(), visited, onStack)) {
                return true;
            }
        }
        onStack.remove(projectId);
        return false;
    }

    // ========================= STATISTICS =========================

    public GraphStatistics statistics() {
        GraphStatistics.GraphStatisticsBuilder builder = GraphStatistics.builder()
                .nodeCount(NodeKind.SOLUTION, solutions.size())
                .nodeCount(NodeKind.PROJECT, projects.size())
                .nodeCount(NodeKind.FILE, files.size())
                .nodeCount(NodeKind.TYPE, types.size())
                .nodeCount(NodeKind.PACKAGE, packages.size())
                .nodeCount(NodeKind.NAMESPACE, namespaces.size());

        Map<EdgeKind, Integer> byKind = new EnumMap<>(EdgeKind.class);
        for (GraphEdge edge : edges) {
            byKind.merge(edge.getKind(), 1, Integer::sum);
        }
        for (EdgeKind kind : EdgeKind.values()) {
            builder.edgeCount(kind, byKind.getOrDefault(kind, 0));
        }
        return builder.build();
    }

    // ========================= HELPERS =========================

    private List<ProjectNode> projectNeighbours(List<GraphEdge> candidates, Function<GraphEdge, String> endpoint) {
        Map<String, ProjectNode> result = new LinkedHashMap<>();
        candidates.stream()
                .filter(e -> e.getKind() == EdgeKind.PROJECT_REFERENCE)
                .map(endpoint)
                .map(this::getProject)
                .flatMap(Optional::stream)
                .forEach(p -> result.putIfAbsent(p.getId(), p));
        return new ArrayList<>(result.values());
    }

    private List<GraphNode> distinctNodes(List<String> ids) {
        Map<String, GraphNode> result = new LinkedHashMap<>();
        for (String id : ids) {
            getNode(id).ifPresent(n -> result.putIfAbsent(n.getId(), n));
        }
        return new ArrayList<>(result.values());
    }
}

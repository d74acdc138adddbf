package com.architecture.migration.impact.service.graph;

import com.architecture.migration.impact.dto.graph.ProjectDependencyCycle;
import com.architecture.migration.impact.model.graph.DependencyGraph;
import com.architecture.migration.impact.model.graph.EdgeKind;
import com.architecture.migration.impact.model.graph.GraphEdge;
import com.architecture.migration.impact.model.graph.nodes.ProjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Finds cycles in the project reference graph using DFS.
 * A cycle is reported once, whichever project the search entered it from. Projects already
 * explored are not re-entered, so overlapping cycles may be reported as one.
 */
@Service
@Slf4j
public class ProjectCycleDetector {

    /**
     * Detect project reference cycles, in a deterministic order.
     */
    public List<ProjectDependencyCycle> detectCycles(DependencyGraph graph) {
        Map<String, Set<String>> adjacency = new TreeMap<>();
        for (ProjectNode project : graph.getProjects()) {
            Set<String> targets = graph.outgoingEdges(project.getId()).stream()
                    .filter(e -> e.getKind() == EdgeKind.PROJECT_REFERENCE)
                    .map(GraphEdge::getTargetId)
                    .collect(Collectors.toCollection(TreeSet::new));
            adjacency.put(project.getId(), targets);
        }

        List<List<String>> cycles = findCyclesDFS(adjacency);
        log.debug("Found {} project reference cycle(s)", cycles.size());

        return cycles.stream()
                .map(cycle -> {
                    List<String> names = cycle.stream()
                            .map(id -> graph.getProject(id).map(ProjectNode::getName).orElse(id))
                            .collect(Collectors.toList());
                    return ProjectDependencyCycle.builder()
                            .projectIds(cycle)
                            .projectNames(names)
                            .description("Circular project reference: " + String.join(" -> ", names))
                            .build();
                })
                .collect(Collectors.toList());
    }

    // ========================= DFS CYCLE DETECTION =========================

    /**
     * Each cycle is returned with its first element repeated at the end.
     */
    private List<List<String>> findCyclesDFS(Map<String, Set<String>> adjacency) {
        List<List<String>> cycles = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        Set<String> reported = new HashSet<>();

        for (String node : adjacency.keySet()) {
            if (!visited.contains(node)) {
                dfs(node, adjacency, visited, new ArrayList<>(), cycles, reported);
            }
        }
        return cycles;
    }

    private void dfs(String node, Map<String, Set<String>> adjacency, Set<String> visited,
                     List<String> path, List<List<String>> cycles, Set<String> reported) {
        visited.add(node);
        path.add(node);

        for (String neighbor : adjacency.getOrDefault(node, Collections.emptySet())) {
            if (!adjacency.containsKey(neighbor)) continue; // dangling reference

            int onPath = path.indexOf(neighbor);
            if (onPath >= 0) {
                List<String> cycle = new ArrayList<>(path.subList(onPath, path.size()));
                cycle.add(neighbor);
                if (reported.add(normalizeCycleKey(cycle))) {
                    cycles.add(cycle);
                }
            } else if (!visited.contains(neighbor)) {
                dfs(neighbor, adjacency, visited, path, cycles, reported);
            }
        }

        path.remove(path.size() - 1);
    }

    /**
     * Rotate the cycle so its smallest element comes first.
     */
    private String normalizeCycleKey(List<String> cycle) {
        List<String> core = cycle.subList(0, cycle.size() - 1);
        int minIdx = core.indexOf(Collections.min(core));
        List<String> normalized = new ArrayList<>();
        for (int i = 0; i < core.size(); i++) {
            normalized.add(core.get((minIdx + i) % core.size()));
        }
        return normalized.toString();
    }
}

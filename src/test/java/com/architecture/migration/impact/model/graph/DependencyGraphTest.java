package com.architecture.migration.impact.model.graph;

import com.architecture.migration.impact.model.graph.nodes.FileNode;
import com.architecture.migration.impact.model.graph.nodes.GraphNode;
import com.architecture.migration.impact.model.graph.nodes.NamespaceNode;
import com.architecture.migration.impact.model.graph.nodes.ProjectNode;
import com.architecture.migration.impact.model.graph.nodes.TypeNode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DependencyGraphTest {

    private static final String CORE = "/repo/core/pom.xml";
    private static final String APP = "/repo/app/pom.xml";

    private static final String MODEL_FILE = "/repo/core/src/main/java/com/acme/core/model/Customer.java";
    private static final String REPO_FILE = "/repo/core/src/main/java/com/acme/core/data/CustomerRepository.java";
    private static final String SERVICE_FILE = "/repo/app/src/main/java/com/acme/app/CustomerService.java";

    private DependencyGraph sampleGraph() {
        return GraphFixtures.graph()
                .project(CORE, "core")
                .project(APP, "app")
                .projectReference(APP, CORE)
                .file(CORE, MODEL_FILE, "com.acme.core.model")
                .file(CORE, REPO_FILE, "com.acme.core.data")
                .file(APP, SERVICE_FILE, "com.acme.app")
                .type(MODEL_FILE, "com.acme.core.model.Customer")
                .type(REPO_FILE, "com.acme.core.data.CustomerRepository")
                .type(SERVICE_FILE, "com.acme.app.CustomerService")
                .uses("com.acme.core.data.CustomerRepository", "com.acme.core.model.Customer")
                .uses("com.acme.app.CustomerService", "com.acme.core.model.Customer")
                .uses("com.acme.app.CustomerService", "com.acme.core.data.CustomerRepository")
                .imports(REPO_FILE, "com.acme.core.model", 3)
                .imports(SERVICE_FILE, "com.acme.core.model", 3)
                .imports(SERVICE_FILE, "com.acme.core.data", 4)
                .build();
    }

    @Test
    void addNode_ignoresSecondNodeWithSameId() {
        DependencyGraph graph = new DependencyGraph();
        FileNode first = FileNode.builder().id("file:/a/A.java").path("/a/A.java").namespace("a").build();
        FileNode second = FileNode.builder().id("file:/a/A.java").path("/a/A.java").namespace("b").build();

        assertThat(graph.addNode(first)).isTrue();
        assertThat(graph.addNode(second)).isFalse();

        assertThat(graph.getFiles()).hasSize(1);
        assertThat(graph.getFile("file:/a/A.java").map(FileNode::getNamespace)).contains("a");
    }

    @Test
    void getNode_findsNodesOfEveryKind() {
        DependencyGraph graph = sampleGraph();

        assertThat(graph.getNode(GraphIds.projectId(CORE))).containsInstanceOf(ProjectNode.class);
        assertThat(graph.getNode(GraphIds.fileId(MODEL_FILE))).containsInstanceOf(FileNode.class);
        assertThat(graph.getNode(GraphIds.typeId("com.acme.core.model.Customer"))).containsInstanceOf(TypeNode.class);
        assertThat(graph.getNode(GraphIds.namespaceId("com.acme.core.model"))).containsInstanceOf(NamespaceNode.class);
        assertThat(graph.getNode("type:does.not.Exist")).isEmpty();
        assertThat(graph.getNode(null)).isEmpty();
    }

    @Test
    void ensureNamespace_returnsSameNodeOnRepeatedCalls() {
        DependencyGraph graph = new DependencyGraph();

        NamespaceNode first = graph.ensureNamespace("com.acme");
        NamespaceNode second = graph.ensureNamespace("com.acme");

        assertThat(second).isSameAs(first);
        assertThat(graph.getNamespaces()).hasSize(1);
    }

    @Test
    void edgeIndexes_matchEdgeList() {
        DependencyGraph graph = sampleGraph();

        for (GraphEdge edge : graph.getEdges()) {
            assertThat(graph.outgoingEdges(edge.getSourceId())).contains(edge);
            assertThat(graph.incomingEdges(edge.getTargetId())).contains(edge);
        }
        assertThat(graph.outgoingEdges("file:/nowhere")).isEmpty();
    }

    @Test
    void nodes_listsEveryNodeOfAKind() {
        DependencyGraph graph = sampleGraph();

        assertThat(graph.nodes(NodeKind.PROJECT)).extracting(GraphNode::getDisplayName)
                .containsExactlyInAnyOrder("core", "app");
        assertThat(graph.nodes(NodeKind.SOLUTION)).isEmpty();
    }

    @Test
    void dependenciesAndDependents_followAnyEdgeKindAndSkipDanglingIds() {
        DependencyGraph graph = sampleGraph();
        graph.addEdge(GraphEdge.of(EdgeKind.TYPE_IMPLEMENTS,
                GraphIds.typeId("com.acme.core.model.Customer"), GraphIds.typeId("java.io.Serializable")));

        assertThat(graph.dependenciesOf(GraphIds.typeId("com.acme.core.model.Customer")))
                .extracting(GraphNode::getId)
                .containsExactly(GraphIds.namespaceId("com.acme.core.model"));
        assertThat(graph.dependentsOf(GraphIds.fileId(MODEL_FILE)))
                .extracting(GraphNode::getId)
                .containsExactly(GraphIds.projectId(CORE));
    }

    @Test
    void typesReferencing_returnsDistinctUsers() {
        DependencyGraph graph = sampleGraph();

        assertThat(graph.typesReferencing(GraphIds.typeId("com.acme.core.model.Customer")))
                .extracting(TypeNode::getFullName)
                .containsExactlyInAnyOrder("com.acme.core.data.CustomerRepository", "com.acme.app.CustomerService");
        assertThat(graph.typesReferencedBy(GraphIds.typeId("com.acme.app.CustomerService")))
                .extracting(TypeNode::getFullName)
                .containsExactlyInAnyOrder("com.acme.core.model.Customer", "com.acme.core.data.CustomerRepository");
    }

    @Test
    void filesReferencingType_mapsReferencingTypesToTheirFiles() {
        DependencyGraph graph = sampleGraph();

        assertThat(graph.filesReferencingType(GraphIds.typeId("com.acme.core.model.Customer")))
                .extracting(FileNode::getPath)
                .containsExactlyInAnyOrder(REPO_FILE, SERVICE_FILE);
    }

    @Test
    void typesInNamespace_isOrderedByFullName() {
        DependencyGraph graph = GraphFixtures.graph()
                .file(null, "/x/B.java", "com.acme")
                .file(null, "/x/A.java", "com.acme")
                .type("/x/B.java", "com.acme.Beta")
                .type("/x/A.java", "com.acme.Alpha")
                .build();

        assertThat(graph.typesInNamespace("com.acme"))
                .extracting(TypeNode::getSimpleName)
                .containsExactly("Alpha", "Beta");
        assertThat(graph.typesInNamespace("com.other")).isEmpty();
    }

    @Test
    void namespaceUsage_carriesImportLine() {
        DependencyGraph graph = sampleGraph();

        assertThat(graph.namespaceUsage(GraphIds.fileId(SERVICE_FILE), "com.acme.core.data")
                .map(GraphEdge::getLineNumber)).contains(4);
        assertThat(graph.namespaceUsage(GraphIds.fileId(MODEL_FILE), "com.acme.core.data")).isEmpty();
        assertThat(graph.filesUsingNamespace("com.acme.core.model"))
                .extracting(FileNode::getPath)
                .containsExactlyInAnyOrder(REPO_FILE, SERVICE_FILE);
    }

    @Test
    void findFileByPath_ignoresCaseAndSeparators() {
        DependencyGraph graph = sampleGraph();

        assertThat(graph.findFileByPath(MODEL_FILE.toUpperCase())).isPresent();
        assertThat(graph.findFileByPath(MODEL_FILE.replace('/', '\\'))).isPresent();
        assertThat(graph.findFileByPath("/repo/core/Missing.java")).isEmpty();
    }

    @Test
    void filesUnderFolder_requiresSeparatorBoundary() {
        DependencyGraph graph = GraphFixtures.graph()
                .file(null, "/src/app/A.java", "app")
                .file(null, "/src/app/sub/B.java", "app.sub")
                .file(null, "/src/application/C.java", "application")
                .build();

        assertThat(graph.filesUnderFolder("/src/app"))
                .extracting(FileNode::getPath)
                .containsExactly("/src/app/A.java", "/src/app/sub/B.java");
        assertThat(graph.filesUnderFolder("/src/app/")).hasSize(2);
    }

    @Test
    void projectQueries_followProjectReferences() {
        DependencyGraph graph = sampleGraph();
        String core = GraphIds.projectId(CORE);
        String app = GraphIds.projectId(APP);

        assertThat(graph.projectContainingFile(GraphIds.fileId(SERVICE_FILE)).map(ProjectNode::getName))
                .contains("app");
        assertThat(graph.projectDependencies(app)).extracting(ProjectNode::getName).containsExactly("core");
        assertThat(graph.projectsDependingOn(core)).extracting(ProjectNode::getName).containsExactly("app");
        assertThat(graph.hasProjectReference(app, core)).isTrue();
        assertThat(graph.hasProjectReference(core, app)).isFalse();
    }

    @Test
    void findProjectOwningPath_prefersDeepestProjectDirectory() {
        DependencyGraph graph = GraphFixtures.graph()
                .project("/repo/pom.xml", "parent")
                .project("/repo/core/pom.xml", "core")
                .build();

        assertThat(graph.findProjectOwningPath("/repo/core/src/main/java/X.java").map(ProjectNode::getName))
                .contains("core");
        assertThat(graph.findProjectOwningPath("/repo/docs/readme.md").map(ProjectNode::getName))
                .contains("parent");
        assertThat(graph.findProjectOwningPath("/elsewhere/Y.java")).isEmpty();
    }

    @Test
    void hasCyclicDependency_detectsReachableCycle() {
        DependencyGraph graph = GraphFixtures.graph()
                .project("/a/pom.xml", "a")
                .project("/b/pom.xml", "b")
                .project("/c/pom.xml", "c")
                .projectReference("/a/pom.xml", "/b/pom.xml")
                .projectReference("/b/pom.xml", "/c/pom.xml")
                .build();

        assertThat(graph.hasCyclicDependency(GraphIds.projectId("/a/pom.xml"))).isFalse();

        graph.addEdge(GraphEdge.of(EdgeKind.PROJECT_REFERENCE,
                GraphIds.projectId("/c/pom.xml"), GraphIds.projectId("/b/pom.xml")));

        assertThat(graph.hasCyclicDependency(GraphIds.projectId("/a/pom.xml"))).isTrue();
    }

    @Test
    void statistics_countsNodesAndEdgesByKind() {
        DependencyGraph graph = sampleGraph();

        GraphStatistics stats = graph.statistics();

        assertThat(stats.nodeCount(NodeKind.PROJECT)).isEqualTo(2);
        assertThat(stats.nodeCount(NodeKind.FILE)).isEqualTo(3);
        assertThat(stats.nodeCount(NodeKind.TYPE)).isEqualTo(3);
        assertThat(stats.edgeCount(EdgeKind.TYPE_USAGE)).isEqualTo(3);
        assertThat(stats.edgeCount(EdgeKind.FILE_USES_NAMESPACE)).isEqualTo(3);
        assertThat(stats.getTotalEdges()).isEqualTo(graph.getEdges().size());
        assertThat(stats.toString()).contains("Projects:   2");
    }
}

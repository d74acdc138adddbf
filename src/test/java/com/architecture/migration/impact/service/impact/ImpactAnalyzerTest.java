package com.architecture.migration.impact.service.impact;

import com.architecture.migration.impact.dto.impact.AffectedFileReason;
import com.architecture.migration.impact.dto.impact.AffectedTypeReason;
import com.architecture.migration.impact.dto.impact.ErrorCode;
import com.architecture.migration.impact.dto.impact.ImpactReport;
import com.architecture.migration.impact.dto.impact.ImpactReport.AffectedFile;
import com.architecture.migration.impact.dto.impact.ImpactReport.AffectedType;
import com.architecture.migration.impact.dto.impact.ImpactReport.RequiredChange;
import com.architecture.migration.impact.dto.impact.MigrationComplexity;
import com.architecture.migration.impact.dto.impact.RequiredChangeType;
import com.architecture.migration.impact.dto.impact.WarningCode;
import com.architecture.migration.impact.dto.operation.DeleteOperation;
import com.architecture.migration.impact.dto.operation.MoveOperation;
import com.architecture.migration.impact.dto.operation.MoveTypeOperation;
import com.architecture.migration.impact.dto.operation.RenameNamespaceOperation;
import com.architecture.migration.impact.model.graph.DependencyGraph;
import com.architecture.migration.impact.model.graph.GraphFixtures;
import com.architecture.migration.impact.model.graph.GraphIds;
import com.architecture.migration.impact.model.graph.nodes.TypeNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class ImpactAnalyzerTest {

    private static final String MOVED = "/repo/src/old/Order.java";
    private static final String IMPORTER = "/repo/src/billing/Invoice.java";
    private static final String SAME_PACKAGE_USER = "/repo/src/shipping/Shipment.java";
    private static final String BYSTANDER = "/repo/src/misc/Clock.java";

    private ImpactAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new ImpactAnalyzer(new ComplexityScorer());
    }

    private DependencyGraph orderGraph() {
        return GraphFixtures.graph()
                .file(null, MOVED, "com.acme.old")
                .file(null, IMPORTER, "com.acme.billing")
                .file(null, SAME_PACKAGE_USER, "com.acme.shipping")
                .file(null, BYSTANDER, "com.acme.misc")
                .type(MOVED, "com.acme.old.Order")
                .type(IMPORTER, "com.acme.billing.Invoice")
                .type(SAME_PACKAGE_USER, "com.acme.shipping.Shipment")
                .type(BYSTANDER, "com.acme.misc.Clock")
                .uses("com.acme.billing.Invoice", "com.acme.old.Order")
                .uses("com.acme.shipping.Shipment", "com.acme.old.Order")
                .imports(IMPORTER, "com.acme.old", 5)
                .build();
    }

    private static AffectedFile fileEntry(ImpactReport report, String path) {
        return report.getAffectedFiles().stream()
                .filter(f -> f.getFilePath().equals(path))
                .findFirst()
                .orElseThrow(() -> new AssertionError("No affected file entry for " + path));
    }

    private static List<RequiredChangeType> changeTypes(AffectedFile file) {
        return file.getRequiredChanges().stream().map(RequiredChange::getType).collect(Collectors.toList());
    }

    // ========================= MOVE =========================

    @Nested
    class Move {

        @Test
        void namespaceChange_fansOutToEveryReferencingFile() {
            ImpactReport report = analyzer.analyze(orderGraph(), MoveOperation.builder()
                    .sourcePath(MOVED)
                    .targetPath("/repo/src/sales/Order.java")
                    .newNamespace("com.acme.sales")
                    .build());

            assertThat(report.canProceed()).isTrue();
            assertThat(report.getAffectedFiles()).extracting(AffectedFile::getFilePath)
                    .containsExactlyInAnyOrder(MOVED, IMPORTER, SAME_PACKAGE_USER);

            AffectedFile moved = fileEntry(report, MOVED);
            assertThat(moved.getReason()).isEqualTo(AffectedFileReason.DIRECTLY_MOVED);
            assertThat(changeTypes(moved)).containsExactly(RequiredChangeType.MOVE_FILE, RequiredChangeType.UPDATE_NAMESPACE);

            RequiredChange update = fileEntry(report, IMPORTER).getRequiredChanges().get(0);
            assertThat(update.getType()).isEqualTo(RequiredChangeType.UPDATE_USING_DIRECTIVE);
            assertThat(update.getLineNumber()).isEqualTo(5);
            assertThat(update.getCurrentValue()).isEqualTo("com.acme.old");
            assertThat(update.getNewValue()).isEqualTo("com.acme.sales");

            RequiredChange add = fileEntry(report, SAME_PACKAGE_USER).getRequiredChanges().get(0);
            assertThat(add.getType()).isEqualTo(RequiredChangeType.ADD_USING_DIRECTIVE);
            assertThat(add.getNewValue()).isEqualTo("com.acme.sales");

            assertThat(report.getAffectedTypes())
                    .extracting(AffectedType::getReason)
                    .containsExactlyInAnyOrder(AffectedTypeReason.DIRECTLY_MOVED,
                            AffectedTypeReason.REFERENCES_MOVED_TYPE, AffectedTypeReason.REFERENCES_MOVED_TYPE);
            assertThat(report.getComplexity()).isEqualTo(MigrationComplexity.MEDIUM);
        }

        @Test
        void sameNamespace_onlyMovesTheFile() {
            ImpactReport report = analyzer.analyze(orderGraph(), MoveOperation.builder()
                    .sourcePath(MOVED)
                    .targetPath("/repo/src/old/sub/Order.java")
                    .build());

            assertThat(report.getAffectedFiles()).hasSize(1);
            assertThat(changeTypes(fileEntry(report, MOVED))).containsExactly(RequiredChangeType.MOVE_FILE);
            assertThat(report.getComplexity()).isEqualTo(MigrationComplexity.SIMPLE);
        }

        @Test
        void referencingFileAlreadyInNewNamespace_needsNoImport() {
            ImpactReport report = analyzer.analyze(orderGraph(), MoveOperation.builder()
                    .sourcePath(MOVED)
                    .targetPath("/repo/src/shipping/Order.java")
                    .newNamespace("com.acme.shipping")
                    .build());

            assertThat(report.getAffectedFiles()).extracting(AffectedFile::getFilePath)
                    .containsExactlyInAnyOrder(MOVED, IMPORTER);
        }

        @Test
        void missingSource_isFileNotFound() {
            ImpactReport report = analyzer.analyze(orderGraph(), MoveOperation.builder()
                    .sourcePath("/repo/src/old/Missing.java")
                    .targetPath("/repo/src/new/Missing.java")
                    .build());

            assertThat(report.canProceed()).isFalse();
            assertThat(report.getErrors()).extracting(ImpactReport.MigrationError::getCode)
                    .containsExactly(ErrorCode.FILE_NOT_FOUND);
            assertThat(report.getAffectedFiles()).isEmpty();
            assertThat(report.getComplexity()).isEqualTo(MigrationComplexity.VERY_COMPLEX);
        }

        @Test
        void existingTarget_isErrorButAnalysisContinues() {
            ImpactReport report = analyzer.analyze(orderGraph(), MoveOperation.builder()
                    .sourcePath(MOVED)
                    .targetPath(BYSTANDER)
                    .newNamespace("com.acme.misc")
                    .build());

            assertThat(report.canProceed()).isFalse();
            assertThat(report.getErrors()).extracting(ImpactReport.MigrationError::getCode)
                    .containsExactly(ErrorCode.TARGET_EXISTS);
            assertThat(report.getAffectedFiles()).extracting(AffectedFile::getFilePath).contains(IMPORTER);
        }

        @Test
        void derivedTypesInOtherFiles_areInformational() {
            DependencyGraph graph = GraphFixtures.graph()
                    .file(null, "/src/base/Shape.java", "base")
                    .file(null, "/src/base/Drawable.java", "base")
                    .file(null, "/src/impl/Circle.java", "impl")
                    .type("/src/base/Shape.java", "base.Shape")
                    .type("/src/base/Drawable.java", "base.Drawable")
                    .type("/src/impl/Circle.java", "impl.Circle")
                    .inherits("impl.Circle", "base.Shape")
                    .build();

            ImpactReport report = analyzer.analyze(graph, MoveOperation.builder()
                    .sourcePath("/src/base/Shape.java")
                    .targetPath("/src/base/geometry/Shape.java")
                    .build());

            assertThat(report.getAffectedTypes())
                    .filteredOn(t -> t.getReason() == AffectedTypeReason.INHERITS_FROM_MOVED_TYPE)
                    .extracting(AffectedType::getTypeFullName)
                    .containsExactly("impl.Circle");
            assertThat(report.getAffectedFiles()).extracting(AffectedFile::getFilePath)
                    .containsExactly("/src/base/Shape.java");
        }

        @Test
        void partialSiblingPart_raisesWarning() {
            DependencyGraph graph = GraphFixtures.graph()
                    .file(null, "/src/ui/Form.java", "ui")
                    .file(null, "/src/ui/Form.Designer.java", "ui")
                    .partialType("/src/ui/Form.java", "ui.Form")
                    .partialType("/src/ui/Form.Designer.java", "ui.Form")
                    .build();

            ImpactReport report = analyzer.analyze(graph, MoveOperation.builder()
                    .sourcePath("/src/ui/Form.java")
                    .targetPath("/src/forms/Form.java")
                    .build());

            assertThat(report.canProceed()).isTrue();
            assertThat(report.getWarnings()).extracting(ImpactReport.MigrationWarning::getCode)
                    .containsExactly(WarningCode.PARTIAL_CLASS);
        }

        @Test
        void crossProjectMove_requiresReferencesFromProjectsLackingThem() {
            String core = "/repo/core/pom.xml";
            String shared = "/repo/shared/pom.xml";
            String app = "/repo/app/pom.xml";
            String web = "/repo/web/pom.xml";
            String customer = "/repo/core/src/main/java/com/acme/core/Customer.java";
            String appFile = "/repo/app/src/main/java/com/acme/app/Checkout.java";
            String webFile = "/repo/web/src/main/java/com/acme/web/CustomerPage.java";
            DependencyGraph graph = GraphFixtures.graph()
                    .project(core, "core")
                    .project(shared, "shared")
                    .project(app, "app")
                    .project(web, "web")
                    .projectReference(app, core)
                    .projectReference(web, core)
                    .projectReference(web, shared)
                    .file(core, customer, "com.acme.core")
                    .file(app, appFile, "com.acme.app")
                    .file(web, webFile, "com.acme.web")
                    .type(customer, "com.acme.core.Customer")
                    .type(appFile, "com.acme.app.Checkout")
                    .type(webFile, "com.acme.web.CustomerPage")
                    .uses("com.acme.app.Checkout", "com.acme.core.Customer")
                    .uses("com.acme.web.CustomerPage", "com.acme.core.Customer")
                    .imports(appFile, "com.acme.core", 3)
                    .imports(webFile, "com.acme.core", 3)
                    .build();

            ImpactReport report = analyzer.analyze(graph, MoveOperation.builder()
                    .sourcePath(customer)
                    .targetPath("/repo/shared/src/main/java/com/acme/shared/Customer.java")
                    .newNamespace("com.acme.shared")
                    .build());

            assertThat(report.getRequiredProjectReferences()).hasSize(1);
            assertThat(report.getRequiredProjectReferences().get(0).getProjectPath()).isEqualTo(app);
            assertThat(report.getRequiredProjectReferences().get(0).getReferencePath()).isEqualTo(shared);
            assertThat(report.getAffectedProjectCount()).isEqualTo(3);
            assertThat(fileEntry(report, appFile).getProjectPath()).isEqualTo(app);
        }

        @Test
        void typeUsedTwiceFromOneFile_yieldsSingleMergedEntry() {
            DependencyGraph graph = GraphFixtures.graph()
                    .file(null, "/src/old/Money.java", "old")
                    .file(null, "/src/app/Ledger.java", "app")
                    .type("/src/old/Money.java", "old.Money")
                    .type("/src/old/Money.java", "old.Currency")
                    .type("/src/app/Ledger.java", "app.Ledger")
                    .uses("app.Ledger", "old.Money")
                    .uses("app.Ledger", "old.Currency")
                    .uses("app.Ledger", "old.Money")
                    .imports("/src/app/Ledger.java", "old", 2)
                    .build();

            ImpactReport report = analyzer.analyze(graph, MoveOperation.builder()
                    .sourcePath("/src/old/Money.java")
                    .targetPath("/src/finance/Money.java")
                    .newNamespace("finance")
                    .build());

            assertThat(report.getAffectedFiles()).extracting(AffectedFile::getFilePath)
                    .containsExactly("/src/old/Money.java", "/src/app/Ledger.java");
            AffectedFile ledger = fileEntry(report, "/src/app/Ledger.java");
            assertThat(ledger.getRequiredChanges()).hasSize(2).doesNotHaveDuplicates();
            assertThat(report.getAffectedTypes()).doesNotHaveDuplicates();
        }
    }

    // ========================= FOLDER MOVE =========================

    @Nested
    class FolderMove {

        private DependencyGraph folderGraph(int fileCount) {
            GraphFixtures fixtures = GraphFixtures.graph();
            for (int i = 0; i < fileCount; i++) {
                fixtures.file(null, "/src/legacy/File" + i + ".java", "legacy");
            }
            fixtures.file(null, "/src/legacyextra/Other.java", "legacyextra");
            return fixtures.build();
        }

        @Test
        void everyFileUnderFolder_getsMoveChange() {
            ImpactReport report = analyzer.analyze(folderGraph(3), MoveOperation.builder()
                    .sourcePath("/src/legacy")
                    .targetPath("/src/modern")
                    .folder(true)
                    .build());

            assertThat(report.getAffectedFiles()).hasSize(3);
            assertThat(report.getAffectedFiles())
                    .flatExtracting(AffectedFile::getRequiredChanges)
                    .extracting(RequiredChange::getNewValue)
                    .containsExactly("/src/modern/File0.java", "/src/modern/File1.java", "/src/modern/File2.java");
            assertThat(report.getWarnings()).isEmpty();
        }

        @Test
        void moreThanTenFiles_warnsLargeFolderMove() {
            ImpactReport report = analyzer.analyze(folderGraph(11), MoveOperation.builder()
                    .sourcePath("/src/legacy")
                    .targetPath("/src/modern")
                    .folder(true)
                    .build());

            assertThat(report.getWarnings()).extracting(ImpactReport.MigrationWarning::getCode)
                    .containsExactly(WarningCode.LARGE_FOLDER_MOVE);
            assertThat(report.canProceed()).isTrue();
        }

        @Test
        void exactlyTenFiles_doesNotWarn() {
            ImpactReport report = analyzer.analyze(folderGraph(10), MoveOperation.builder()
                    .sourcePath("/src/legacy")
                    .targetPath("/src/modern")
                    .folder(true)
                    .build());

            assertThat(report.getWarnings()).isEmpty();
        }

        @Test
        void rebasedTargetAlreadyPresent_isTargetExists() {
            DependencyGraph graph = GraphFixtures.graph()
                    .file(null, "/src/legacy/A.java", "legacy")
                    .file(null, "/src/modern/A.java", "modern")
                    .build();

            ImpactReport report = analyzer.analyze(graph, MoveOperation.builder()
                    .sourcePath("/src/legacy")
                    .targetPath("/src/modern")
                    .folder(true)
                    .build());

            assertThat(report.getErrors()).extracting(ImpactReport.MigrationError::getFilePath)
                    .containsExactly("/src/modern/A.java");
        }

        @Test
        void repeatedAnalysis_neverDuplicatesPaths() {
            DependencyGraph graph = folderGraph(4);
            MoveOperation operation = MoveOperation.builder()
                    .sourcePath("/src/legacy")
                    .targetPath("/src/modern")
                    .folder(true)
                    .build();

            ImpactReport first = analyzer.analyze(graph, operation);
            ImpactReport second = analyzer.analyze(graph, operation);

            assertThat(first.getAffectedFiles()).extracting(AffectedFile::getFilePath).doesNotHaveDuplicates();
            assertThat(second.getAffectedFiles()).isEqualTo(first.getAffectedFiles());
        }
    }

    // ========================= RENAME NAMESPACE =========================

    @Nested
    class RenameNamespace {

        @Test
        void reportsDeclaringAndUsingFilesOnce() {
            DependencyGraph graph = GraphFixtures.graph()
                    .file(null, "/src/a/b/One.java", "A.B")
                    .file(null, "/src/a/b/Two.java", "A.B")
                    .file(null, "/src/c/UserOne.java", "C")
                    .file(null, "/src/d/UserTwo.java", "D")
                    .type("/src/a/b/One.java", "A.B.One")
                    .type("/src/a/b/One.java", "A.B.OneHelper")
                    .type("/src/a/b/Two.java", "A.B.Two")
                    .type("/src/c/UserOne.java", "C.UserOne")
                    .type("/src/d/UserTwo.java", "D.UserTwo")
                    .imports("/src/c/UserOne.java", "A.B", 3)
                    .imports("/src/d/UserTwo.java", "A.B", 7)
                    .imports("/src/a/b/Two.java", "A.B", 2)
                    .build();

            ImpactReport report = analyzer.analyze(graph, RenameNamespaceOperation.builder()
                    .oldNamespace("A.B")
                    .newNamespace("X.Y")
                    .build());

            assertThat(report.getAffectedFiles()).hasSize(4);
            assertThat(report.getAffectedFiles())
                    .filteredOn(f -> f.getReason() == AffectedFileReason.DECLARES_NAMESPACE)
                    .extracting(AffectedFile::getFilePath)
                    .containsExactlyInAnyOrder("/src/a/b/One.java", "/src/a/b/Two.java");
            assertThat(report.getAffectedFiles())
                    .filteredOn(f -> f.getReason() == AffectedFileReason.CONTAINS_USING_DIRECTIVE)
                    .extracting(AffectedFile::getFilePath)
                    .containsExactlyInAnyOrder("/src/c/UserOne.java", "/src/d/UserTwo.java");
            assertThat(fileEntry(report, "/src/d/UserTwo.java").getRequiredChanges().get(0).getLineNumber())
                    .isEqualTo(7);
            assertThat(report.getAffectedTypes()).hasSize(3)
                    .allMatch(t -> t.getReason() == AffectedTypeReason.NAMESPACE_CHANGED);
        }

        @Test
        void unknownNamespace_warnsButProceeds() {
            ImpactReport report = analyzer.analyze(orderGraph(), RenameNamespaceOperation.builder()
                    .oldNamespace("com.nothing")
                    .newNamespace("com.something")
                    .build());

            assertThat(report.canProceed()).isTrue();
            assertThat(report.getWarnings()).extracting(ImpactReport.MigrationWarning::getCode)
                    .containsExactly(WarningCode.NAMESPACE_EMPTY);
            assertThat(report.getAffectedFiles()).isEmpty();
        }
    }

    // ========================= DELETE =========================

    @Nested
    class Delete {

        @Test
        void referencedType_blocksDeleteWithoutForce() {
            ImpactReport report = analyzer.analyze(orderGraph(), DeleteOperation.builder()
                    .path(IMPORTER)
                    .build());

            assertThat(report.canProceed()).isTrue();

            ImpactReport blocked = analyzer.analyze(GraphFixtures.graph()
                    .file(null, "/src/Target.java", "app")
                    .file(null, "/src/User.java", "app")
                    .type("/src/Target.java", "app.Target")
                    .type("/src/User.java", "app.User")
                    .uses("app.User", "app.Target")
                    .build(), DeleteOperation.builder().path("/src/Target.java").build());

            assertThat(blocked.canProceed()).isFalse();
            assertThat(blocked.getErrors()).hasSize(1);
            assertThat(blocked.getErrors().get(0).getCode()).isEqualTo(ErrorCode.TYPE_IN_USE);
            assertThat(blocked.getErrors().get(0).getFilePath()).isEqualTo("/src/User.java");
        }

        @Test
        void force_turnsErrorIntoBrokenReferenceWarning() {
            DependencyGraph graph = GraphFixtures.graph()
                    .file(null, "/src/Target.java", "app")
                    .file(null, "/src/User.java", "app")
                    .type("/src/Target.java", "app.Target")
                    .type("/src/User.java", "app.User")
                    .uses("app.User", "app.Target")
                    .build();

            ImpactReport report = analyzer.analyze(graph, DeleteOperation.builder()
                    .path("/src/Target.java")
                    .force(true)
                    .build());

            assertThat(report.canProceed()).isTrue();
            assertThat(report.getErrors()).isEmpty();
            assertThat(report.getWarnings()).hasSize(1);
            assertThat(report.getWarnings().get(0).getCode()).isEqualTo(WarningCode.BROKEN_REFERENCE);
            assertThat(changeTypes(fileEntry(report, "/src/Target.java"))).containsExactly(RequiredChangeType.DELETE_FILE);
        }

        @Test
        void folderDelete_ignoresReferencesInsideDeletedFolder() {
            DependencyGraph graph = GraphFixtures.graph()
                    .file(null, "/src/old/A.java", "old")
                    .file(null, "/src/old/B.java", "old")
                    .file(null, "/src/app/C.java", "app")
                    .type("/src/old/A.java", "old.A")
                    .type("/src/old/B.java", "old.B")
                    .type("/src/app/C.java", "app.C")
                    .uses("old.B", "old.A")
                    .uses("app.C", "old.B")
                    .build();

            ImpactReport report = analyzer.analyze(graph, DeleteOperation.builder()
                    .path("/src/old")
                    .folder(true)
                    .build());

            assertThat(report.getAffectedFiles()).hasSize(2);
            assertThat(report.getErrors()).hasSize(1);
            assertThat(report.getErrors().get(0).getFilePath()).isEqualTo("/src/app/C.java");
        }

        @Test
        void missingFile_isFileNotFound() {
            ImpactReport report = analyzer.analyze(orderGraph(), DeleteOperation.builder()
                    .path("/repo/src/Nope.java")
                    .build());

            assertThat(report.getErrors()).extracting(ImpactReport.MigrationError::getCode)
                    .containsExactly(ErrorCode.FILE_NOT_FOUND);
        }
    }

    // ========================= MOVE TYPE =========================

    @Nested
    class MoveType {

        @Test
        void updatesNamespaceAndReferencingImports() {
            ImpactReport report = analyzer.analyze(orderGraph(), MoveTypeOperation.builder()
                    .typeFullName("com.acme.old.Order")
                    .newNamespace("com.acme.sales")
                    .build());

            assertThat(changeTypes(fileEntry(report, MOVED))).containsExactly(RequiredChangeType.UPDATE_NAMESPACE);
            assertThat(changeTypes(fileEntry(report, IMPORTER))).containsExactly(RequiredChangeType.UPDATE_USING_DIRECTIVE);
            assertThat(changeTypes(fileEntry(report, SAME_PACKAGE_USER))).containsExactly(RequiredChangeType.ADD_USING_DIRECTIVE);
        }

        @Test
        void newFilePath_addsMoveAndChecksTarget() {
            ImpactReport report = analyzer.analyze(orderGraph(), MoveTypeOperation.builder()
                    .typeFullName("com.acme.old.Order")
                    .newNamespace("com.acme.misc")
                    .newFilePath(BYSTANDER)
                    .build());

            assertThat(changeTypes(fileEntry(report, MOVED)))
                    .containsExactly(RequiredChangeType.UPDATE_NAMESPACE, RequiredChangeType.MOVE_FILE);
            assertThat(report.getErrors()).extracting(ImpactReport.MigrationError::getCode)
                    .containsExactly(ErrorCode.TARGET_EXISTS);
        }

        @Test
        void unknownType_isTypeNotFound() {
            ImpactReport report = analyzer.analyze(orderGraph(), MoveTypeOperation.builder()
                    .typeFullName("com.acme.Unknown")
                    .newNamespace("com.acme.sales")
                    .build());

            assertThat(report.getErrors()).extracting(ImpactReport.MigrationError::getCode)
                    .containsExactly(ErrorCode.TYPE_NOT_FOUND);
            assertThat(report.getComplexity()).isEqualTo(MigrationComplexity.VERY_COMPLEX);
        }

        @Test
        void orphanType_isReportedNotThrown() {
            DependencyGraph graph = new DependencyGraph();
            graph.addType(TypeNode.builder()
                    .id(GraphIds.typeId("lost.Orphan"))
                    .fullName("lost.Orphan")
                    .namespace("lost")
                    .simpleName("Orphan")
                    .fileId(GraphIds.fileId("/gone/Orphan.java"))
                    .build());

            ImpactReport report = analyzer.analyze(graph, MoveTypeOperation.builder()
                    .typeFullName("lost.Orphan")
                    .newNamespace("found")
                    .build());

            assertThat(report.canProceed()).isFalse();
            assertThat(report.getErrors()).extracting(ImpactReport.MigrationError::getCode)
                    .containsExactly(ErrorCode.FILE_NOT_FOUND);
        }
    }
}

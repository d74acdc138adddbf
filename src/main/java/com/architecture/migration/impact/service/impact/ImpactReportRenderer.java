package com.architecture.migration.impact.service.impact;

import com.architecture.migration.impact.dto.impact.AffectedFileReason;
import com.architecture.migration.impact.dto.impact.ImpactReport;
import com.architecture.migration.impact.dto.impact.ImpactReport.AffectedFile;
import com.architecture.migration.impact.dto.impact.ImpactReport.RequiredChange;
import com.architecture.migration.impact.model.graph.GraphPaths;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders impact reports as Markdown for people and JSON for tools.
 * Both renderings are deterministic for a given report.
 */
@Component
public class ImpactReportRenderer {

    private static final String UNKNOWN = "unknown";

    private final ObjectMapper objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    // ========================= MARKDOWN =========================

    public String toMarkdown(ImpactReport report) {
        StringBuilder sb = new StringBuilder();

        sb.append("# Migration Impact Report\n\n");
        sb.append("## Summary\n\n");
        sb.append("| Metric | Value |\n");
        sb.append("|--------|-------|\n");
        sb.append("| Operation | ").append(report.getOperation().getDescription()).append(" |\n");
        sb.append("| Complexity | ").append(report.getComplexity()).append(" |\n");
        sb.append("| Can Proceed | ").append(report.canProceed() ? "Yes" : "No").append(" |\n");
        sb.append("| Affected Files | ").append(report.getAffectedFileCount()).append(" |\n");
        sb.append("| Affected Types | ").append(report.getAffectedTypeCount()).append(" |\n");
        sb.append("| Affected Projects | ").append(report.getAffectedProjectCount()).append(" |\n");
        sb.append("| Required Changes | ").append(report.getRequiredChangeCount()).append(" |\n");
        sb.append('\n');

        if (!report.getErrors().isEmpty()) {
            sb.append("## Errors (Must Fix)\n\n");
            for (ImpactReport.MigrationError error : report.getErrors()) {
                appendIssue(sb, error.getCode().name(), error.getMessage(), error.getFilePath());
            }
            sb.append('\n');
        }

        if (!report.getWarnings().isEmpty()) {
            sb.append("## Warnings\n\n");
            for (ImpactReport.MigrationWarning warning : report.getWarnings()) {
                appendIssue(sb, warning.getCode().name(), warning.getMessage(), warning.getFilePath());
            }
            sb.append('\n');
        }

        if (!report.getAffectedFiles().isEmpty()) {
            sb.append("## Affected Files\n\n");
            Map<AffectedFileReason, List<AffectedFile>> byReason = report.getAffectedFiles().stream()
                    .collect(Collectors.groupingBy(AffectedFile::getReason,
                            () -> new EnumMap<>(AffectedFileReason.class), Collectors.toList()));
            for (Map.Entry<AffectedFileReason, List<AffectedFile>> group : byReason.entrySet()) {
                sb.append("### ").append(group.getKey().getLabel()).append("\n\n");
                sb.append("| File | Changes |\n");
                sb.append("|------|---------|\n");
                for (AffectedFile file : group.getValue()) {
                    String changes = file.getRequiredChanges().stream()
                            .map(c -> c.getType().name())
                            .collect(Collectors.joining(", "));
                    sb.append("| `").append(GraphPaths.fileNameOf(file.getFilePath())).append("` | ")
                            .append(changes).append(" |\n");
                }
                sb.append('\n');
            }
        }

        if (!report.getRequiredProjectReferences().isEmpty()) {
            sb.append("## Required Project References\n\n");
            sb.append("| Project | Needs Reference To |\n");
            sb.append("|---------|-------------------|\n");
            for (ImpactReport.RequiredProjectReference reference : report.getRequiredProjectReferences()) {
                sb.append("| `").append(projectLabel(reference.getProjectPath())).append("` | `")
                        .append(projectLabel(reference.getReferencePath())).append("` |\n");
            }
            sb.append('\n');
        }

        return sb.toString();
    }

    private void appendIssue(StringBuilder sb, String code, String message, String filePath) {
        sb.append("- **").append(code).append("**: ").append(message).append('\n');
        if (filePath != null) {
            sb.append("  - File: `").append(filePath).append("`\n");
        }
    }

    /**
     * Project manifests share a file name (pom.xml), so projects are labelled by directory.
     */
    private String projectLabel(String manifestPath) {
        String directory = GraphPaths.directoryOf(manifestPath);
        return directory.isEmpty() ? GraphPaths.fileNameOf(manifestPath) : GraphPaths.fileNameOf(directory);
    }

    // ========================= JSON =========================

    public String toJson(ImpactReport report) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("success", true);
        root.put("operation", report.getOperation().getDescription());
        root.put("operationKind", report.getOperation().getKind().name());
        root.put("canProceed", report.canProceed());
        root.put("complexity", report.getComplexity().name());

        ObjectNode summary = root.putObject("summary");
        summary.put("affectedFilesCount", report.getAffectedFileCount());
        summary.put("affectedTypesCount", report.getAffectedTypeCount());
        summary.put("affectedProjectsCount", report.getAffectedProjectCount());
        summary.put("requiredChangesCount", report.getRequiredChangeCount());
        summary.put("warningsCount", report.getWarnings().size());
        summary.put("errorsCount", report.getErrors().size());

        ArrayNode files = root.putArray("affectedFiles");
        for (AffectedFile file : report.getAffectedFiles()) {
            ObjectNode node = files.addObject();
            node.put("filePath", file.getFilePath());
            node.put("projectPath", file.getProjectPath() == null ? UNKNOWN : file.getProjectPath());
            node.put("reason", file.getReason().name());
            ArrayNode changes = node.putArray("changes");
            for (RequiredChange change : file.getRequiredChanges()) {
                ObjectNode c = changes.addObject();
                c.put("type", change.getType().name());
                c.put("lineNumber", change.getLineNumber());
                c.put("currentValue", change.getCurrentValue());
                c.put("newValue", change.getNewValue());
                c.put("description", change.getDescription());
            }
        }

        ArrayNode types = root.putArray("affectedTypes");
        for (ImpactReport.AffectedType type : report.getAffectedTypes()) {
            ObjectNode node = types.addObject();
            node.put("typeFullName", type.getTypeFullName());
            node.put("filePath", type.getFilePath());
            node.put("reason", type.getReason().name());
        }

        ArrayNode references = root.putArray("requiredProjectReferences");
        for (ImpactReport.RequiredProjectReference reference : report.getRequiredProjectReferences()) {
            ObjectNode node = references.addObject();
            node.put("projectPath", reference.getProjectPath());
            node.put("referencePath", reference.getReferencePath());
            node.put("reason", reference.getReason());
        }

        ArrayNode packages = root.putArray("requiredPackageReferences");
        for (ImpactReport.RequiredPackageReference reference : report.getRequiredPackageReferences()) {
            ObjectNode node = packages.addObject();
            node.put("projectPath", reference.getProjectPath());
            node.put("packageId", reference.getPackageId());
            node.put("version", reference.getVersion());
            node.put("reason", reference.getReason());
        }

        ArrayNode warnings = root.putArray("warnings");
        for (ImpactReport.MigrationWarning warning : report.getWarnings()) {
            ObjectNode node = warnings.addObject();
            node.put("code", warning.getCode().name());
            node.put("message", warning.getMessage());
            node.put("filePath", warning.getFilePath());
        }

        ArrayNode errors = root.putArray("errors");
        for (ImpactReport.MigrationError error : report.getErrors()) {
            ObjectNode node = errors.addObject();
            node.put("code", error.getCode().name());
            node.put("message", error.getMessage());
            node.put("filePath", error.getFilePath());
        }

        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render impact report as JSON: " + e.getMessage(), e);
        }
    }
}

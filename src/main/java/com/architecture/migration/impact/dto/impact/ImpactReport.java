package com.architecture.migration.impact.dto.impact;

import com.architecture.migration.impact.dto.operation.MigrationOperation;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Result of analyzing one migration operation against a dependency graph.
 * The operation can proceed when no error was recorded; warnings never block.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImpactReport {

    private MigrationOperation operation;

    @Builder.Default
    private MigrationComplexity complexity = MigrationComplexity.SIMPLE;

    @Builder.Default
    private List<AffectedFile> affectedFiles = new ArrayList<>();

    @Builder.Default
    private List<AffectedType> affectedTypes = new ArrayList<>();

    @Builder.Default
    private List<RequiredProjectReference> requiredProjectReferences = new ArrayList<>();

    @Builder.Default
    private List<RequiredPackageReference> requiredPackageReferences = new ArrayList<>();

    @Builder.Default
    private List<MigrationWarning> warnings = new ArrayList<>();

    @Builder.Default
    private List<MigrationError> errors = new ArrayList<>();

    public boolean canProceed() {
        return errors.isEmpty();
    }

    public int getAffectedFileCount() {
        return affectedFiles.size();
    }

    public int getAffectedTypeCount() {
        return affectedTypes.size();
    }

    /**
     * Distinct projects owning an affected file. Files outside any known project are not counted.
     */
    public int getAffectedProjectCount() {
        return (int) affectedFiles.stream()
                .map(AffectedFile::getProjectPath)
                .filter(Objects::nonNull)
                .distinct()
                .count();
    }

    public int getRequiredChangeCount() {
        return affectedFiles.stream().mapToInt(f -> f.getRequiredChanges().size()).sum();
    }

    public void addError(ErrorCode code, String message, String filePath) {
        errors.add(MigrationError.builder().code(code).message(message).filePath(filePath).build());
    }

    public void addWarning(WarningCode code, String message, String filePath) {
        warnings.add(MigrationWarning.builder().code(code).message(message).filePath(filePath).build());
    }

    /**
     * A file that has to change, or is changed directly, by the operation.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AffectedFile {
        private String filePath;
        private String projectPath;     // null when the file belongs to no known project
        private AffectedFileReason reason;

        @Builder.Default
        private List<RequiredChange> requiredChanges = new ArrayList<>();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AffectedType {
        private String typeFullName;
        private String filePath;
        private AffectedTypeReason reason;
    }

    /**
     * One edit a caller has to apply to a file.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RequiredChange {
        private RequiredChangeType type;
        private Integer lineNumber;
        private String currentValue;
        private String newValue;
        private String description;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RequiredProjectReference {
        private String projectPath;     // project that needs the reference
        private String referencePath;   // project it has to reference
        private String reason;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RequiredPackageReference {
        private String projectPath;
        private String packageId;
        private String version;
        private String reason;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MigrationError {
        private ErrorCode code;
        private String message;
        private String filePath;
        private Integer lineNumber;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MigrationWarning {
        private WarningCode code;
        private String message;
        private String filePath;
        private Integer lineNumber;
    }
}

package com.architecture.migration.impact.dto.operation;

/**
 * A proposed reorganization to analyze. Implementations are immutable.
 */
public interface MigrationOperation {

    OperationKind getKind();

    /**
     * One-line human readable description, echoed in reports.
     */
    String getDescription();
}

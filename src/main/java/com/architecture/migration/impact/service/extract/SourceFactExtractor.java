package com.architecture.migration.impact.service.extract;

import com.architecture.migration.impact.dto.extract.ProjectDescriptor;
import com.architecture.migration.impact.dto.extract.SourceFileFacts;

/**
 * Reads the facts the graph needs from one source file: declared namespace, imports and
 * top-level types. Implementations must be safe to call from several threads for different
 * projects.
 */
public interface SourceFactExtractor {

    SourceFileFacts extract(ProjectDescriptor project, String filePath);

    /**
     * Called once a project has been fully processed, so per-project caches can be dropped.
     */
    default void release(ProjectDescriptor project) {
    }
}

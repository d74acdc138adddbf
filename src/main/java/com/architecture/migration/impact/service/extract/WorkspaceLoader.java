package com.architecture.migration.impact.service.extract;

import com.architecture.migration.impact.dto.extract.SolutionDescriptor;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Turns an input path into the set of projects it contains.
 */
public interface WorkspaceLoader {

    /**
     * Load a solution or a single project. A single project comes back wrapped in a virtual
     * solution.
     *
     * @throws IOException if the input cannot be opened at all
     */
    SolutionDescriptor load(Path inputPath) throws IOException;
}

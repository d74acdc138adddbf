package com.architecture.migration.impact.service.graph;

import lombok.Builder;
import lombok.Value;

/**
 * Snapshot of build progress passed to a {@link GraphBuildProgressListener}.
 */
@Value
@Builder
public class GraphBuildProgress {

    GraphBuildPhase phase;
    String currentItem;
    int progressPercent;
    int processedCount;
    int totalCount;

    public String getMessage() {
        return "[" + phase + "] " + currentItem + " (" + processedCount + "/" + totalCount + ")";
    }
}

package com.architecture.migration.impact.service.graph;

/**
 * Receives progress checkpoints from the graph builder. May be called from worker threads;
 * implementations serialize their own output if they need to.
 */
@FunctionalInterface
public interface GraphBuildProgressListener {

    void onProgress(GraphBuildProgress progress);
}

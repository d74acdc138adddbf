package com.architecture.migration.impact.service.graph;

public enum GraphBuildPhase {
    LOADING_SOLUTION,
    ANALYZING_PROJECTS,
    ANALYZING_USAGES,
    COMPLETED
}

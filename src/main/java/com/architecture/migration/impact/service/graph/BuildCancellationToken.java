package com.architecture.migration.impact.service.graph;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag. The builder polls it between inputs, projects and files.
 */
public class BuildCancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public static BuildCancellationToken none() {
        return new BuildCancellationToken();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}

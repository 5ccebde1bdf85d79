package com.augment.core;

import java.time.Duration;
import java.util.Objects;

/**
 * Outcome of one {@link WorkerPool} run.
 *
 * @param submitted tasks handed to the pool
 * @param processed tasks that made it through the pipeline
 * @param persisted artifacts the sink wrote
 * @param failedTasks tasks dropped because loading or a transform failed
 * @param failedWrites artifacts the sink could not write
 */
public record RunReport(long submitted, long processed, long persisted, long failedTasks, long failedWrites,
                        Duration elapsed) {
    public RunReport {
        Objects.requireNonNull(elapsed, "elapsed");
    }

    public static RunReport empty() {
        return new RunReport(0, 0, 0, 0, 0, Duration.ZERO);
    }

    public boolean isClean() {
        return failedTasks == 0 && failedWrites == 0;
    }
}

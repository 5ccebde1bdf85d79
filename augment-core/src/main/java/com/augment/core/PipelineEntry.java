package com.augment.core;

import java.util.Objects;

/** An operation together with the probability that {@link Pipeline#apply} runs it. */
public record PipelineEntry(Operation operation, double probability) {
    public PipelineEntry {
        Objects.requireNonNull(operation, "operation");
        if (!(probability >= 0.0 && probability <= 1.0)) {
            throw new IllegalArgumentException("probability must be in [0, 1], got " + probability);
        }
    }
}

package com.augment.core;

import java.util.List;
import java.util.Objects;

/** One configured pipeline line: operation name, its numeric arguments and the chance it runs. */
public record OperationSpec(String name, List<Double> params, double probability) {
    public OperationSpec {
        Objects.requireNonNull(name, "name");
        params = params == null ? List.of() : List.copyOf(params);
    }

    public OperationSpec(String name, double probability) {
        this(name, List.of(), probability);
    }
}

package com.augment.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One unit of work: augment {@code identifier} for the {@code iteration}-th time, drawing from
 * {@code seed}. The seed is a function of the run's base seed and {@link #name()} only, so a task
 * gets the same random stream whichever worker picks it up.
 */
public record Task(String identifier, int iteration, long seed) {
    public Task {
        Objects.requireNonNull(identifier, "identifier");
        if (iteration < 0) throw new IllegalArgumentException("iteration must be >= 0");
    }

    public static Task of(String identifier, int iteration, long baseSeed) {
        return new Task(identifier, iteration, Seeds.derive(baseSeed, nameOf(identifier, iteration)));
    }

    /**
     * Every (identifier, iteration) pair, identifier-major, in input order.
     *
     * @throws IllegalArgumentException if {@code iterations < 1}
     */
    public static List<Task> enumerate(List<String> identifiers, int iterations, long baseSeed) {
        Objects.requireNonNull(identifiers, "identifiers");
        if (iterations < 1) throw new IllegalArgumentException("iterations must be >= 1, got " + iterations);
        List<Task> tasks = new ArrayList<>(identifiers.size() * iterations);
        for (String id : identifiers) {
            for (int i = 0; i < iterations; i++) tasks.add(of(id, i, baseSeed));
        }
        return tasks;
    }

    /** Display name given to the image built for this task. */
    public String name() {
        return nameOf(identifier, iteration);
    }

    static String nameOf(String identifier, int iteration) {
        return identifier + "#" + iteration;
    }
}

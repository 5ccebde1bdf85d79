package com.augment.core;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/** The argument counts an operation accepts, e.g. {@code Arity.of(2, 4)} for resize. */
public record Arity(List<Integer> counts) {
    public Arity {
        if (counts == null || counts.isEmpty()) throw new IllegalArgumentException("counts must not be empty");
        for (Integer c : counts) {
            if (c == null || c < 0) throw new IllegalArgumentException("counts must be >= 0");
        }
        counts = List.copyOf(counts);
    }

    public static Arity of(int... counts) {
        return new Arity(Arrays.stream(counts).sorted().distinct().boxed().collect(Collectors.toList()));
    }

    public boolean accepts(int count) {
        return counts.contains(count);
    }

    @Override
    public String toString() {
        return counts.stream().map(String::valueOf).collect(Collectors.joining(" or "));
    }
}

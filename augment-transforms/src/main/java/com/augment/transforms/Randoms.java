package com.augment.transforms;

import java.util.Random;

/**
 * Uniform sampling helpers over a caller-supplied {@link Random}.
 * Both bounds are inclusive for integers; doubles are drawn from {@code [min, max)}.
 */
public final class Randoms {
    private Randoms() {}

    public static int uniformInt(Random rng, int min, int max) {
        if (min > max) throw new IllegalArgumentException("min > max: " + min + " > " + max);
        long span = (long) max - min + 1;
        if (span <= Integer.MAX_VALUE) return min + rng.nextInt((int) span);
        return (int) (min + rng.nextLong(span));
    }

    public static double uniformDouble(Random rng, double min, double max) {
        if (min > max) throw new IllegalArgumentException("min > max: " + min + " > " + max);
        return min + (max - min) * rng.nextDouble();
    }
}

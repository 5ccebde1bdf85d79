package com.augment.core;

import java.util.List;
import java.util.Random;

/** Draws a default argument list for an operation configured without parameters. */
@FunctionalInterface
public interface ParameterSampler {
    List<Double> sample(Random rng);
}

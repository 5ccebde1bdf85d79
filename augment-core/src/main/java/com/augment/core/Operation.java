package com.augment.core;

import java.util.Random;

/**
 * A configured, immutable image transform. Instances are shared by every producer thread, so
 * implementations keep no mutable state; all randomness comes from the {@code rng} argument.
 */
public interface Operation {

    /**
     * Transforms {@code image} in place and appends a description of what was done to its history.
     *
     * @throws RuntimeException if the transform cannot be applied to this image
     */
    void apply(Image image, Random rng);

    /** Short name used in logs and metrics, e.g. {@code RotateImage}. */
    String name();
}

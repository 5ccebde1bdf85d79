package com.augment.core.ops;

import com.augment.core.Image;
import com.augment.core.Operation;
import com.augment.transforms.Transforms;

import java.util.Arrays;
import java.util.Random;

/** Warps with a fixed 2x3 affine matrix given row-major. */
public final class AffineTransformImage implements Operation {
    private final double[] matrix;

    public AffineTransformImage(double[] matrix) {
        if (matrix == null || matrix.length != 6) throw new IllegalArgumentException("matrix needs 6 values");
        this.matrix = matrix.clone();
    }

    @Override
    public void apply(Image image, Random rng) {
        image.setData(Transforms.affine(image.data(), matrix));
        image.logOperation("AffineTransform: " + Arrays.toString(matrix));
    }

    @Override
    public String name() { return "AffineTransform"; }
}

package com.augment.core.ops;

import com.augment.core.Image;
import com.augment.core.Operation;
import com.augment.transforms.Transforms;

import java.util.Random;

/** Converts to luma grayscale, keeping three channels. */
public final class ToGrayscale implements Operation {

    @Override
    public void apply(Image image, Random rng) {
        image.setData(Transforms.grayscale(image.data()));
        image.logOperation("ToGrayscale");
    }

    @Override
    public String name() { return "ToGrayscale"; }
}

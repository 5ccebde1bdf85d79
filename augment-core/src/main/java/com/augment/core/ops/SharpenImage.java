package com.augment.core.ops;

import com.augment.core.Image;
import com.augment.core.Operation;
import com.augment.transforms.Transforms;

import java.util.Random;

/** 3x3 Laplacian sharpen. */
public final class SharpenImage implements Operation {

    @Override
    public void apply(Image image, Random rng) {
        image.setData(Transforms.sharpen(image.data()));
        image.logOperation("SharpenImage");
    }

    @Override
    public String name() { return "SharpenImage"; }
}

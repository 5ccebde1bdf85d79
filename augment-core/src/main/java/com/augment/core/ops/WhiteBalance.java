package com.augment.core.ops;

import com.augment.core.Image;
import com.augment.core.Operation;
import com.augment.transforms.Transforms;

import java.util.Random;

/** Gray-world white balance. */
public final class WhiteBalance implements Operation {

    @Override
    public void apply(Image image, Random rng) {
        image.setData(Transforms.whiteBalance(image.data()));
        image.logOperation("WhiteBalance");
    }

    @Override
    public String name() { return "WhiteBalance"; }
}

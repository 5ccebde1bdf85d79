package com.augment.core.ops;

import com.augment.core.Image;
import com.augment.core.Operation;
import com.augment.transforms.Randoms;
import com.augment.transforms.Transforms;

import java.util.Random;

/** Adds an offset drawn from {@code [min, max)} to every channel. */
public final class AdjustBrightness implements Operation {
    private final double min;
    private final double max;

    public AdjustBrightness(double min, double max) {
        Params.requireOrdered("adjust brightness", min, max, "value");
        this.min = min;
        this.max = max;
    }

    @Override
    public void apply(Image image, Random rng) {
        double offset = Randoms.uniformDouble(rng, min, max);
        image.setData(Transforms.adjustBrightness(image.data(), offset));
        image.logOperation("AdjustBrightness: " + Params.fmt(offset));
    }

    @Override
    public String name() { return "AdjustBrightness"; }
}

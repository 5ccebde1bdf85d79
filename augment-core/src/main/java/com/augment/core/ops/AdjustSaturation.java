package com.augment.core.ops;

import com.augment.core.Image;
import com.augment.core.Operation;
import com.augment.transforms.Randoms;
import com.augment.transforms.Transforms;

import java.util.Random;

public final class AdjustSaturation implements Operation {
    private final double min;
    private final double max;

    public AdjustSaturation(double min, double max) {
        Params.requireNonNegative("adjust saturation", min, "minimum value");
        Params.requireOrdered("adjust saturation", min, max, "value");
        this.min = min;
        this.max = max;
    }

    @Override
    public void apply(Image image, Random rng) {
        double factor = Randoms.uniformDouble(rng, min, max);
        image.setData(Transforms.adjustSaturation(image.data(), factor));
        image.logOperation("AdjustSaturation: " + Params.fmt(factor));
    }

    @Override
    public String name() { return "AdjustSaturation"; }
}

package com.augment.core.ops;

import com.augment.core.Image;
import com.augment.core.Operation;
import com.augment.transforms.Randoms;
import com.augment.transforms.Transforms;

import java.util.Random;

/** Multiplies every channel by a gain drawn from {@code [min, max)}. */
public final class AdjustContrast implements Operation {
    private final double min;
    private final double max;

    public AdjustContrast(double min, double max) {
        Params.requireNonNegative("adjust contrast", min, "minimum value");
        Params.requireOrdered("adjust contrast", min, max, "value");
        this.min = min;
        this.max = max;
    }

    @Override
    public void apply(Image image, Random rng) {
        double gain = Randoms.uniformDouble(rng, min, max);
        image.setData(Transforms.adjustContrast(image.data(), gain));
        image.logOperation("AdjustContrast: " + Params.fmt(gain));
    }

    @Override
    public String name() { return "AdjustContrast"; }
}

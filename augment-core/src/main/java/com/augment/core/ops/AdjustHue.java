package com.augment.core.ops;

import com.augment.core.Image;
import com.augment.core.Operation;
import com.augment.transforms.Randoms;
import com.augment.transforms.Transforms;

import java.util.Random;

/** Shifts hue by a whole number of degrees drawn from {@code [min, max]}. */
public final class AdjustHue implements Operation {
    private final int min;
    private final int max;

    public AdjustHue(int min, int max) {
        Params.requireOrdered("adjust hue", min, max, "value");
        this.min = min;
        this.max = max;
    }

    @Override
    public void apply(Image image, Random rng) {
        int shift = Randoms.uniformInt(rng, min, max);
        image.setData(Transforms.adjustHue(image.data(), shift));
        image.logOperation("AdjustHue: " + shift);
    }

    @Override
    public String name() { return "AdjustHue"; }
}

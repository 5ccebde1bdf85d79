package com.augment.core.ops;

import com.augment.core.Image;
import com.augment.core.Operation;
import com.augment.transforms.Transforms;

import java.util.Random;

/** Blacks out one rectangle of random size and position. */
public final class RandomErase implements Operation {
    private final int minH;
    private final int maxH;
    private final int minW;
    private final int maxW;

    public RandomErase() {
        this(1, 10, 1, 10);
    }

    public RandomErase(int minH, int maxH, int minW, int maxW) {
        Params.requireNonNegative("random erase", minH, "minimum height");
        Params.requireNonNegative("random erase", minW, "minimum width");
        Params.requireOrdered("random erase", minH, maxH, "height");
        Params.requireOrdered("random erase", minW, maxW, "width");
        this.minH = minH;
        this.maxH = maxH;
        this.minW = minW;
        this.maxW = maxW;
    }

    @Override
    public void apply(Image image, Random rng) {
        image.setData(Transforms.randomErase(image.data(), minH, maxH, minW, maxW, rng));
        image.logOperation("RandomErase: h=" + minH + "-" + maxH + ", w=" + minW + "-" + maxW);
    }

    @Override
    public String name() { return "RandomErase"; }
}

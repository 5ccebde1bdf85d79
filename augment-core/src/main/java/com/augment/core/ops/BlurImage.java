package com.augment.core.ops;

import com.augment.core.Image;
import com.augment.core.Operation;
import com.augment.transforms.Randoms;
import com.augment.transforms.Transforms;

import java.util.Random;

/** Box blur with an odd kernel size drawn from {@code [minKernel, maxKernel]}; even draws are bumped up by one. */
public final class BlurImage implements Operation {
    private final int minKernel;
    private final int maxKernel;

    public BlurImage() {
        this(3, 9);
    }

    public BlurImage(int minKernel, int maxKernel) {
        Params.requirePositive("blur image", minKernel, "minimum kernel size");
        Params.requireOrdered("blur image", minKernel, maxKernel, "kernel size");
        this.minKernel = minKernel;
        this.maxKernel = maxKernel;
    }

    @Override
    public void apply(Image image, Random rng) {
        int k = Randoms.uniformInt(rng, minKernel, maxKernel);
        if (k % 2 == 0) k += 1;
        image.setData(Transforms.blur(image.data(), k));
        image.logOperation("BlurImage: k=" + k);
    }

    @Override
    public String name() { return "BlurImage"; }
}

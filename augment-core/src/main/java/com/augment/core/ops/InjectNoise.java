package com.augment.core.ops;

import com.augment.core.Image;
import com.augment.core.Operation;
import com.augment.transforms.Randoms;
import com.augment.transforms.Transforms;

import java.util.Random;

/** Adds Gaussian noise whose mean and standard deviation are drawn from ranges. */
public final class InjectNoise implements Operation {
    private final double meanMin;
    private final double meanMax;
    private final double stdevMin;
    private final double stdevMax;

    public InjectNoise() {
        this(-10.0, 10.0, 0.0, 20.0);
    }

    public InjectNoise(double meanMin, double meanMax, double stdevMin, double stdevMax) {
        Params.requireOrdered("inject noise", meanMin, meanMax, "mean");
        Params.requireNonNegative("inject noise", stdevMin, "minimum stdev");
        Params.requireOrdered("inject noise", stdevMin, stdevMax, "stdev");
        this.meanMin = meanMin;
        this.meanMax = meanMax;
        this.stdevMin = stdevMin;
        this.stdevMax = stdevMax;
    }

    @Override
    public void apply(Image image, Random rng) {
        double mean = Randoms.uniformDouble(rng, meanMin, meanMax);
        double stdev = Randoms.uniformDouble(rng, stdevMin, stdevMax);
        // per-pixel draws use a child stream; the parent advances by one draw at any image size
        image.setData(Transforms.injectNoise(image.data(), mean, stdev, new Random(rng.nextLong())));
        image.logOperation("InjectNoise: mean=" + Params.fmt(mean) + ", stdev=" + Params.fmt(stdev));
    }

    @Override
    public String name() { return "InjectNoise"; }
}

package com.augment.core.ops;

import com.augment.core.Image;
import com.augment.core.Operation;
import com.augment.transforms.Transforms;

import java.util.Random;

/** Equalizes the luma histogram. */
public final class HistogramEqualization implements Operation {

    @Override
    public void apply(Image image, Random rng) {
        image.setData(Transforms.histogramEqualization(image.data()));
        image.logOperation("HistogramEqualization");
    }

    @Override
    public String name() { return "HistogramEqualization"; }
}

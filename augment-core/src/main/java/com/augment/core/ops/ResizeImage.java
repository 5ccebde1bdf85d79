package com.augment.core.ops;

import com.augment.core.Image;
import com.augment.core.Operation;
import com.augment.transforms.Randoms;
import com.augment.transforms.Transforms;

import java.util.Random;

/** Resizes either by a uniform scale factor or to absolute dimensions, both drawn from ranges. */
public final class ResizeImage implements Operation {
    private final boolean byScale;
    private final double minScale;
    private final double maxScale;
    private final int minW;
    private final int maxW;
    private final int minH;
    private final int maxH;

    private ResizeImage(boolean byScale, double minScale, double maxScale, int minW, int maxW, int minH, int maxH) {
        this.byScale = byScale;
        this.minScale = minScale;
        this.maxScale = maxScale;
        this.minW = minW;
        this.maxW = maxW;
        this.minH = minH;
        this.maxH = maxH;
    }

    public static ResizeImage byScale(double minScale, double maxScale) {
        Params.requirePositive("resize", minScale, "scale");
        Params.requireOrdered("resize", minScale, maxScale, "scale");
        return new ResizeImage(true, minScale, maxScale, 0, 0, 0, 0);
    }

    public static ResizeImage absolute(int minW, int maxW, int minH, int maxH) {
        Params.requirePositive("resize", minW, "width");
        Params.requirePositive("resize", minH, "height");
        Params.requireOrdered("resize", minW, maxW, "width");
        Params.requireOrdered("resize", minH, maxH, "height");
        return new ResizeImage(false, 0, 0, minW, maxW, minH, maxH);
    }

    @Override
    public void apply(Image image, Random rng) {
        if (byScale) {
            double scale = Randoms.uniformDouble(rng, minScale, maxScale);
            image.setData(Transforms.resize(image.data(), scale));
            image.logOperation("ResizeImage (scale): " + Params.fmt(scale));
        } else {
            int w = Randoms.uniformInt(rng, minW, maxW);
            int h = Randoms.uniformInt(rng, minH, maxH);
            image.setData(Transforms.resize(image.data(), w, h));
            image.logOperation("ResizeImage (absolute): " + w + "x" + h);
        }
    }

    @Override
    public String name() { return "ResizeImage"; }
}

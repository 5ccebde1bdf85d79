package com.augment.core.ops;

import com.augment.core.Image;
import com.augment.core.Operation;
import com.augment.transforms.Transforms;

import java.util.Random;

/**
 * Crops a fixed-size window, either at a fixed origin or at one drawn from the rng. A window that
 * does not fit the image fails the task.
 */
public final class CropImage implements Operation {
    private final int x;
    private final int y;
    private final int width;
    private final int height;
    private final boolean randomOrigin;

    private CropImage(int x, int y, int width, int height, boolean randomOrigin) {
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
        this.randomOrigin = randomOrigin;
    }

    public static CropImage random(int width, int height) {
        Params.requirePositive("crop", width, "width");
        Params.requirePositive("crop", height, "height");
        return new CropImage(0, 0, width, height, true);
    }

    public static CropImage fixed(int x, int y, int width, int height) {
        Params.requireNonNegative("crop", x, "x");
        Params.requireNonNegative("crop", y, "y");
        Params.requirePositive("crop", width, "width");
        Params.requirePositive("crop", height, "height");
        return new CropImage(x, y, width, height, false);
    }

    @Override
    public void apply(Image image, Random rng) {
        if (randomOrigin) {
            image.setData(Transforms.randomCrop(image.data(), width, height, rng));
            image.logOperation("CropImage (random): " + width + "x" + height);
        } else {
            image.setData(Transforms.crop(image.data(), x, y, width, height));
            image.logOperation("CropImage (fixed): (" + x + "," + y + ") " + width + "x" + height);
        }
    }

    @Override
    public String name() { return "CropImage"; }
}

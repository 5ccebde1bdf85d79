package com.augment.core.ops;

import com.augment.core.Image;
import com.augment.core.Operation;
import com.augment.transforms.Transforms;

import java.util.Random;

/** Random brightness, contrast, saturation and hue jitter within symmetric ranges. */
public final class ColorJitter implements Operation {
    private final double brightness;
    private final double contrast;
    private final double saturation;
    private final int hue;

    public ColorJitter(double brightness, double contrast, double saturation, int hue) {
        Params.requireNonNegative("color jitter", brightness, "brightness range");
        Params.requireNonNegative("color jitter", contrast, "contrast range");
        Params.requireNonNegative("color jitter", saturation, "saturation range");
        Params.requireNonNegative("color jitter", hue, "hue range");
        this.brightness = brightness;
        this.contrast = contrast;
        this.saturation = saturation;
        this.hue = hue;
    }

    @Override
    public void apply(Image image, Random rng) {
        image.setData(Transforms.colorJitter(image.data(), brightness, contrast, saturation, hue, rng));
        image.logOperation("ColorJitter: " + Params.fmt(brightness) + " " + Params.fmt(contrast) + " "
            + Params.fmt(saturation) + " " + hue);
    }

    @Override
    public String name() { return "ColorJitter"; }
}

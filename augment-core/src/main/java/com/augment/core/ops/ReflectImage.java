package com.augment.core.ops;

import com.augment.core.Image;
import com.augment.core.Operation;
import com.augment.transforms.Randoms;
import com.augment.transforms.Transforms;

import java.util.Random;

/** Flips top-to-bottom or left-to-right, the axis drawn with even odds. */
public final class ReflectImage implements Operation {

    @Override
    public void apply(Image image, Random rng) {
        if (Randoms.uniformInt(rng, 0, 1) == 0) {
            image.setData(Transforms.reflectVertical(image.data()));
            image.logOperation("ReflectImage: Vertical");
        } else {
            image.setData(Transforms.reflectHorizontal(image.data()));
            image.logOperation("ReflectImage: Horizontal");
        }
    }

    @Override
    public String name() { return "ReflectImage"; }
}

package com.augment.core.ops;

import com.augment.core.Arity;
import com.augment.core.OperationRegistry;
import com.augment.transforms.Randoms;

import java.util.List;
import java.util.Random;

/**
 * Registers the built-in operations. Names are the ones accepted in pipeline configs; the samplers
 * give the ranges {@link OperationRegistry#buildRandom} draws from when a config omits parameters.
 */
public final class BuiltinOperations {
    private BuiltinOperations() {}

    public static void registerAll(OperationRegistry r) {
        r.register("rotate", Arity.of(3),
            p -> RotateImage.fromCode(p.get(0), p.get(1), p.get(2)),
            rng -> List.of(between(rng, -45, 0), between(rng, 0, 45), (double) Randoms.uniformInt(rng, 0, 2)));

        r.register("reflect", Arity.of(0), p -> new ReflectImage());

        r.register("resize", Arity.of(2, 4),
            p -> p.size() == 2
                ? ResizeImage.byScale(p.get(0), p.get(1))
                : ResizeImage.absolute(
                    Params.whole("resize", p.get(0), "min width"), Params.whole("resize", p.get(1), "max width"),
                    Params.whole("resize", p.get(2), "min height"), Params.whole("resize", p.get(3), "max height")),
            rng -> List.of(between(rng, 0.5, 1.0), between(rng, 1.0, 1.5)));

        r.register("crop", Arity.of(2, 4),
            p -> p.size() == 2
                ? CropImage.random(Params.whole("crop", p.get(0), "width"), Params.whole("crop", p.get(1), "height"))
                : CropImage.fixed(
                    Params.whole("crop", p.get(0), "x"), Params.whole("crop", p.get(1), "y"),
                    Params.whole("crop", p.get(2), "width"), Params.whole("crop", p.get(3), "height")),
            rng -> List.of((double) Randoms.uniformInt(rng, 16, 64), (double) Randoms.uniformInt(rng, 16, 64)));

        r.register("affine transform", Arity.of(0, 6),
            p -> new AffineTransformImage(p.isEmpty() ? identity() : toArray(p)),
            rng -> List.of(
                between(rng, 0.8, 1.2), between(rng, -0.2, 0.2), between(rng, -10, 10),
                between(rng, -0.2, 0.2), between(rng, 0.8, 1.2), between(rng, -10, 10)));

        r.register("color jitter", Arity.of(4),
            p -> new ColorJitter(p.get(0), p.get(1), p.get(2), Params.whole("color jitter", p.get(3), "hue range")),
            rng -> List.of(between(rng, 0, 0.3), between(rng, 0, 0.3), between(rng, 0, 0.3),
                (double) Randoms.uniformInt(rng, 0, 18)));

        r.register("histogram equalization", Arity.of(0), p -> new HistogramEqualization());
        r.register("white balance", Arity.of(0), p -> new WhiteBalance());
        r.register("to grayscale", Arity.of(0), p -> new ToGrayscale());

        r.register("adjust brightness", Arity.of(2),
            p -> new AdjustBrightness(p.get(0), p.get(1)),
            rng -> List.of(between(rng, -40, 0), between(rng, 0, 40)));

        r.register("adjust contrast", Arity.of(2),
            p -> new AdjustContrast(p.get(0), p.get(1)),
            rng -> List.of(between(rng, 0.7, 1.0), between(rng, 1.0, 1.3)));

        r.register("adjust saturation", Arity.of(2),
            p -> new AdjustSaturation(p.get(0), p.get(1)),
            rng -> List.of(between(rng, 0.7, 1.0), between(rng, 1.0, 1.3)));

        r.register("adjust hue", Arity.of(2),
            p -> new AdjustHue(Params.whole("adjust hue", p.get(0), "min"), Params.whole("adjust hue", p.get(1), "max")),
            rng -> List.of((double) Randoms.uniformInt(rng, -18, 0), (double) Randoms.uniformInt(rng, 0, 18)));

        r.register("inject noise", Arity.of(0, 4),
            p -> p.isEmpty() ? new InjectNoise() : new InjectNoise(p.get(0), p.get(1), p.get(2), p.get(3)));

        r.register("blur image", Arity.of(0, 2),
            p -> p.isEmpty()
                ? new BlurImage()
                : new BlurImage(Params.whole("blur image", p.get(0), "min kernel"),
                    Params.whole("blur image", p.get(1), "max kernel")));

        r.register("sharpen image", Arity.of(0), p -> new SharpenImage());

        r.register("random erase", Arity.of(0, 4),
            p -> p.isEmpty()
                ? new RandomErase()
                : new RandomErase(
                    Params.whole("random erase", p.get(0), "min height"), Params.whole("random erase", p.get(1), "max height"),
                    Params.whole("random erase", p.get(2), "min width"), Params.whole("random erase", p.get(3), "max width")));
    }

    private static double between(Random rng, double min, double max) {
        return Randoms.uniformDouble(rng, min, max);
    }

    private static double[] identity() {
        return new double[] {1, 0, 0, 0, 1, 0};
    }

    private static double[] toArray(List<Double> p) {
        double[] out = new double[p.size()];
        for (int i = 0; i < out.length; i++) out[i] = p.get(i);
        return out;
    }
}

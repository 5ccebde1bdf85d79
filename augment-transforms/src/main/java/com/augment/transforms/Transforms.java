package com.augment.transforms;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.geom.AffineTransform;
import java.awt.image.AffineTransformOp;
import java.awt.image.BufferedImage;
import java.awt.image.ImagingOpException;
import java.util.Objects;
import java.util.Random;

/**
 * Pixel-level image transforms on {@link BufferedImage}.
 *
 * <p>Every function leaves its input untouched and returns a new {@code TYPE_INT_RGB} image.
 * Functions that need randomness take the caller's {@link Random}; nothing here draws from a
 * generator of its own, so a seeded caller gets reproducible output.
 */
public final class Transforms {
    private Transforms() {}

    // ---------------------------------------------------------------- geometry

    /** Rotates by {@code degrees} (counter-clockwise) and grows the canvas to fit the whole image. */
    public static BufferedImage rotateExpand(BufferedImage src, double degrees) {
        requireImage(src, "rotateExpand");
        double rad = Math.toRadians(degrees);
        double sin = Math.abs(Math.sin(rad));
        double cos = Math.abs(Math.cos(rad));
        int w = src.getWidth();
        int h = src.getHeight();
        int outW = Math.max(1, (int) Math.round(w * cos + h * sin));
        int outH = Math.max(1, (int) Math.round(w * sin + h * cos));
        return rotateInto(src, rad, outW, outH);
    }

    /** Rotates by {@code degrees} keeping the original canvas; uncovered corners are filled black. */
    public static BufferedImage rotateFill(BufferedImage src, double degrees) {
        requireImage(src, "rotateFill");
        return rotateInto(src, Math.toRadians(degrees), src.getWidth(), src.getHeight());
    }

    /** Rotates by {@code degrees} and crops to the largest axis-aligned rectangle free of fill. */
    public static BufferedImage rotateCrop(BufferedImage src, double degrees) {
        requireImage(src, "rotateCrop");
        BufferedImage rotated = rotateFill(src, degrees);
        int[] inner = largestInnerRect(src.getWidth(), src.getHeight(), Math.toRadians(degrees));
        int cw = Math.max(1, Math.min(inner[0], rotated.getWidth()));
        int ch = Math.max(1, Math.min(inner[1], rotated.getHeight()));
        int x = (rotated.getWidth() - cw) / 2;
        int y = (rotated.getHeight() - ch) / 2;
        return crop(rotated, x, y, cw, ch);
    }

    public static BufferedImage reflectHorizontal(BufferedImage src) {
        requireImage(src, "reflectHorizontal");
        int w = src.getWidth();
        int h = src.getHeight();
        int[] in = pixels(src);
        int[] out = new int[in.length];
        for (int y = 0; y < h; y++) {
            int row = y * w;
            for (int x = 0; x < w; x++) out[row + x] = in[row + (w - 1 - x)];
        }
        return image(w, h, out);
    }

    public static BufferedImage reflectVertical(BufferedImage src) {
        requireImage(src, "reflectVertical");
        int w = src.getWidth();
        int h = src.getHeight();
        int[] in = pixels(src);
        int[] out = new int[in.length];
        for (int y = 0; y < h; y++) {
            System.arraycopy(in, (h - 1 - y) * w, out, y * w, w);
        }
        return image(w, h, out);
    }

    public static BufferedImage resize(BufferedImage src, double scale) {
        requireImage(src, "resize");
        if (!(scale > 0)) throw new TransformException("resize: scale must be > 0, got " + scale);
        int w = Math.max(1, (int) Math.round(src.getWidth() * scale));
        int h = Math.max(1, (int) Math.round(src.getHeight() * scale));
        return resize(src, w, h);
    }

    public static BufferedImage resize(BufferedImage src, int width, int height) {
        requireImage(src, "resize");
        if (width < 1 || height < 1) {
            throw new TransformException("resize: target size must be positive, got " + width + "x" + height);
        }
        BufferedImage out = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = out.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.drawImage(src, 0, 0, width, height, null);
        } finally {
            g.dispose();
        }
        return out;
    }

    public static BufferedImage crop(BufferedImage src, int x, int y, int width, int height) {
        requireImage(src, "crop");
        if (width < 1 || height < 1) {
            throw new TransformException("crop: size must be positive, got " + width + "x" + height);
        }
        if (width > src.getWidth() || height > src.getHeight()) {
            throw new TransformException("crop: size (" + width + "x" + height + ") exceeds image dimensions ("
                + src.getWidth() + "x" + src.getHeight() + ")");
        }
        if (x < 0 || y < 0 || x + width > src.getWidth() || y + height > src.getHeight()) {
            throw new TransformException("crop: region (" + x + "," + y + ") " + width + "x" + height
                + " is outside the bounds of the " + src.getWidth() + "x" + src.getHeight() + " image");
        }
        int[] region = src.getRGB(x, y, width, height, null, 0, width);
        return image(width, height, region);
    }

    /** Crops a {@code width x height} window at an origin drawn from {@code rng}. */
    public static BufferedImage randomCrop(BufferedImage src, int width, int height, Random rng) {
        requireImage(src, "randomCrop");
        if (width > src.getWidth() || height > src.getHeight()) {
            throw new TransformException("randomCrop: crop size (" + width + "x" + height
                + ") exceeds the image dimensions (" + src.getWidth() + "x" + src.getHeight() + ")");
        }
        int x = Randoms.uniformInt(rng, 0, src.getWidth() - width);
        int y = Randoms.uniformInt(rng, 0, src.getHeight() - height);
        return crop(src, x, y, width, height);
    }

    /**
     * Applies a 2x3 affine matrix {@code [m00 m01 m02; m10 m11 m12]} mapping source to destination
     * coordinates. The output keeps the input size.
     */
    public static BufferedImage affine(BufferedImage src, double[] matrix) {
        requireImage(src, "affine");
        Objects.requireNonNull(matrix, "matrix");
        if (matrix.length != 6) throw new TransformException("affine: matrix needs 6 values, got " + matrix.length);
        AffineTransform at = new AffineTransform(matrix[0], matrix[3], matrix[1], matrix[4], matrix[2], matrix[5]);
        BufferedImage out = new BufferedImage(src.getWidth(), src.getHeight(), BufferedImage.TYPE_INT_RGB);
        try {
            AffineTransformOp op = new AffineTransformOp(at, AffineTransformOp.TYPE_BILINEAR);
            op.filter(toRgb(src), out);
        } catch (ImagingOpException e) {
            throw new TransformException("affine: matrix is not invertible", e);
        }
        return out;
    }

    // ---------------------------------------------------------------- color

    /**
     * Random brightness shift in {@code [-brightness, brightness] * 255}, contrast gain in
     * {@code [1 - contrast, 1 + contrast]}, saturation factor in {@code [1 - saturation, 1 + saturation]}
     * and hue shift in {@code [-hue, hue]} degrees, drawn from {@code rng} in that order.
     */
    public static BufferedImage colorJitter(BufferedImage src, double brightness, double contrast,
                                            double saturation, int hue, Random rng) {
        requireImage(src, "colorJitter");
        double shift = Randoms.uniformDouble(rng, -brightness, brightness) * 255.0;
        double gain = Randoms.uniformDouble(rng, 1.0 - contrast, 1.0 + contrast);
        double sat = Randoms.uniformDouble(rng, 1.0 - saturation, 1.0 + saturation);
        int hueShift = Randoms.uniformInt(rng, -hue, hue);
        BufferedImage out = adjustBrightness(src, shift);
        out = adjustContrast(out, gain);
        out = adjustSaturation(out, sat);
        return adjustHue(out, hueShift);
    }

    /** Equalizes the luma histogram, leaving chroma untouched. */
    public static BufferedImage histogramEqualization(BufferedImage src) {
        requireImage(src, "histogramEqualization");
        int[] px = pixels(src);
        int n = px.length;
        double[] yy = new double[n];
        double[] cb = new double[n];
        double[] cr = new double[n];
        int[] hist = new int[256];
        for (int i = 0; i < n; i++) {
            int r = red(px[i]), g = green(px[i]), b = blue(px[i]);
            yy[i] = 0.299 * r + 0.587 * g + 0.114 * b;
            cb[i] = 128 - 0.168736 * r - 0.331264 * g + 0.5 * b;
            cr[i] = 128 + 0.5 * r - 0.418688 * g - 0.081312 * b;
            hist[clamp(yy[i])]++;
        }
        int[] lut = new int[256];
        int cdfMin = 0;
        int cumulative = 0;
        for (int v = 0; v < 256; v++) {
            cumulative += hist[v];
            if (cdfMin == 0 && cumulative > 0) cdfMin = cumulative;
            lut[v] = n == cdfMin ? v : clamp((cumulative - cdfMin) * 255.0 / (n - cdfMin));
        }
        int[] out = new int[n];
        for (int i = 0; i < n; i++) {
            double y = lut[clamp(yy[i])];
            double r = y + 1.402 * (cr[i] - 128);
            double g = y - 0.344136 * (cb[i] - 128) - 0.714136 * (cr[i] - 128);
            double b = y + 1.772 * (cb[i] - 128);
            out[i] = rgb(clamp(r), clamp(g), clamp(b));
        }
        return image(src.getWidth(), src.getHeight(), out);
    }

    /** Gray-world white balance: scales each channel so the channel means match. */
    public static BufferedImage whiteBalance(BufferedImage src) {
        requireImage(src, "whiteBalance");
        int[] px = pixels(src);
        double sr = 0, sg = 0, sb = 0;
        for (int p : px) {
            sr += red(p);
            sg += green(p);
            sb += blue(p);
        }
        double n = px.length;
        double mr = sr / n, mg = sg / n, mb = sb / n;
        double gray = (mr + mg + mb) / 3.0;
        double fr = mr == 0 ? 1.0 : gray / mr;
        double fg = mg == 0 ? 1.0 : gray / mg;
        double fb = mb == 0 ? 1.0 : gray / mb;
        int[] out = new int[px.length];
        for (int i = 0; i < px.length; i++) {
            out[i] = rgb(clamp(red(px[i]) * fr), clamp(green(px[i]) * fg), clamp(blue(px[i]) * fb));
        }
        return image(src.getWidth(), src.getHeight(), out);
    }

    /** Luma grayscale. The result stays three-channel so later color operations still apply. */
    public static BufferedImage grayscale(BufferedImage src) {
        requireImage(src, "grayscale");
        int[] px = pixels(src);
        int[] out = new int[px.length];
        for (int i = 0; i < px.length; i++) {
            int y = clamp(0.299 * red(px[i]) + 0.587 * green(px[i]) + 0.114 * blue(px[i]));
            out[i] = rgb(y, y, y);
        }
        return image(src.getWidth(), src.getHeight(), out);
    }

    /** Adds {@code offset} to every channel. */
    public static BufferedImage adjustBrightness(BufferedImage src, double offset) {
        requireImage(src, "adjustBrightness");
        int[] px = pixels(src);
        int[] out = new int[px.length];
        for (int i = 0; i < px.length; i++) {
            out[i] = rgb(clamp(red(px[i]) + offset), clamp(green(px[i]) + offset), clamp(blue(px[i]) + offset));
        }
        return image(src.getWidth(), src.getHeight(), out);
    }

    /** Multiplies every channel by {@code gain}. */
    public static BufferedImage adjustContrast(BufferedImage src, double gain) {
        requireImage(src, "adjustContrast");
        int[] px = pixels(src);
        int[] out = new int[px.length];
        for (int i = 0; i < px.length; i++) {
            out[i] = rgb(clamp(red(px[i]) * gain), clamp(green(px[i]) * gain), clamp(blue(px[i]) * gain));
        }
        return image(src.getWidth(), src.getHeight(), out);
    }

    /** Scales HSB saturation by {@code factor}, saturating at 1. */
    public static BufferedImage adjustSaturation(BufferedImage src, double factor) {
        requireImage(src, "adjustSaturation");
        int[] px = pixels(src);
        int[] out = new int[px.length];
        float[] hsb = new float[3];
        for (int i = 0; i < px.length; i++) {
            Color.RGBtoHSB(red(px[i]), green(px[i]), blue(px[i]), hsb);
            float s = (float) Math.max(0.0, Math.min(1.0, hsb[1] * factor));
            out[i] = Color.HSBtoRGB(hsb[0], s, hsb[2]) & 0xFFFFFF;
        }
        return image(src.getWidth(), src.getHeight(), out);
    }

    /** Rotates hue by {@code degrees}, wrapping around the color wheel. */
    public static BufferedImage adjustHue(BufferedImage src, int degrees) {
        requireImage(src, "adjustHue");
        int[] px = pixels(src);
        int[] out = new int[px.length];
        float[] hsb = new float[3];
        float shift = degrees / 360f;
        for (int i = 0; i < px.length; i++) {
            Color.RGBtoHSB(red(px[i]), green(px[i]), blue(px[i]), hsb);
            float h = hsb[0] + shift;
            h -= (float) Math.floor(h);
            out[i] = Color.HSBtoRGB(h, hsb[1], hsb[2]) & 0xFFFFFF;
        }
        return image(src.getWidth(), src.getHeight(), out);
    }

    // ---------------------------------------------------------------- noise and filters

    /** Adds per-channel Gaussian noise {@code N(mean, stdev)} drawn from {@code rng}. */
    public static BufferedImage injectNoise(BufferedImage src, double mean, double stdev, Random rng) {
        requireImage(src, "injectNoise");
        if (stdev < 0) throw new TransformException("injectNoise: stdev must be >= 0, got " + stdev);
        int[] px = pixels(src);
        int[] out = new int[px.length];
        for (int i = 0; i < px.length; i++) {
            double r = red(px[i]) + mean + stdev * rng.nextGaussian();
            double g = green(px[i]) + mean + stdev * rng.nextGaussian();
            double b = blue(px[i]) + mean + stdev * rng.nextGaussian();
            out[i] = rgb(clamp(r), clamp(g), clamp(b));
        }
        return image(src.getWidth(), src.getHeight(), out);
    }

    /** Box blur with a square {@code kernel x kernel} window; edges are clamped. */
    public static BufferedImage blur(BufferedImage src, int kernel) {
        requireImage(src, "blur");
        if (kernel < 1) throw new TransformException("blur: kernel must be >= 1, got " + kernel);
        int w = src.getWidth();
        int h = src.getHeight();
        int[] px = pixels(src);
        int radius = kernel / 2;
        int[] tmp = boxPass(px, w, h, radius, true);
        int[] out = boxPass(tmp, w, h, radius, false);
        return image(w, h, out);
    }

    /** 3x3 Laplacian sharpen ({@code 0 -1 0 / -1 5 -1 / 0 -1 0}). */
    public static BufferedImage sharpen(BufferedImage src) {
        requireImage(src, "sharpen");
        int w = src.getWidth();
        int h = src.getHeight();
        int[] px = pixels(src);
        int[] out = new int[px.length];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int c = px[y * w + x];
                int up = px[Math.max(0, y - 1) * w + x];
                int down = px[Math.min(h - 1, y + 1) * w + x];
                int left = px[y * w + Math.max(0, x - 1)];
                int right = px[y * w + Math.min(w - 1, x + 1)];
                int r = 5 * red(c) - red(up) - red(down) - red(left) - red(right);
                int g = 5 * green(c) - green(up) - green(down) - green(left) - green(right);
                int b = 5 * blue(c) - blue(up) - blue(down) - blue(left) - blue(right);
                out[y * w + x] = rgb(clamp(r), clamp(g), clamp(b));
            }
        }
        return image(w, h, out);
    }

    /**
     * Blacks out one rectangle whose height and width are drawn from the given ranges and whose
     * position is drawn uniformly; the rectangle is capped at the image size.
     */
    public static BufferedImage randomErase(BufferedImage src, int minH, int maxH, int minW, int maxW, Random rng) {
        requireImage(src, "randomErase");
        if (minH > maxH || minW > maxW) {
            throw new TransformException("randomErase: minimums cannot exceed maximums");
        }
        int w = src.getWidth();
        int h = src.getHeight();
        int eraseH = Math.min(h, Randoms.uniformInt(rng, minH, maxH));
        int eraseW = Math.min(w, Randoms.uniformInt(rng, minW, maxW));
        int y0 = Randoms.uniformInt(rng, 0, h - eraseH);
        int x0 = Randoms.uniformInt(rng, 0, w - eraseW);
        int[] out = pixels(src);
        for (int y = y0; y < y0 + eraseH; y++) {
            for (int x = x0; x < x0 + eraseW; x++) out[y * w + x] = 0;
        }
        return image(w, h, out);
    }

    // ---------------------------------------------------------------- helpers

    /** Copies {@code src} into a fresh {@code TYPE_INT_RGB} image. */
    public static BufferedImage toRgb(BufferedImage src) {
        requireImage(src, "toRgb");
        return image(src.getWidth(), src.getHeight(), pixels(src));
    }

    private static BufferedImage rotateInto(BufferedImage src, double rad, int outW, int outH) {
        BufferedImage out = new BufferedImage(outW, outH, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = out.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            AffineTransform at = new AffineTransform();
            at.translate(outW / 2.0, outH / 2.0);
            at.rotate(-rad);
            at.translate(-src.getWidth() / 2.0, -src.getHeight() / 2.0);
            g.drawImage(src, at, null);
        } finally {
            g.dispose();
        }
        return out;
    }

    private static int[] largestInnerRect(int width, int height, double rad) {
        double sin = Math.abs(Math.sin(rad));
        double cos = Math.abs(Math.cos(rad));
        if (sin < 1e-10) return new int[] {width, height};
        boolean widthLonger = width >= height;
        double longSide = widthLonger ? width : height;
        double shortSide = widthLonger ? height : width;
        double wr;
        double hr;
        if (shortSide <= 2.0 * sin * cos * longSide || Math.abs(sin - cos) < 1e-10) {
            double x = 0.5 * shortSide;
            if (widthLonger) {
                wr = x / sin;
                hr = x / cos;
            } else {
                wr = x / cos;
                hr = x / sin;
            }
        } else {
            double cos2a = cos * cos - sin * sin;
            wr = (width * cos - height * sin) / cos2a;
            hr = (height * cos - width * sin) / cos2a;
        }
        return new int[] {(int) wr, (int) hr};
    }

    private static int[] boxPass(int[] in, int w, int h, int radius, boolean horizontal) {
        int[] out = new int[in.length];
        int window = 2 * radius + 1;
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int sr = 0, sg = 0, sb = 0;
                for (int k = -radius; k <= radius; k++) {
                    int sx = horizontal ? Math.min(w - 1, Math.max(0, x + k)) : x;
                    int sy = horizontal ? y : Math.min(h - 1, Math.max(0, y + k));
                    int p = in[sy * w + sx];
                    sr += red(p);
                    sg += green(p);
                    sb += blue(p);
                }
                out[y * w + x] = rgb(clamp((double) sr / window), clamp((double) sg / window), clamp((double) sb / window));
            }
        }
        return out;
    }

    private static void requireImage(BufferedImage src, String op) {
        if (src == null || src.getWidth() < 1 || src.getHeight() < 1) {
            throw new TransformException(op + ": image is empty");
        }
    }

    private static int[] pixels(BufferedImage src) {
        return src.getRGB(0, 0, src.getWidth(), src.getHeight(), null, 0, src.getWidth());
    }

    private static BufferedImage image(int w, int h, int[] rgb) {
        BufferedImage out = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
        out.setRGB(0, 0, w, h, rgb, 0, w);
        return out;
    }

    private static int red(int p) { return (p >> 16) & 0xFF; }
    private static int green(int p) { return (p >> 8) & 0xFF; }
    private static int blue(int p) { return p & 0xFF; }
    private static int rgb(int r, int g, int b) { return (r << 16) | (g << 8) | b; }

    private static int clamp(double v) {
        if (v <= 0) return 0;
        if (v >= 255) return 255;
        return (int) Math.round(v);
    }
}

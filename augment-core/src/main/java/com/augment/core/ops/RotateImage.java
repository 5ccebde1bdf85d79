package com.augment.core.ops;

import com.augment.core.Image;
import com.augment.core.Operation;
import com.augment.core.OperationBuildException;
import com.augment.transforms.Randoms;
import com.augment.transforms.Transforms;

import java.util.Random;

/** Rotates by an angle drawn from {@code [minAngle, maxAngle)} degrees. */
public final class RotateImage implements Operation {

    public enum Mode {
        /** grow the canvas to keep every pixel */
        EXPAND("no crop"),
        /** crop to the largest rectangle without fill */
        CROP("crop"),
        /** keep the canvas, fill uncovered corners */
        FILL("fill-in");

        private final String label;

        Mode(String label) { this.label = label; }

        static Mode fromCode(int code) {
            Mode[] modes = values();
            if (code < 0 || code >= modes.length) {
                throw OperationBuildException.invalidValue("rotate", "rotation type must be 0, 1 or 2, got " + code);
            }
            return modes[code];
        }
    }

    private final double minAngle;
    private final double maxAngle;
    private final Mode mode;

    public RotateImage(double minAngle, double maxAngle, Mode mode) {
        Params.requireOrdered("rotate", minAngle, maxAngle, "angle");
        this.minAngle = minAngle;
        this.maxAngle = maxAngle;
        this.mode = mode;
    }

    static RotateImage fromCode(double minAngle, double maxAngle, double code) {
        return new RotateImage(minAngle, maxAngle, Mode.fromCode(Params.whole("rotate", code, "rotation type")));
    }

    @Override
    public void apply(Image image, Random rng) {
        double angle = Randoms.uniformDouble(rng, minAngle, maxAngle);
        switch (mode) {
            case EXPAND -> image.setData(Transforms.rotateExpand(image.data(), angle));
            case CROP -> image.setData(Transforms.rotateCrop(image.data(), angle));
            case FILL -> image.setData(Transforms.rotateFill(image.data(), angle));
        }
        image.logOperation("RotateImage (" + mode.label + "): " + Params.fmt(angle));
    }

    @Override
    public String name() { return "RotateImage"; }
}

package com.augment.core.ops;

import com.augment.core.OperationBuildException;

import java.util.Locale;

/** Argument checks and formatting shared by the built-in operations. */
final class Params {
    private Params() {}

    static void requireOrdered(String op, double min, double max, String what) {
        if (min > max) {
            throw OperationBuildException.invalidValue(op, "minimum " + what + " cannot be greater than maximum " + what
                + " (" + fmt(min) + " > " + fmt(max) + ")");
        }
    }

    static void requireNonNegative(String op, double value, String what) {
        if (value < 0) throw OperationBuildException.invalidValue(op, what + " must be >= 0, got " + fmt(value));
    }

    static void requirePositive(String op, double value, String what) {
        if (value <= 0) throw OperationBuildException.invalidValue(op, what + " must be > 0, got " + fmt(value));
    }

    static int whole(String op, double value, String what) {
        if (value != Math.rint(value) || Math.abs(value) > Integer.MAX_VALUE) {
            throw OperationBuildException.invalidValue(op, what + " must be a whole number, got " + value);
        }
        return (int) value;
    }

    static String fmt(double v) {
        return String.format(Locale.ROOT, "%.6f", v);
    }
}

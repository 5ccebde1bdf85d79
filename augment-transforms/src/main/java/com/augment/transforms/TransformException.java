package com.augment.transforms;

/** Raised when a transform cannot be applied to a particular image (bounds, empty input, singular matrix). */
public class TransformException extends RuntimeException {
    public TransformException(String message) {
        super(message);
    }

    public TransformException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.augment.core;

import java.io.IOException;

/** Persists a finished image. Only ever called from the single consumer thread. */
@FunctionalInterface
public interface ImageSink {
    void write(Image image) throws IOException;
}

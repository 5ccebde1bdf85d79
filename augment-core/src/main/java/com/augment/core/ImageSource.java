package com.augment.core;

import java.awt.image.BufferedImage;
import java.io.IOException;

/** Loads the pixels behind a task identifier. Called concurrently from every producer thread. */
@FunctionalInterface
public interface ImageSource {
    BufferedImage read(String identifier) throws IOException;
}

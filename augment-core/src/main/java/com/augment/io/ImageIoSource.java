package com.augment.io;

import com.augment.core.ImageSource;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/** Reads identifiers as file paths through {@link ImageIO}. */
public final class ImageIoSource implements ImageSource {

    @Override
    public BufferedImage read(String identifier) throws IOException {
        Path path = Path.of(identifier);
        if (!Files.isRegularFile(path)) throw new IOException("Failed to load image from " + path + ": not a file");
        BufferedImage img = ImageIO.read(path.toFile());
        if (img == null) throw new IOException("Failed to load image from " + path + ": unsupported or corrupt");
        return img;
    }
}

package com.augment.io;

import com.augment.core.Image;
import com.augment.core.ImageSink;

import javax.imageio.ImageIO;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * Writes each image to {@code <outputDir>/<base>_<id>.<format>}, where {@code base} is the source
 * file name without directory or extension. With {@code saveHistory} a {@code <base>_<id>.txt}
 * sidecar lists the applied operations, one per line.
 */
public final class ImageIoSink implements ImageSink {
    private final Path outputDir;
    private final String format;
    private final boolean saveHistory;

    public ImageIoSink(Path outputDir, String format, boolean saveHistory) {
        this.outputDir = Objects.requireNonNull(outputDir, "outputDir");
        this.format = Objects.requireNonNull(format, "format").toLowerCase(Locale.ROOT);
        this.saveHistory = saveHistory;
        if (!ImageIO.getImageWritersByFormatName(this.format).hasNext()) {
            throw new IllegalArgumentException("No ImageIO writer for format '" + format + "'");
        }
    }

    public ImageIoSink(Path outputDir) {
        this(outputDir, "png", false);
    }

    @Override
    public void write(Image image) throws IOException {
        Files.createDirectories(outputDir);
        String stem = baseName(image.name()) + "_" + image.id();
        Path target = outputDir.resolve(stem + "." + format);
        if (!ImageIO.write(image.data(), format, target.toFile())) {
            throw new IOException("No writer accepted " + image + " as " + format);
        }
        if (saveHistory) {
            Files.write(outputDir.resolve(stem + ".txt"), image.history(), StandardCharsets.UTF_8);
        }
    }

    public Path outputDir() { return outputDir; }

    /**
     * {@code "in/cat.png#3"} becomes {@code "cat"}: the iteration suffix, directories and the last
     * extension are dropped. Falls back to {@code "image"} when nothing is left.
     */
    public static String baseName(String imageName) {
        String s = imageName == null ? "" : imageName;
        int hash = s.lastIndexOf('#');
        if (hash >= 0) s = s.substring(0, hash);
        int slash = Math.max(s.lastIndexOf('/'), s.lastIndexOf('\\'));
        if (slash >= 0) s = s.substring(slash + 1);
        int dot = s.lastIndexOf('.');
        if (dot > 0) s = s.substring(0, dot);
        return s.isEmpty() ? "image" : s;
    }
}

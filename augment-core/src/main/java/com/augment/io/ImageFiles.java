package com.augment.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/** Input discovery. */
public final class ImageFiles {
    public static final Set<String> EXTENSIONS = Set.of("png", "jpg", "jpeg", "bmp", "gif");

    private ImageFiles() {}

    /** Regular files directly under {@code dir} with an image extension, sorted by path. */
    public static List<Path> list(Path dir) throws IOException {
        if (!Files.isDirectory(dir)) throw new IOException("Not a directory: " + dir);
        try (Stream<Path> entries = Files.list(dir)) {
            return entries
                .filter(Files::isRegularFile)
                .filter(ImageFiles::isImage)
                .sorted()
                .collect(Collectors.toList());
        }
    }

    public static boolean isImage(Path path) {
        String file = path.getFileName().toString();
        int dot = file.lastIndexOf('.');
        return dot > 0 && EXTENSIONS.contains(file.substring(dot + 1).toLowerCase(Locale.ROOT));
    }
}

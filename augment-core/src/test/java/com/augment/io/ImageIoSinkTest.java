package com.augment.io;

import com.augment.core.Image;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class ImageIoSinkTest {

    @TempDir
    Path tmp;

    private static Image image(String name) {
        BufferedImage img = new BufferedImage(3, 2, BufferedImage.TYPE_INT_RGB);
        img.setRGB(1, 1, 0x123456);
        return new Image(img, name);
    }

    @Test
    void baseNameDropsIterationDirectoriesAndExtension() {
        assertEquals("cat", ImageIoSink.baseName("in/photos/cat.png#3"));
        assertEquals("cat.tar", ImageIoSink.baseName("cat.tar.gz"));
        assertEquals("dog", ImageIoSink.baseName("C:\\imgs\\dog.JPG#0"));
        assertEquals(".hidden", ImageIoSink.baseName(".hidden"));
        assertEquals("image", ImageIoSink.baseName("#1"));
        assertEquals("image", ImageIoSink.baseName(null));
    }

    @Test
    void writesImageIntoCreatedDirectory() throws IOException {
        Path out = tmp.resolve("nested/out");
        Image img = image("src/cat.png#0");
        new ImageIoSink(out).write(img);

        Path file = out.resolve("cat_" + img.id() + ".png");
        assertTrue(Files.isRegularFile(file));
        BufferedImage back = ImageIO.read(file.toFile());
        assertEquals(3, back.getWidth());
        assertEquals(0x123456, back.getRGB(1, 1) & 0xFFFFFF);
        assertFalse(Files.exists(out.resolve("cat_" + img.id() + ".txt")));
    }

    @Test
    void historySidecarListsOperations() throws IOException {
        Image img = image("a/b.jpg#1");
        img.logOperation("ReflectImage: Vertical");
        img.logOperation("ToGrayscale");
        new ImageIoSink(tmp, "bmp", true).write(img);

        assertTrue(Files.exists(tmp.resolve("b_" + img.id() + ".bmp")));
        assertEquals(List.of("ReflectImage: Vertical", "ToGrayscale"),
            Files.readAllLines(tmp.resolve("b_" + img.id() + ".txt"), StandardCharsets.UTF_8));
    }

    @Test
    void unknownFormatIsRejectedUpFront() {
        assertThrows(IllegalArgumentException.class, () -> new ImageIoSink(tmp, "nope", false));
    }

    @Test
    void sourceReadsWhatSinkWrote() throws IOException {
        Image img = image("x.png#0");
        new ImageIoSink(tmp).write(img);
        BufferedImage read = new ImageIoSource().read(tmp.resolve("x_" + img.id() + ".png").toString());
        assertEquals(2, read.getHeight());
    }

    @Test
    void sourceFailsOnMissingOrUndecodableFile() throws IOException {
        ImageIoSource source = new ImageIoSource();
        assertThrows(IOException.class, () -> source.read(tmp.resolve("missing.png").toString()));
        Path junk = Files.writeString(tmp.resolve("junk.png"), "not an image");
        IOException ex = assertThrows(IOException.class, () -> source.read(junk.toString()));
        assertTrue(ex.getMessage().contains("unsupported or corrupt"));
    }

    @Test
    void listsImagesSortedAndCaseInsensitive() throws IOException {
        Files.createFile(tmp.resolve("b.PNG"));
        Files.createFile(tmp.resolve("a.jpeg"));
        Files.createFile(tmp.resolve("notes.txt"));
        Files.createFile(tmp.resolve("c.gif"));
        Files.createDirectory(tmp.resolve("d.png"));
        List<Path> found = ImageFiles.list(tmp);
        assertEquals(List.of(tmp.resolve("a.jpeg"), tmp.resolve("b.PNG"), tmp.resolve("c.gif")), found);
        assertThrows(IOException.class, () -> ImageFiles.list(tmp.resolve("nope")));
    }
}

package com.augment.config;

import com.augment.core.OperationBuildException;
import com.augment.core.OperationRegistry;
import com.augment.core.OperationSpec;
import com.augment.core.Pipeline;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class AugmentConfigLoaderTest {

    @TempDir
    Path tmp;

    private static AugmentConfig parse(String json) throws IOException {
        return AugmentConfigLoader.load(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void readsEveryField() throws Exception {
        String json = """
        {
          "output_dir": "out",
          "input_dir": "images",
          "image_paths": ["a.png", "b.jpg"],
          "iterations": 3,
          "num_threads": 5,
          "queue_capacity": 16,
          "verbose": true,
          "seed": 42,
          "save_history": true,
          "output_format": "jpg",
          "progress_interval": 10,
          "pipeline": [
            { "name": "rotate", "params": [-10, 10, 1], "prob": 0.5 },
            { "name": "reflect" }
          ]
        }
        """;
        AugmentConfig c = parse(json);
        assertEquals(Path.of("out"), c.outputDir());
        assertEquals(Path.of("images"), c.inputDir());
        assertEquals(List.of("a.png", "b.jpg"), c.imagePaths());
        assertEquals(3, c.iterations());
        assertEquals(5, c.numThreads());
        assertEquals(16, c.queueCapacity());
        assertTrue(c.verbose());
        assertEquals(42L, c.seed());
        assertTrue(c.saveHistory());
        assertEquals("jpg", c.outputFormat());
        assertEquals(10, c.progressInterval());
        assertEquals(List.of(
            new OperationSpec("rotate", List.of(-10.0, 10.0, 1.0), 0.5),
            new OperationSpec("reflect", List.of(), 1.0)), c.pipeline());
    }

    @Test
    void appliesDefaultsAndClamps() throws Exception {
        String json = """
        {
          "output_dir": "out",
          "image_paths": ["a.png"],
          "iterations": 0,
          "num_threads": -2,
          "queue_capacity": 0,
          "pipeline": [ { "name": "reflect" } ]
        }
        """;
        AugmentConfig c = parse(json);
        assertEquals(1, c.iterations());
        assertEquals(1, c.numThreads());
        assertEquals(AugmentConfigLoader.DEFAULT_QUEUE_CAPACITY, c.queueCapacity());
        assertFalse(c.verbose());
        assertFalse(c.saveHistory());
        assertEquals("png", c.outputFormat());
        assertEquals(7, c.progressInterval());
        assertNull(c.inputDir());
    }

    @Test
    void missingRequiredFieldsFail() {
        ConfigurationException noOut = assertThrows(ConfigurationException.class, () -> parse("""
            { "image_paths": ["a.png"], "pipeline": [ { "name": "reflect" } ] }
            """));
        assertEquals("Missing required field: output_dir", noOut.getMessage());

        assertThrows(ConfigurationException.class, () -> parse("""
            { "output_dir": "o", "pipeline": [ { "name": "reflect" } ] }
            """));
        assertThrows(ConfigurationException.class, () -> parse("""
            { "output_dir": "o", "image_paths": ["a.png"], "pipeline": [] }
            """));
        assertThrows(ConfigurationException.class, () -> parse("""
            { "output_dir": "o", "image_paths": ["a.png"], "pipeline": [ { "prob": 0.5 } ] }
            """));
    }

    @Test
    void probabilityMustBeInUnitInterval() {
        ConfigurationException ex = assertThrows(ConfigurationException.class, () -> parse("""
            { "output_dir": "o", "image_paths": ["a.png"], "pipeline": [ { "name": "reflect", "prob": 1.5 } ] }
            """));
        assertTrue(ex.getMessage().contains("pipeline[0].prob"));
    }

    @Test
    void wrongTypesFail() {
        assertThrows(ConfigurationException.class, () -> parse("""
            { "output_dir": "o", "image_paths": ["a.png"], "iterations": "two", "pipeline": [ { "name": "reflect" } ] }
            """));
        assertThrows(ConfigurationException.class, () -> parse("""
            { "output_dir": "o", "image_paths": ["a.png"], "pipeline": [ { "name": "resize", "params": ["x", 1] } ] }
            """));
        assertThrows(ConfigurationException.class, () -> parse("""
            { "output_dir": "o", "image_paths": "a.png", "pipeline": [ { "name": "reflect" } ] }
            """));
    }

    @Test
    void malformedJsonIsAConfigurationError() {
        assertThrows(ConfigurationException.class, () -> parse("{ \"output_dir\": "));
        assertThrows(ConfigurationException.class, () -> parse("[1, 2]"));
    }

    @Test
    void missingFileIsAConfigurationError() {
        assertThrows(ConfigurationException.class, () -> AugmentConfigLoader.load(tmp.resolve("absent.json")));
    }

    @Test
    void buildsPipelineThroughRegistry() throws Exception {
        AugmentConfig c = parse("""
            { "output_dir": "o", "image_paths": ["a.png"], "seed": 5,
              "pipeline": [ { "name": "Reflect", "prob": 0.3 }, { "name": "blur image", "params": [3, 5] } ] }
            """);
        Pipeline p = c.buildPipeline(OperationRegistry.defaults());
        assertEquals(2, p.size());
        assertEquals(5L, p.baseSeed());
        assertEquals(0.3, p.entries().get(0).probability());
        assertEquals("BlurImage", p.entries().get(1).operation().name());
    }

    @Test
    void badOperationSurfacesAtPipelineBuild() throws Exception {
        AugmentConfig c = parse("""
            { "output_dir": "o", "image_paths": ["a.png"],
              "pipeline": [ { "name": "resize", "params": [0.5] } ] }
            """);
        assertThrows(OperationBuildException.class, () -> c.buildPipeline(OperationRegistry.defaults()));
    }

    @Test
    void resolvesDirectoryThenExplicitPaths() throws Exception {
        Path in = Files.createDirectory(tmp.resolve("in"));
        Files.createFile(in.resolve("z.png"));
        Files.createFile(in.resolve("y.jpg"));
        Files.createFile(in.resolve("readme.md"));
        Path config = tmp.resolve("run.json");
        Files.writeString(config, """
            { "output_dir": "o", "input_dir": "%s", "image_paths": ["extra.png"],
              "pipeline": [ { "name": "reflect" } ] }
            """.formatted(in.toString().replace("\\", "\\\\")));
        AugmentConfig c = AugmentConfigLoader.load(config);
        assertEquals(List.of(in.resolve("y.jpg").toString(), in.resolve("z.png").toString(), "extra.png"),
            c.resolveInputs());
    }
}

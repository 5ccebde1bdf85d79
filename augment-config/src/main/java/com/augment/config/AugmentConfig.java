package com.augment.config;

import com.augment.core.OperationRegistry;
import com.augment.core.OperationSpec;
import com.augment.core.Pipeline;
import com.augment.io.ImageFiles;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A validated run configuration. Instances come from {@link AugmentConfigLoader}; every numeric
 * field has already been defaulted and clamped.
 *
 * @param inputDir directory scanned for images, or {@code null}
 * @param imagePaths explicit inputs, appended after the scanned ones
 */
public record AugmentConfig(
    Path outputDir,
    Path inputDir,
    List<String> imagePaths,
    int iterations,
    int numThreads,
    int queueCapacity,
    boolean verbose,
    long seed,
    boolean saveHistory,
    String outputFormat,
    int progressInterval,
    List<OperationSpec> pipeline
) {
    public static final String PIPELINE_NAME = "augment";

    public AugmentConfig {
        Objects.requireNonNull(outputDir, "outputDir");
        Objects.requireNonNull(outputFormat, "outputFormat");
        imagePaths = List.copyOf(imagePaths);
        pipeline = List.copyOf(pipeline);
    }

    /** Same configuration with {@code verbose} forced on. */
    public AugmentConfig withVerbose(boolean verbose) {
        return new AugmentConfig(outputDir, inputDir, imagePaths, iterations, numThreads, queueCapacity, verbose,
            seed, saveHistory, outputFormat, progressInterval, pipeline);
    }

    /**
     * Builds every configured operation through {@code registry}.
     *
     * @throws com.augment.core.OperationBuildException for the first entry that cannot be built
     */
    public Pipeline buildPipeline(OperationRegistry registry) {
        return Pipeline.configure(PIPELINE_NAME, pipeline, seed, registry);
    }

    /** The scanned directory contents (sorted) followed by the explicit paths. */
    public List<String> resolveInputs() throws IOException {
        List<String> out = new ArrayList<>();
        if (inputDir != null) {
            for (Path p : ImageFiles.list(inputDir)) out.add(p.toString());
        }
        out.addAll(imagePaths);
        return out;
    }
}

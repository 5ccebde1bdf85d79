package com.augment.core;

import com.augment.metrics.Metrics;
import com.augment.metrics.MetricsRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Ordered, probabilistic sequence of operations.
 *
 * <p>{@link #apply(Image, long)} seeds one {@link Random} and walks the entries in configured order.
 * For each entry it draws one value in {@code [0, 1)} and runs the operation when the draw is below
 * the entry's probability, passing the same generator on so that every parameter the operation
 * samples comes from the same stream. The sequence of decisions and parameters is therefore a pure
 * function of (entries, seed). No state is shared between calls, so any number of threads may
 * apply one pipeline concurrently.
 *
 * <p>Operation failures are not caught here; they propagate to the caller.
 */
public final class Pipeline {
    private static final Logger log = LoggerFactory.getLogger(Pipeline.class);

    private final String name;
    private final long baseSeed;
    private final List<PipelineEntry> entries;

    private Pipeline(String name, long baseSeed, List<PipelineEntry> entries) {
        this.name = Objects.requireNonNull(name, "name");
        this.baseSeed = baseSeed;
        this.entries = List.copyOf(entries);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Builds every {@link OperationSpec} through {@code registry}, in order.
     *
     * @throws OperationBuildException for the first entry that cannot be built
     */
    public static Pipeline configure(String name, List<OperationSpec> specs, long seed, OperationRegistry registry) {
        Objects.requireNonNull(specs, "specs");
        Objects.requireNonNull(registry, "registry");
        Builder b = builder(name).seed(seed);
        for (OperationSpec spec : specs) b.add(registry.build(spec));
        return b.build();
    }

    public static final class Builder {
        private final String name;
        private long seed;
        private final List<PipelineEntry> entries = new ArrayList<>();

        public Builder(String name) { this.name = name; }

        public Builder seed(long seed) { this.seed = seed; return this; }
        public Builder add(PipelineEntry entry) { entries.add(Objects.requireNonNull(entry, "entry")); return this; }
        public Builder add(Operation op, double probability) { return add(new PipelineEntry(op, probability)); }
        public Pipeline build() { return new Pipeline(name, seed, entries); }
    }

    /** Applies the pipeline with a seed derived from the base seed and the image's name. */
    public void apply(Image image) {
        Objects.requireNonNull(image, "image");
        apply(image, seedFor(image.name()));
    }

    /**
     * Applies the pipeline with an explicit seed. Two images applied with the same seed get the same
     * decisions and the same sampled parameters, which keeps paired inputs (e.g. stereo views) aligned.
     */
    public void apply(Image image, long seed) {
        Objects.requireNonNull(image, "image");
        MetricsRecorder rec = Metrics.recorder();
        Random rng = new Random(seed);

        for (PipelineEntry entry : entries) {
            Operation op = entry.operation();
            double draw = rng.nextDouble();
            if (draw >= entry.probability()) {
                rec.onOperationSkipped(name, op.name());
                continue;
            }
            long t0 = System.nanoTime();
            try {
                op.apply(image, rng);
            } catch (RuntimeException ex) {
                rec.onOperationFailed(name, op.name(), ex);
                log.debug("'{}' failed at {} on {}", name, op.name(), image.name(), ex);
                throw ex;
            }
            rec.onOperationApplied(name, op.name(), System.nanoTime() - t0);
        }
    }

    /** Applies the same seed (derived from {@code first}'s name) to both images. */
    public void applyPair(Image first, Image second) {
        Objects.requireNonNull(first, "first");
        Objects.requireNonNull(second, "second");
        long seed = seedFor(first.name());
        apply(first, seed);
        apply(second, seed);
    }

    /** The seed {@link #apply(Image)} uses for an image called {@code imageName}. */
    public long seedFor(String imageName) {
        return Seeds.derive(baseSeed, imageName);
    }

    public String name() { return name; }
    public long baseSeed() { return baseSeed; }
    public List<PipelineEntry> entries() { return entries; }
    public int size() { return entries.size(); }
}

package com.augment.cli;

import com.augment.config.AugmentConfig;
import com.augment.config.AugmentConfigLoader;
import com.augment.config.ConfigurationException;
import com.augment.core.ImageSink;
import com.augment.core.ImageSource;
import com.augment.core.OperationRegistry;
import com.augment.core.Pipeline;
import com.augment.core.PipelineEntry;
import com.augment.core.RunReport;
import com.augment.core.Task;
import com.augment.core.WorkerPool;
import com.augment.io.ImageIoSink;
import com.augment.io.ImageIoSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * One augmentation run: configuration, a built pipeline and the task list, executed on a fresh
 * {@link WorkerPool}.
 *
 * <p>Everything that can be rejected up front (config, operation arguments, inputs) is checked by
 * {@link #prepare()} before a single thread starts.
 */
public final class AugmentSession {
    private static final Logger log = LoggerFactory.getLogger(AugmentSession.class);

    /** What a run would do. */
    public record Plan(Pipeline pipeline, List<String> inputs, List<Task> tasks) {
        public Plan {
            inputs = List.copyOf(inputs);
            tasks = List.copyOf(tasks);
        }
    }

    private final AugmentConfig config;
    private final OperationRegistry registry;

    public AugmentSession(AugmentConfig config, OperationRegistry registry) {
        this.config = Objects.requireNonNull(config, "config");
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public static AugmentSession fromFile(Path configPath) throws IOException {
        return new AugmentSession(AugmentConfigLoader.load(configPath), OperationRegistry.defaults());
    }

    public AugmentConfig config() { return config; }

    /**
     * Builds the pipeline and enumerates tasks.
     *
     * @throws com.augment.core.OperationBuildException if an operation cannot be built
     * @throws ConfigurationException if no input images were found
     * @throws IOException if the input directory cannot be listed
     */
    public Plan prepare() throws IOException {
        Pipeline pipeline = config.buildPipeline(registry);
        List<String> inputs = config.resolveInputs();
        if (inputs.isEmpty()) throw new ConfigurationException("No input images found");
        List<Task> tasks = Task.enumerate(inputs, config.iterations(), config.seed());
        if (config.verbose()) {
            log.info("Pipeline '{}' with {} operation(s), seed {}", pipeline.name(), pipeline.size(), pipeline.baseSeed());
            log.info("{} input image(s) x {} iteration(s) = {} task(s)", inputs.size(), config.iterations(), tasks.size());
        }
        return new Plan(pipeline, inputs, tasks);
    }

    /** Logs the plan without touching any image. */
    public Plan dryRun() throws IOException {
        Plan plan = prepare();
        log.info("Dry run: {} task(s) -> {}", plan.tasks().size(), config.outputDir());
        for (PipelineEntry e : plan.pipeline().entries()) {
            log.info("  {} (p={})", e.operation().name(), e.probability());
        }
        log.info("Workers: {}, queue capacity: {}", config.numThreads(), config.queueCapacity());
        return plan;
    }

    public RunReport run() throws IOException, InterruptedException {
        return run(new ImageIoSource(), new ImageIoSink(config.outputDir(), config.outputFormat(), config.saveHistory()));
    }

    public RunReport run(ImageSource source, ImageSink sink) throws IOException, InterruptedException {
        Plan plan = prepare();
        WorkerPool pool = WorkerPool.builder()
            .workers(config.numThreads())
            .queueCapacity(config.queueCapacity())
            .verbose(config.verbose())
            .progressInterval(config.progressInterval())
            .build();
        RunReport report = pool.run(plan.tasks(), plan.pipeline(), source, sink);
        log.info("Processed {} of {} task(s), saved {} image(s) in {} ms",
            report.processed(), report.submitted(), report.persisted(), report.elapsed().toMillis());
        if (!report.isClean()) {
            log.warn("{} task(s) failed, {} write(s) failed", report.failedTasks(), report.failedWrites());
        }
        return report;
    }
}

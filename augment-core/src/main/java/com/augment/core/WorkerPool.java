package com.augment.core;

import com.augment.metrics.Metrics;
import com.augment.metrics.MetricsRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fans tasks out to {@code workerCount} producer threads and fans the finished images in to one
 * consumer thread that hands them to the sink.
 *
 * <p>Both hops go through a {@link BoundedQueue} of {@code queueCapacity}, so at most
 * {@code 2 * queueCapacity + workerCount} tasks and images are alive at once however large the
 * input is. The caller's thread enqueues while the producers are already draining.
 *
 * <p>Shutdown always runs in this order: close the task queue after the last push, wait for every
 * producer, close the result queue, wait for the consumer. The pool is the only party that closes
 * either queue.
 *
 * <p>A task that fails to load or transform is logged, counted and dropped; so is an artifact the
 * sink cannot write. Nothing is retried. A pool instance runs once.
 *
 * <p>If every producer thread has exited, the task queue is closed so the enqueuing caller cannot
 * block on it; tasks that could no longer be enqueued are counted as failed.
 */
public final class WorkerPool {
    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    public static final int DEFAULT_PROGRESS_INTERVAL = 7;

    public enum State {
        IDLE,
        ENQUEUING,
        RUNNING,
        DRAINING,
        COMPLETED
    }

    private final int workerCount;
    private final int queueCapacity;
    private final boolean verbose;
    private final int progressInterval;

    private final AtomicBoolean started = new AtomicBoolean();
    private volatile State state = State.IDLE;

    private final AtomicLong processed = new AtomicLong();
    private final AtomicLong persisted = new AtomicLong();
    private final AtomicLong failedTasks = new AtomicLong();
    private final AtomicLong failedWrites = new AtomicLong();

    public WorkerPool(int workerCount, int queueCapacity) {
        this(builder().workers(workerCount).queueCapacity(queueCapacity));
    }

    private WorkerPool(Builder b) {
        if (b.workerCount < 1) throw new IllegalArgumentException("workerCount must be >= 1, got " + b.workerCount);
        if (b.queueCapacity < 1) throw new IllegalArgumentException("queueCapacity must be >= 1, got " + b.queueCapacity);
        if (b.progressInterval < 1) {
            throw new IllegalArgumentException("progressInterval must be >= 1, got " + b.progressInterval);
        }
        this.workerCount = b.workerCount;
        this.queueCapacity = b.queueCapacity;
        this.verbose = b.verbose;
        this.progressInterval = b.progressInterval;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int workerCount = Runtime.getRuntime().availableProcessors();
        private int queueCapacity = 128;
        private boolean verbose;
        private int progressInterval = DEFAULT_PROGRESS_INTERVAL;

        public Builder workers(int n) { this.workerCount = n; return this; }
        public Builder queueCapacity(int n) { this.queueCapacity = n; return this; }
        public Builder verbose(boolean b) { this.verbose = b; return this; }
        public Builder progressInterval(int n) { this.progressInterval = n; return this; }
        public WorkerPool build() { return new WorkerPool(this); }
    }

    /**
     * Processes every task and blocks until the last artifact has been handed to the sink.
     *
     * <p>Each task is applied with {@link Task#seed()}, i.e. the base seed given to
     * {@link Task#enumerate}; {@link Pipeline#baseSeed()} is not consulted. A mismatch between the two
     * is logged once as a warning.
     *
     * @throws IllegalStateException if this pool has already run
     * @throws InterruptedException if the calling thread is interrupted while enqueuing or joining
     */
    public RunReport run(List<Task> tasks, Pipeline pipeline, ImageSource source, ImageSink sink)
            throws InterruptedException {
        Objects.requireNonNull(tasks, "tasks");
        Objects.requireNonNull(pipeline, "pipeline");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(sink, "sink");
        if (!started.compareAndSet(false, true)) throw new IllegalStateException("WorkerPool has already run");

        if (tasks.isEmpty()) {
            if (verbose) log.warn("No tasks to process");
            state = State.COMPLETED;
            return RunReport.empty();
        }

        if (verbose) {
            log.info("Launching {} producer threads", workerCount);
            log.info("Total tasks to process: {}", tasks.size());
        }

        Task first = tasks.get(0);
        if (first.seed() != pipeline.seedFor(first.name())) {
            log.warn("Task seeds were not derived from pipeline '{}' base seed {}; using the task seeds",
                pipeline.name(), pipeline.baseSeed());
        }

        long t0 = System.nanoTime();
        BoundedQueue<Task> taskQueue = new BoundedQueue<>(queueCapacity);
        BoundedQueue<Image> resultQueue = new BoundedQueue<>(queueCapacity);

        ExecutorService producerPool = Executors.newFixedThreadPool(workerCount, named("augment-producer"));
        ExecutorService consumerPool = Executors.newSingleThreadExecutor(named("augment-consumer"));
        try {
            Future<?> consumer = consumerPool.submit(() -> consume(resultQueue, sink));
            List<Future<?>> producers = new ArrayList<>(workerCount);
            AtomicInteger live = new AtomicInteger(workerCount);
            for (int i = 0; i < workerCount; i++) {
                int workerId = i;
                producers.add(producerPool.submit(() -> {
                    try {
                        produce(workerId, taskQueue, resultQueue, pipeline, source);
                    } finally {
                        if (live.decrementAndGet() == 0) taskQueue.close();
                    }
                }));
            }

            state = State.ENQUEUING;
            try {
                long dropped = 0;
                for (Task task : tasks) {
                    if (!taskQueue.push(task)) dropped++;
                }
                if (dropped > 0) {
                    failedTasks.addAndGet(dropped);
                    log.error("All producers exited early; {} task(s) were not processed", dropped);
                }
            } finally {
                taskQueue.close();
                state = State.RUNNING;
                try {
                    join(producers);
                    int stranded = taskQueue.size();
                    if (stranded > 0) {
                        failedTasks.addAndGet(stranded);
                        log.error("{} queued task(s) were left when the producers exited", stranded);
                    }
                } finally {
                    resultQueue.close();
                    state = State.DRAINING;
                    join(List.of(consumer));
                }
            }
        } finally {
            producerPool.shutdownNow();
            consumerPool.shutdownNow();
        }
        state = State.COMPLETED;

        RunReport report = new RunReport(tasks.size(), processed.get(), persisted.get(), failedTasks.get(),
            failedWrites.get(), Duration.ofNanos(System.nanoTime() - t0));
        if (verbose) {
            log.info("Augmentation complete: {} saved, {} task failures, {} write failures in {} ms",
                report.persisted(), report.failedTasks(), report.failedWrites(), report.elapsed().toMillis());
        }
        return report;
    }

    public State state() { return state; }

    private void produce(int workerId, BoundedQueue<Task> tasks, BoundedQueue<Image> results,
                         Pipeline pipeline, ImageSource source) {
        MetricsRecorder rec = Metrics.recorder();
        try {
            Optional<Task> next;
            while ((next = tasks.pop()).isPresent()) {
                Task task = next.get();
                Image image;
                try {
                    image = new Image(Objects.requireNonNull(source.read(task.identifier()), "source returned null"),
                        task.name());
                    pipeline.apply(image, task.seed());
                } catch (Throwable ex) {
                    failedTasks.incrementAndGet();
                    rec.onTaskFailed(ex);
                    log.warn("producer-{} failed to process {}: {}", workerId, task.name(), ex.getMessage(), ex);
                    continue;
                }
                processed.incrementAndGet();
                // the result queue stays open until every producer has returned
                results.push(image);
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            log.warn("producer-{} interrupted", workerId);
        }
    }

    private void consume(BoundedQueue<Image> results, ImageSink sink) {
        MetricsRecorder rec = Metrics.recorder();
        try {
            Optional<Image> next;
            while ((next = results.pop()).isPresent()) {
                Image image = next.get();
                try {
                    sink.write(image);
                } catch (Throwable ex) {
                    failedWrites.incrementAndGet();
                    rec.onPersistFailed(ex);
                    log.error("Failed to save image {}: {}", image.name(), ex.getMessage(), ex);
                    continue;
                }
                rec.onArtifactPersisted();
                long saved = persisted.incrementAndGet();
                if (verbose && saved % progressInterval == 0) log.info("Saved {} images...", saved);
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            log.warn("consumer interrupted");
        }
    }

    /** Waits for every future, then rethrows the first failure. */
    private static void join(List<Future<?>> futures) throws InterruptedException {
        Throwable first = null;
        for (Future<?> f : futures) {
            try {
                f.get();
            } catch (ExecutionException e) {
                if (first == null) first = e.getCause();
            }
        }
        if (first != null) throw new IllegalStateException("worker thread died", first);
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + seq.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
    }
}

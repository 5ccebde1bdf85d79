package com.augment.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.concurrent.TimeUnit;

public final class SimpleMetricsRecorder implements MetricsRecorder {
    private final MeterRegistry registry;

    public SimpleMetricsRecorder() {
        this(new SimpleMeterRegistry());
    }

    public SimpleMetricsRecorder(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void onOperationApplied(String pipeline, String operation, long nanos) {
        Timer.builder(op(pipeline, operation, "duration"))
                .register(registry)
                .record(nanos, TimeUnit.NANOSECONDS);
    }

    @Override
    public void onOperationSkipped(String pipeline, String operation) {
        Counter.builder(op(pipeline, operation, "skipped")).register(registry).increment();
    }

    @Override
    public void onOperationFailed(String pipeline, String operation, Throwable t) {
        Counter.builder(op(pipeline, operation, "errors")).register(registry).increment();
    }

    @Override
    public void onTaskFailed(Throwable t) {
        Counter.builder("augment.pool.tasks.failed").register(registry).increment();
    }

    @Override
    public void onArtifactPersisted() {
        Counter.builder("augment.pool.artifacts.persisted").register(registry).increment();
    }

    @Override
    public void onPersistFailed(Throwable t) {
        Counter.builder("augment.pool.artifacts.failed").register(registry).increment();
    }

    @Override
    public MeterRegistry registry() {
        return registry;
    }

    private static String op(String pipeline, String operation, String name) {
        return "augment.pipeline." + pipeline + ".op." + operation + "." + name;
    }
}

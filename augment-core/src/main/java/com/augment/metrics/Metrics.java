package com.augment.metrics;

import java.util.Objects;

/**
 * Process-wide {@link MetricsRecorder}. {@link com.augment.core.Pipeline} and
 * {@link com.augment.core.WorkerPool} look it up on every run, so a recorder installed before a run
 * sees all of that run's meters.
 */
public final class Metrics {
    private static volatile MetricsRecorder recorder = new SimpleMetricsRecorder();

    private Metrics() {}

    public static MetricsRecorder recorder() {
        return recorder;
    }

    public static void setRecorder(MetricsRecorder r) {
        recorder = Objects.requireNonNull(r, "recorder");
    }

    /** Installs a fresh in-memory recorder and returns it. */
    public static SimpleMetricsRecorder reset() {
        SimpleMetricsRecorder fresh = new SimpleMetricsRecorder();
        recorder = fresh;
        return fresh;
    }
}

package com.augment.metrics;

import io.micrometer.core.instrument.MeterRegistry;

public interface MetricsRecorder {
    void onOperationApplied(String pipeline, String operation, long nanos);
    void onOperationSkipped(String pipeline, String operation);
    void onOperationFailed(String pipeline, String operation, Throwable t);
    void onTaskFailed(Throwable t);
    void onArtifactPersisted();
    void onPersistFailed(Throwable t);
    MeterRegistry registry();
}

package com.alertengine.engine;

/**
 * Ingestion point for metric samples.
 *
 * <p>Producers (request filters, the health probe, other services) depend on this
 * interface only. Implementations must never throw: a bad sample is logged and dropped.
 */
public interface MetricRecorder {

    void recordMetric(String name, double value);
}

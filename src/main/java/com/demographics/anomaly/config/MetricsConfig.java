package com.demographics.anomaly.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordRun(String status) {
        Counter.builder("analysis.run.count")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordAnomalies(String method, long count) {
        Counter.builder("anomaly.flagged.count")
                .tag("method", method)
                .register(registry)
                .increment(count);
    }

    public void recordSeriesSkipped(String detector) {
        Counter.builder("series.skipped.count")
                .tag("detector", detector)
                .register(registry)
                .increment();
    }

    public void recordPersistenceFailure(String unitType) {
        Counter.builder("persistence.failure.count")
                .tag("unit", unitType)
                .register(registry)
                .increment();
    }

    public void recordCredibility(String model, double normalizedWeight) {
        DistributionSummary.builder("credibility.normalized_weight")
                .tag("model", model)
                .register(registry)
                .record(normalizedWeight);
    }
}

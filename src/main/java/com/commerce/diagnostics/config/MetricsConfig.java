package com.commerce.diagnostics.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordRun(String status, long durationMs) {
        Counter.builder("workflow.run.count")
                .tag("status", status)
                .register(registry)
                .increment();

        Timer.builder("workflow.run.duration")
                .tag("status", status)
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordNodeExecuted(String nodeType) {
        Counter.builder("workflow.node.executed.count")
                .tag("node_type", nodeType)
                .register(registry)
                .increment();
    }

    public void recordDimensionFailure(String dimension) {
        Counter.builder("analysis.dimension.failure.count")
                .tag("dimension", dimension)
                .register(registry)
                .increment();
    }

    public void recordQuery(String template, String outcome) {
        Counter.builder("query.executed.count")
                .tag("template", template)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }
}

package com.commerce.diagnostics.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "engine")
public class EngineConfig {

    // Structural bounds enforced by the workflow validator
    private int maxNodes = 50;
    private int maxDepth = 20;

    // Nodes executed per run before the engine aborts
    private int maxSteps = 50;

    // Timeout for a single tenant query, also the upper bound of a joined fetch
    private long queryTimeoutMs = 5000;

    private Thresholds thresholds = new Thresholds();

    private FetchPool fetchPool = new FetchPool();

    @Data
    public static class Thresholds {
        // Validation: a still-open current window shorter than this is deferred
        private long minWindowMinutes = 30;

        // Breakdown: a finding is valid above this absolute impact...
        private double validCauseImpact = 40.0;
        // ...or above this share (%) of the overall order drop
        private double validCauseRelativePct = 20.0;
        // Breakdown: top valid finding above this is dominant
        private double dominantImpact = 60.0;

        // Drill-down only runs when the top cause exceeds this impact
        private double drillDownMinImpact = 40.0;

        // Confidence: fewer current orders than this costs 0.1
        private double lowVolumeOrders = 50;
    }

    @Data
    public static class FetchPool {
        private int corePoolSize = 8;
        private int maxPoolSize = 32;
        private int queueCapacity = 500;
        private long keepAliveSeconds = 60;
        private String threadNamePrefix = "query-fetch-";
    }
}

package com.designlens.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for Designlens analysis runs.
 */
@Service
public class AnalysisMetrics {

    private final MeterRegistry registry;

    public AnalysisMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordStageDuration(String stage, long ms) {
        Timer.builder("designlens.stage.duration")
                .tag("stage", stage)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordRunDuration(long ms) {
        Timer.builder("designlens.run.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Counts a stage that fell back to its heuristic path.
     *
     * @param stage "grouping" or "validation"
     */
    public void recordFallback(String stage) {
        Counter.builder("designlens.fallbacks.total")
                .description("Stages that used their model-free fallback")
                .tag("stage", stage)
                .register(registry)
                .increment();
    }

    public void recordRunResult(String status) {
        Counter.builder("designlens.runs.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordDescriptorCount(int count) {
        DistributionSummary.builder("designlens.descriptors.count")
                .register(registry)
                .record(count);
    }

    public void recordComponentCount(int count) {
        DistributionSummary.builder("designlens.components.count")
                .register(registry)
                .record(count);
    }

    public void recordConfidence(String stage, double confidence) {
        DistributionSummary.builder("designlens.confidence")
                .tag("stage", stage)
                .register(registry)
                .record(confidence);
    }
}

package com.aura.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for message dispatch.
 */
@Service
public class AuraMetrics {

    private final MeterRegistry registry;

    public AuraMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param outcome {@code "success"} or the lower-cased failure kind
     */
    public void recordDispatch(String outcome, long ms) {
        Counter.builder("aura.dispatch.total")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
        Timer.builder("aura.dispatch.duration")
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordExecution(boolean stateChanged, long ms) {
        Timer.builder("aura.execution.duration")
                .tag("state_changed", String.valueOf(stateChanged))
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordResolutionDepth(int depth) {
        DistributionSummary.builder("aura.resolution.depth")
                .description("Delegation depth at which methods were found")
                .register(registry)
                .record(depth);
    }

    public void recordGeneration(boolean succeeded, long ms) {
        Timer.builder("aura.generation.duration")
                .tag("result", succeeded ? "success" : "failure")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordAudit(boolean passed) {
        Counter.builder("aura.audit.verdicts")
                .tag("result", passed ? "passed" : "rejected")
                .register(registry)
                .increment();
    }

    public void incrementInstalls() {
        Counter.builder("aura.methods.installed")
                .register(registry)
                .increment();
    }
}

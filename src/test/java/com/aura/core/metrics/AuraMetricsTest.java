package com.aura.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AuraMetricsTest {

    private SimpleMeterRegistry registry;
    private AuraMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new AuraMetrics(registry);
    }

    @Test
    @DisplayName("recordDispatch counts and times by outcome")
    void recordDispatch() {
        metrics.recordDispatch("success", 20);
        metrics.recordDispatch("success", 30);
        metrics.recordDispatch("audit_rejection", 10);

        assertEquals(2.0, registry.find("aura.dispatch.total").tag("outcome", "success").counter().count());
        assertEquals(1.0, registry.find("aura.dispatch.total").tag("outcome", "audit_rejection").counter().count());
        assertEquals(2, registry.find("aura.dispatch.duration").tag("outcome", "success").timer().count());
    }

    @Test
    @DisplayName("recordExecution tags by state change")
    void recordExecution() {
        metrics.recordExecution(true, 5);
        metrics.recordExecution(false, 5);

        assertNotNull(registry.find("aura.execution.duration").tag("state_changed", "true").timer());
        assertNotNull(registry.find("aura.execution.duration").tag("state_changed", "false").timer());
    }

    @Test
    @DisplayName("recordResolutionDepth feeds a distribution summary")
    void recordResolutionDepth() {
        metrics.recordResolutionDepth(0);
        metrics.recordResolutionDepth(2);

        var summary = registry.find("aura.resolution.depth").summary();
        assertNotNull(summary);
        assertEquals(2, summary.count());
        assertEquals(2.0, summary.max());
    }

    @Test
    @DisplayName("generation, audit and install meters are recorded")
    void generationAuditInstall() {
        metrics.recordGeneration(true, 100);
        metrics.recordGeneration(false, 100);
        metrics.recordAudit(true);
        metrics.recordAudit(false);
        metrics.recordAudit(false);
        metrics.incrementInstalls();

        assertEquals(1, registry.find("aura.generation.duration").tag("result", "success").timer().count());
        assertEquals(1, registry.find("aura.generation.duration").tag("result", "failure").timer().count());
        assertEquals(2.0, registry.find("aura.audit.verdicts").tag("result", "rejected").counter().count());
        assertEquals(1.0, registry.find("aura.methods.installed").counter().count());
    }
}

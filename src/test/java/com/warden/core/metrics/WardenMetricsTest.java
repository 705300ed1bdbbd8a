package com.warden.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WardenMetricsTest {

    private SimpleMeterRegistry registry;
    private WardenMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new WardenMetrics(registry);
    }

    @Test
    @DisplayName("recordUpdateOutcome counts by outcome tag")
    void recordUpdateOutcome() {
        metrics.recordUpdateOutcome("applied");
        metrics.recordUpdateOutcome("applied");
        metrics.recordUpdateOutcome("failed");

        assertEquals(2.0, registry.find("warden.updates.total").tag("outcome", "applied").counter().count());
        assertEquals(1.0, registry.find("warden.updates.total").tag("outcome", "failed").counter().count());
    }

    @Test
    @DisplayName("recordApplierCall times by operation and outcome")
    void recordApplierCall() {
        metrics.recordApplierCall("apply", true, 120);
        metrics.recordApplierCall("rollback", false, 80);

        var applyTimer = registry.find("warden.applier.duration")
                .tag("operation", "apply").tag("outcome", "success").timer();
        var rollbackTimer = registry.find("warden.applier.duration")
                .tag("operation", "rollback").tag("outcome", "failure").timer();

        assertNotNull(applyTimer);
        assertNotNull(rollbackTimer);
        assertEquals(1, applyTimer.count());
        assertEquals(1, rollbackTimer.count());
    }

    @Test
    @DisplayName("recordRejectedTransition and recordRecoveredInterrupted increment counters")
    void counters() {
        metrics.recordRejectedTransition("conflict");
        metrics.recordRecoveredInterrupted(3);

        assertEquals(1.0, registry.find("warden.transitions.rejected").tag("reason", "conflict").counter().count());
        assertEquals(3.0, registry.find("warden.recovery.interrupted").counter().count());
    }
}

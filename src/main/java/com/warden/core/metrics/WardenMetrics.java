package com.warden.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for the update lifecycle.
 */
@Service
public class WardenMetrics {

    private final MeterRegistry registry;

    public WardenMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Counts resolved attempts.
     *
     * @param outcome "applied", "failed" or "rolled_back"
     */
    public void recordUpdateOutcome(String outcome) {
        Counter.builder("warden.updates.total")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    /**
     * Times one applier call.
     *
     * @param operation "apply" or "rollback"
     * @param success   whether the applier reported success
     */
    public void recordApplierCall(String operation, boolean success, long ms) {
        Timer.builder("warden.applier.duration")
                .tag("operation", operation)
                .tag("outcome", success ? "success" : "failure")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Counts requests refused before any mutation.
     *
     * @param reason "conflict" or "invalid_transition"
     */
    public void recordRejectedTransition(String reason) {
        Counter.builder("warden.transitions.rejected")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordRecoveredInterrupted(int count) {
        Counter.builder("warden.recovery.interrupted")
                .description("Pending updates moved to failed by recovery")
                .register(registry)
                .increment(count);
    }
}

package com.warden.core.recovery;

import java.util.List;

/**
 * Result of a read-only audit of every record against the event log.
 */
public record VerificationReport(int examined, List<ProjectionMismatch> mismatches) {

    public VerificationReport {
        mismatches = List.copyOf(mismatches);
    }

    public boolean isConsistent() {
        return mismatches.isEmpty();
    }
}

package com.warden.core.model;

import com.warden.applier.ApplierException;

/**
 * Result of an {@code apply} or {@code rollback} call.
 * <p>
 * Applier failures do not escape as exceptions: the record has already been
 * moved to its terminal-for-this-attempt state and the failure is handed back
 * here so the caller can decide on retry.
 *
 * @param record  the record after the transition
 * @param failure the applier failure, or {@code null} when the applier succeeded
 */
public record UpdateOutcome(UpdateRecord record, ApplierException failure) {

    public static UpdateOutcome succeeded(UpdateRecord record) {
        return new UpdateOutcome(record, null);
    }

    public static UpdateOutcome failed(UpdateRecord record, ApplierException failure) {
        return new UpdateOutcome(record, failure);
    }

    public boolean isSuccess() {
        return failure == null;
    }
}

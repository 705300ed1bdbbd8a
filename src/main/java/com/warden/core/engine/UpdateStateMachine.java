package com.warden.core.engine;

import com.warden.applier.Applier;
import com.warden.applier.ApplierException;
import com.warden.core.events.Event;
import com.warden.core.events.EventKind;
import com.warden.core.logging.MdcContext;
import com.warden.core.metrics.WardenMetrics;
import com.warden.core.model.UpdateOutcome;
import com.warden.core.model.UpdateRecord;
import com.warden.core.model.UpdateState;
import com.warden.core.persistence.Ledger;
import com.warden.core.persistence.StorageException;
import com.warden.core.persistence.UpdateConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Drives an update through its lifecycle.
 * <p>
 * Each phase runs in its own ledger transaction, so the event and the record
 * change it produces commit together. The {@link Applier} is always called
 * between transactions: a slow or hung applier never holds the database.
 * <p>
 * Transitions for one update id are serialized in-process by a per-id lock and
 * across processes by compare-and-set on the expected state.
 */
@Service
public class UpdateStateMachine {

    private static final Logger log = LoggerFactory.getLogger(UpdateStateMachine.class);

    static final String META_ATTEMPT = "attempt";
    static final String META_ERROR = "error";
    static final String META_REASON = "reason";
    static final String META_ROLLBACK_OUTCOME = "rollbackOutcome";
    static final String META_ROLLBACK_ERROR = "rollbackError";
    static final String META_ROLLED_BACK_FROM = "rolledBackFrom";

    private final Ledger ledger;
    private final Applier applier;
    private final WardenMetrics metrics;
    private final UpdateLocks locks = new UpdateLocks();

    public UpdateStateMachine(Ledger ledger, Applier applier, WardenMetrics metrics) {
        this.ledger = ledger;
        this.applier = applier;
        this.metrics = metrics;
    }

    /**
     * Applies {@code name@version} once.
     *
     * @param name    surrounding whitespace is ignored
     * @param version optional; blank is treated as absent
     * @return the resolved record, with the applier failure if there was one
     * @throws UpdateConflictException if an attempt for the same identity is already pending
     * @throws StorageException        if the ledger could not be written
     */
    public UpdateOutcome apply(String name, String version) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Update name must not be blank");
        }
        String normalizedName = name.trim();
        String normalizedVersion = version == null || version.isBlank() ? null : version.trim();
        MdcContext.setIdentity(normalizedName, normalizedVersion);
        try {
            UpdateRecord pending = start(normalizedName, normalizedVersion);
            MdcContext.setUpdate(pending);
            log.info("Applying {} (update {}, attempt {})", pending.identity(), pending.id(),
                    pending.meta().get(META_ATTEMPT));

            ApplierException failure = invokeApply(pending);
            UpdateRecord resolved = failure == null ? markApplied(pending) : markFailed(pending, failure);
            metrics.recordUpdateOutcome(resolved.state().wireName());
            return new UpdateOutcome(resolved, failure);
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Reverts an {@code applied} or {@code failed} update. The record reaches
     * {@code rolled_back} whether or not the applier's inverse succeeds; an
     * inverse failure is reported in the outcome and in the record's meta.
     *
     * @throws InvalidTransitionException if the record is not rollbackable or another
     *                                    process is already rolling it back
     * @throws com.warden.core.persistence.UpdateNotFoundException if no record exists
     */
    public UpdateOutcome rollback(long updateId) {
        return locks.withLock(updateId, () -> {
            try {
                UpdateRecord from = beginRollback(updateId);
                MdcContext.setUpdate(from);
                log.info("Rolling back {} (update {}) from {}", from.identity(), from.id(), from.state().wireName());

                ApplierException failure = invokeRollback(from);
                UpdateRecord resolved = finishRollback(from, failure);
                metrics.recordUpdateOutcome(resolved.state().wireName());
                return new UpdateOutcome(resolved, failure);
            } finally {
                MdcContext.clear();
            }
        });
    }

    private UpdateRecord start(String name, String version) {
        try {
            return ledger.inTransaction(() -> {
                long attempt = ledger.updates().countByIdentity(name, version) + 1;
                Map<String, Object> meta = new LinkedHashMap<>();
                meta.put(META_ATTEMPT, attempt);
                UpdateRecord record = ledger.updates().create(name, version, meta);

                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put(Event.UPDATE_ID, record.id());
                payload.put("name", name);
                payload.put("version", version);
                payload.put(META_ATTEMPT, attempt);
                ProcessOwner.current().writeTo(payload);
                ledger.events().append(EventKind.UPDATE_STARTED, payload);
                return record;
            });
        } catch (UpdateConflictException e) {
            metrics.recordRejectedTransition("conflict");
            log.warn("Refusing to apply {}: {}", version == null ? name : name + "@" + version, e.getMessage());
            throw e;
        }
    }

    private ApplierException invokeApply(UpdateRecord pending) {
        long start = System.currentTimeMillis();
        ApplierException failure;
        try {
            applier.apply(pending.name(), pending.version());
            failure = interruptedFailure("apply");
        } catch (ApplierException e) {
            failure = e;
        } catch (RuntimeException e) {
            failure = new ApplierException("Applier crashed: " + e.getMessage(), e);
        }
        metrics.recordApplierCall("apply", failure == null, System.currentTimeMillis() - start);
        return failure;
    }

    private ApplierException invokeRollback(UpdateRecord record) {
        long start = System.currentTimeMillis();
        ApplierException failure;
        try {
            applier.rollback(record.name(), record.version());
            failure = interruptedFailure("rollback");
        } catch (ApplierException e) {
            failure = e;
        } catch (RuntimeException e) {
            failure = new ApplierException("Applier crashed during rollback: " + e.getMessage(), e);
        }
        metrics.recordApplierCall("rollback", failure == null, System.currentTimeMillis() - start);
        return failure;
    }

    /** An applier that returns normally while the caller was interrupted did not finish its work. */
    private static ApplierException interruptedFailure(String operation) {
        if (Thread.currentThread().isInterrupted()) {
            return ApplierException.cancelled(operation + " interrupted", null);
        }
        return null;
    }

    private UpdateRecord markApplied(UpdateRecord pending) {
        UpdateRecord resolved = ledger.inTransaction(() -> {
            ledger.events().append(EventKind.UPDATE_APPLIED, Map.of(Event.UPDATE_ID, pending.id()));
            return resolve(pending, UpdateState.APPLIED, pending.meta());
        });
        log.info("Applied {} (update {})", pending.identity(), pending.id());
        return resolved;
    }

    private UpdateRecord markFailed(UpdateRecord pending, ApplierException failure) {
        String error = describe(failure);
        String reason = failure.getReason().code();
        UpdateRecord resolved = ledger.inTransaction(() -> {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put(Event.UPDATE_ID, pending.id());
            payload.put(META_REASON, reason);
            payload.put(META_ERROR, error);
            ledger.events().append(EventKind.UPDATE_FAILED, payload);

            Map<String, Object> meta = new LinkedHashMap<>(pending.meta());
            meta.put(META_ERROR, error);
            meta.put(META_REASON, reason);
            return resolve(pending, UpdateState.FAILED, meta);
        });
        log.warn("Failed to apply {} (update {}): {}", pending.identity(), pending.id(), error);
        return resolved;
    }

    private UpdateRecord beginRollback(long updateId) {
        return ledger.inTransaction(() -> {
            UpdateRecord record = ledger.updates().get(updateId);
            boolean inFlight = UpdateProjection
                    .project(updateId, ledger.events().readByReference(updateId))
                    .rollingBack();
            if (!record.state().isRollbackable() || inFlight) {
                metrics.recordRejectedTransition("invalid_transition");
                throw new InvalidTransitionException(updateId, record.state(), UpdateState.ROLLED_BACK);
            }
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put(Event.UPDATE_ID, updateId);
            payload.put("from", record.state().wireName());
            ProcessOwner.current().writeTo(payload);
            ledger.events().append(EventKind.UPDATE_ROLLBACK_STARTED, payload);
            return record;
        });
    }

    private UpdateRecord finishRollback(UpdateRecord from, ApplierException failure) {
        String outcome = failure == null ? "succeeded" : "failed";
        String error = failure == null ? null : describe(failure);
        UpdateRecord resolved = ledger.inTransaction(() -> {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put(Event.UPDATE_ID, from.id());
            payload.put("outcome", outcome);
            if (error != null) {
                payload.put(META_ERROR, error);
            }
            ledger.events().append(EventKind.UPDATE_ROLLED_BACK, payload);

            Map<String, Object> meta = new LinkedHashMap<>(from.meta());
            meta.put(META_ROLLED_BACK_FROM, from.state().wireName());
            meta.put(META_ROLLBACK_OUTCOME, outcome);
            if (error != null) {
                meta.put(META_ROLLBACK_ERROR, error);
            }
            return resolve(from, UpdateState.ROLLED_BACK, meta);
        });
        if (failure == null) {
            log.info("Rolled back {} (update {})", from.identity(), from.id());
        } else {
            log.warn("Rolled back {} (update {}) but the inverse failed: {}", from.identity(), from.id(), error);
        }
        return resolved;
    }

    /**
     * Moves the record from the state this machine last saw to {@code target}.
     * Losing the compare-and-set means another process changed the record
     * underneath us; the transaction is rolled back with the event.
     */
    private UpdateRecord resolve(UpdateRecord current, UpdateState target, Map<String, Object> meta) {
        if (!ledger.updates().compareAndSetState(current.id(), current.state(), target, meta)) {
            UpdateState actual = ledger.updates().get(current.id()).state();
            throw new InvalidTransitionException(current.id(), actual, target);
        }
        return current.withState(target, meta);
    }

    private static String describe(ApplierException failure) {
        return failure.getMessage() != null ? failure.getMessage() : failure.getClass().getSimpleName();
    }
}

package com.warden.core.recovery;

import com.warden.core.WardenException;
import com.warden.core.engine.ProcessOwner;
import com.warden.core.engine.UpdateProjection;
import com.warden.core.events.Event;
import com.warden.core.events.EventKind;
import com.warden.core.logging.MdcContext;
import com.warden.core.metrics.WardenMetrics;
import com.warden.core.model.UpdateRecord;
import com.warden.core.model.UpdateState;
import com.warden.core.persistence.Ledger;
import com.warden.core.persistence.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Predicate;

/**
 * Reconciles records left behind by a process that died mid-transition.
 * <p>
 * A {@code pending} record whose events already show an outcome is only a stale
 * cache and is re-synced silently. One whose attempt never reported back is
 * failed with reason {@code interrupted}. A rollback that was started but never
 * finished is closed as rolled back with outcome {@code interrupted}. The
 * applier is never called.
 * <p>
 * Work whose {@link ProcessOwner} is still running is in flight, not crashed,
 * and is left alone. Events written without an owner count as orphaned.
 */
@Service
public class RecoveryService {

    private static final Logger log = LoggerFactory.getLogger(RecoveryService.class);

    static final String REASON_INTERRUPTED = "interrupted";
    static final String SOURCE = "recovery";

    private final Ledger ledger;
    private final WardenMetrics metrics;
    private final Predicate<ProcessOwner> ownerAlive;

    @Autowired
    public RecoveryService(Ledger ledger, WardenMetrics metrics) {
        this(ledger, metrics, ProcessOwner::isAlive);
    }

    RecoveryService(Ledger ledger, WardenMetrics metrics, Predicate<ProcessOwner> ownerAlive) {
        this.ledger = ledger;
        this.metrics = metrics;
        this.ownerAlive = ownerAlive;
    }

    /**
     * @throws StorageException if the ledger cannot be read or written
     */
    public RecoveryReport recover() {
        MdcContext.setRecovery(UUID.randomUUID().toString().substring(0, 8));
        try {
            List<Long> interrupted = new ArrayList<>();
            List<Long> resynced = new ArrayList<>();
            List<Long> rollbacksClosed = new ArrayList<>();
            List<Long> inFlight = new ArrayList<>();
            List<Long> skipped = new ArrayList<>();

            List<UpdateRecord> pending = ledger.updates().listByState(UpdateState.PENDING);
            for (UpdateRecord record : pending) {
                MdcContext.setUpdate(record);
                try {
                    recoverPending(record, interrupted, resynced, inFlight);
                } catch (StorageException e) {
                    throw e;
                } catch (WardenException e) {
                    log.error("Skipping update {}: {}", record.id(), e.getMessage());
                    skipped.add(record.id());
                }
            }

            List<UpdateRecord> resolved = new ArrayList<>(ledger.updates().listByState(UpdateState.APPLIED));
            resolved.addAll(ledger.updates().listByState(UpdateState.FAILED));
            for (UpdateRecord record : resolved) {
                MdcContext.setUpdate(record);
                try {
                    closeOpenRollback(record, rollbacksClosed, inFlight);
                } catch (StorageException e) {
                    throw e;
                } catch (WardenException e) {
                    log.error("Skipping update {}: {}", record.id(), e.getMessage());
                    skipped.add(record.id());
                }
            }
            MdcContext.clearUpdate();

            if (!interrupted.isEmpty()) {
                metrics.recordRecoveredInterrupted(interrupted.size());
            }
            RecoveryReport report = new RecoveryReport(pending.size() + resolved.size(),
                    interrupted, resynced, rollbacksClosed, inFlight, skipped);
            if (!inFlight.isEmpty()) {
                log.info("Left {} update(s) alone, still in progress in a live process: {}", inFlight.size(), inFlight);
            }
            if (report.isClean()) {
                log.info("Recovery found nothing to repair ({} records examined)", report.examined());
            } else {
                log.warn("Recovery repaired {} records: interrupted={}, resynced={}, rollbacksClosed={}, skipped={}",
                        report.changed(), interrupted, resynced, rollbacksClosed, skipped);
            }
            return report;
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Compares every record with the replay of its events. Writes nothing.
     */
    public VerificationReport verify() {
        List<ProjectionMismatch> mismatches = new ArrayList<>();
        int examined = 0;
        for (UpdateState state : UpdateState.values()) {
            for (UpdateRecord record : ledger.updates().listByState(state)) {
                examined++;
                List<Event> events = ledger.events().readByReference(record.id());
                try {
                    UpdateState projected = UpdateProjection.replay(record.id(), events);
                    if (projected != record.state()) {
                        mismatches.add(new ProjectionMismatch(record.id(), record.state(), projected,
                                "stored " + record.state().wireName() + " but events replay to " + projected.wireName()));
                    }
                } catch (WardenException e) {
                    mismatches.add(new ProjectionMismatch(record.id(), record.state(), null, e.getMessage()));
                }
            }
        }
        if (mismatches.isEmpty()) {
            log.info("Verified {} records against the event log", examined);
        } else {
            log.warn("{} of {} records disagree with the event log", mismatches.size(), examined);
        }
        return new VerificationReport(examined, mismatches);
    }

    private void recoverPending(UpdateRecord record, List<Long> interrupted, List<Long> resynced,
                                List<Long> inFlight) {
        ledger.inTransaction(() -> {
            List<Event> events = ledger.events().readByReference(record.id());
            UpdateState projected = UpdateProjection.replay(record.id(), events);
            if (UpdateProjection.isResolved(projected)) {
                log.warn("Update {} is stored as pending but its events show {}; re-syncing",
                        record.id(), projected.wireName());
                casOrThrow(record, projected, resyncedMeta(record, projected, events));
                resynced.add(record.id());
                return;
            }
            Optional<ProcessOwner> owner = lastOwner(events, EventKind.UPDATE_STARTED);
            if (owner.isPresent() && ownerAlive.test(owner.get())) {
                log.debug("Update {} is still being applied by process {}", record.id(), owner.get().pid());
                inFlight.add(record.id());
                return;
            }

            log.warn("Update {} ({}) was interrupted before the applier reported back; marking failed",
                    record.id(), record.identity());
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put(Event.UPDATE_ID, record.id());
            payload.put("reason", REASON_INTERRUPTED);
            payload.put("source", SOURCE);
            ledger.events().append(EventKind.UPDATE_FAILED, payload);

            Map<String, Object> meta = new LinkedHashMap<>(record.meta());
            meta.put("reason", REASON_INTERRUPTED);
            meta.put("error", "Process stopped before the applier reported an outcome");
            casOrThrow(record, UpdateState.FAILED, meta);
            interrupted.add(record.id());
        });
    }

    private void closeOpenRollback(UpdateRecord record, List<Long> rollbacksClosed, List<Long> inFlight) {
        ledger.inTransaction(() -> {
            List<Event> events = ledger.events().readByReference(record.id());
            UpdateProjection.Projection projection = UpdateProjection.project(record.id(), events);
            if (!projection.rollingBack()) {
                return;
            }
            Optional<ProcessOwner> owner = lastOwner(events, EventKind.UPDATE_ROLLBACK_STARTED);
            if (owner.isPresent() && ownerAlive.test(owner.get())) {
                log.debug("Update {} is still being rolled back by process {}", record.id(), owner.get().pid());
                inFlight.add(record.id());
                return;
            }
            log.warn("Rollback of update {} ({}) was interrupted; closing it", record.id(), record.identity());
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put(Event.UPDATE_ID, record.id());
            payload.put("outcome", REASON_INTERRUPTED);
            payload.put("source", SOURCE);
            ledger.events().append(EventKind.UPDATE_ROLLED_BACK, payload);

            Map<String, Object> meta = new LinkedHashMap<>(record.meta());
            meta.put("rolledBackFrom", record.state().wireName());
            meta.put("rollbackOutcome", REASON_INTERRUPTED);
            casOrThrow(record, UpdateState.ROLLED_BACK, meta);
            rollbacksClosed.add(record.id());
        });
    }

    private static Optional<ProcessOwner> lastOwner(List<Event> events, EventKind kind) {
        Optional<ProcessOwner> owner = Optional.empty();
        for (Event event : events) {
            if (kind.kind().equals(event.kind())) {
                owner = ProcessOwner.readFrom(event);
            }
        }
        return owner;
    }

    private static Map<String, Object> resyncedMeta(UpdateRecord record, UpdateState projected, List<Event> events) {
        Map<String, Object> meta = new LinkedHashMap<>(record.meta());
        if (projected == UpdateState.FAILED) {
            for (Event event : events) {
                if (EventKind.UPDATE_FAILED.kind().equals(event.kind())) {
                    putIfPresent(meta, "reason", event.payloadString("reason"));
                    putIfPresent(meta, "error", event.payloadString("error"));
                }
            }
        }
        return meta;
    }

    private static void putIfPresent(Map<String, Object> meta, String key, String value) {
        if (value != null) {
            meta.put(key, value);
        }
    }

    private void casOrThrow(UpdateRecord record, UpdateState target, Map<String, Object> meta) {
        if (!ledger.updates().compareAndSetState(record.id(), record.state(), target, meta)) {
            throw new WardenException("Update " + record.id() + " changed while recovery was repairing it");
        }
    }
}

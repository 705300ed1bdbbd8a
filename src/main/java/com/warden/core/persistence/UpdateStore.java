package com.warden.core.persistence;

import com.warden.core.model.UpdateRecord;
import com.warden.core.model.UpdateState;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Store of {@link UpdateRecord}s.
 * <p>
 * The store enforces only record existence and pending uniqueness per
 * {@code (name, version)}; transition legality belongs to the state machine.
 */
public interface UpdateStore {

    /**
     * Atomically inserts a {@code pending} record unless one is already pending
     * for the same identity.
     *
     * @throws UpdateConflictException if a pending record exists for {@code (name, version)}
     */
    UpdateRecord create(String name, String version, Map<String, Object> meta);

    Optional<UpdateRecord> find(long id);

    /**
     * @throws UpdateNotFoundException if no record exists for {@code id}
     */
    default UpdateRecord get(long id) {
        return find(id).orElseThrow(() -> new UpdateNotFoundException(id));
    }

    /**
     * Overwrites state and metadata unconditionally.
     *
     * @throws UpdateNotFoundException if no record exists for {@code id}
     */
    UpdateRecord setState(long id, UpdateState newState, Map<String, Object> meta);

    /**
     * Overwrites state and metadata only if the current state is {@code expected}.
     *
     * @return {@code true} if the row was updated
     */
    boolean compareAndSetState(long id, UpdateState expected, UpdateState newState, Map<String, Object> meta);

    /** Every record in {@code state}, oldest first. */
    List<UpdateRecord> listByState(UpdateState state);

    /** At most {@code limit} records in {@code state}, most recent first. */
    List<UpdateRecord> listRecentByState(UpdateState state, int limit);

    /** Most recent records first. */
    List<UpdateRecord> listAll(int limit);

    /** All attempts for one identity, oldest first. */
    List<UpdateRecord> listByIdentity(String name, String version);

    long countByIdentity(String name, String version);
}

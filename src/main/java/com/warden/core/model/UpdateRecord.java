package com.warden.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Current lifecycle state of one named, versioned update.
 * <p>
 * This is a cached projection of the event log; {@link com.warden.core.engine.UpdateProjection}
 * rebuilds {@code state} from the events that reference {@code id}.
 *
 * @param id        store-assigned identifier
 * @param name      logical identity of the update (not unique across versions)
 * @param version   optional version discriminator, {@code null} when absent
 * @param state     current lifecycle state
 * @param meta      applier context, error detail and retry count; never null
 * @param createdAt creation timestamp
 */
public record UpdateRecord(
    long id,
    String name,
    String version,
    UpdateState state,
    Map<String, Object> meta,
    Instant createdAt
) {

    public UpdateRecord {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(state, "state must not be null");
        meta = meta == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(meta));
    }

    /** {@code name@version}, or just {@code name} when unversioned. */
    public String identity() {
        return version == null ? name : name + "@" + version;
    }

    public UpdateRecord withState(UpdateState newState, Map<String, Object> newMeta) {
        return new UpdateRecord(id, name, version, newState, newMeta, createdAt);
    }
}

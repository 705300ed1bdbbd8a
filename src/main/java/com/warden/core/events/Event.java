package com.warden.core.events;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * An immutable fact appended to the {@link EventLog}.
 *
 * @param id        log-assigned, strictly increasing
 * @param kind      category, e.g. "update.started"
 * @param payload   structured data, {@code null} when the event carries none
 * @param createdAt append time, non-decreasing with {@code id}
 */
public record Event(
    long id,
    String kind,
    Map<String, Object> payload,
    Instant createdAt
) {

    /** Payload key linking an event to an update record. */
    public static final String UPDATE_ID = "updateId";

    public Event {
        Objects.requireNonNull(kind, "kind must not be null");
        payload = payload == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public Optional<Long> updateId() {
        if (payload == null || !(payload.get(UPDATE_ID) instanceof Number n)) {
            return Optional.empty();
        }
        return Optional.of(n.longValue());
    }

    public Optional<EventKind> knownKind() {
        return EventKind.fromKind(kind);
    }

    /** Payload value as a string, or {@code null} when missing. */
    public String payloadString(String key) {
        if (payload == null) {
            return null;
        }
        Object value = payload.get(key);
        return value != null ? value.toString() : null;
    }
}

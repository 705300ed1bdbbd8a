package com.warden.core.events;

import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Append-only store of immutable events.
 * <p>
 * Each {@code append} is a single atomic write; an append made inside a ledger
 * transaction commits or rolls back with it. Nothing is ever updated or deleted.
 */
public interface EventLog {

    /**
     * Appends an event, assigning the next id and a timestamp no earlier than
     * the previous event's.
     *
     * @param kind    event category
     * @param payload structured data, may be {@code null}
     * @return the stored event
     * @throws com.warden.core.persistence.StorageException if the write could not be made durable
     */
    Event append(String kind, Map<String, Object> payload);

    default Event append(EventKind kind, Map<String, Object> payload) {
        return append(kind.kind(), payload);
    }

    /**
     * Lazily streams every event in id order. Each call starts from the
     * beginning of the log. Callers should close the stream.
     */
    Stream<Event> readAll();

    /** One page of events with {@code id > afterId}, in id order. */
    List<Event> readAfter(long afterId, int limit);

    /** Events whose payload references the given update id, in append order. */
    List<Event> readByReference(long updateId);

    long count();
}

package com.warden.core.engine;

import com.warden.core.events.Event;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * The process that started an apply or a rollback, as recorded in the
 * {@code update.started} and {@code update.rollback_started} payloads.
 *
 * @param pid       operating system process id
 * @param startedAt process start time in epoch millis, {@code null} when the platform does not report it
 */
public record ProcessOwner(long pid, Long startedAt) {

    public static final String PID = "ownerPid";
    public static final String STARTED_AT = "ownerStartedAt";

    private static final ProcessOwner CURRENT = of(ProcessHandle.current());

    public static ProcessOwner current() {
        return CURRENT;
    }

    static ProcessOwner of(ProcessHandle handle) {
        Long startedAt = handle.info().startInstant().map(Instant::toEpochMilli).orElse(null);
        return new ProcessOwner(handle.pid(), startedAt);
    }

    public void writeTo(Map<String, Object> payload) {
        payload.put(PID, pid);
        if (startedAt != null) {
            payload.put(STARTED_AT, startedAt);
        }
    }

    /** The owner recorded in {@code event}, empty for events written without one. */
    public static Optional<ProcessOwner> readFrom(Event event) {
        Map<String, Object> payload = event.payload();
        if (payload == null || !(payload.get(PID) instanceof Number pid)) {
            return Optional.empty();
        }
        Long startedAt = payload.get(STARTED_AT) instanceof Number n ? n.longValue() : null;
        return Optional.of(new ProcessOwner(pid.longValue(), startedAt));
    }

    /**
     * Whether the owning process is still running. A live process whose start
     * time differs from the recorded one holds a reused pid and does not count.
     */
    public boolean isAlive() {
        return ProcessHandle.of(pid)
                .filter(ProcessHandle::isAlive)
                .map(handle -> startedAt == null || handle.info().startInstant()
                        .map(start -> start.toEpochMilli() == startedAt)
                        .orElse(true))
                .orElse(false);
    }
}

package com.warden.core.events;

import java.util.Optional;

/**
 * Event kinds written by the update lifecycle. The log itself accepts any kind
 * string; these are the ones the state machine and recovery understand.
 */
public enum EventKind {
    UPDATE_STARTED("update.started"),
    UPDATE_APPLIED("update.applied"),
    UPDATE_FAILED("update.failed"),
    UPDATE_ROLLBACK_STARTED("update.rollback_started"),
    UPDATE_ROLLED_BACK("update.rolled_back");

    private final String kind;

    EventKind(String kind) {
        this.kind = kind;
    }

    public String kind() {
        return kind;
    }

    public static Optional<EventKind> fromKind(String kind) {
        for (EventKind k : values()) {
            if (k.kind.equals(kind)) {
                return Optional.of(k);
            }
        }
        return Optional.empty();
    }
}

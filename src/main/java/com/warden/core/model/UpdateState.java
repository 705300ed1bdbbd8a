package com.warden.core.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle state of an update, with the closed table of legal transitions.
 * <p>
 * {@code PENDING} is the only initial state. {@code APPLIED} may still be rolled
 * back once; {@code ROLLED_BACK} accepts no further transitions.
 */
public enum UpdateState {
    PENDING("pending"),
    APPLIED("applied"),
    FAILED("failed"),
    ROLLED_BACK("rolled_back");

    private static final Map<UpdateState, Set<UpdateState>> TRANSITIONS = new EnumMap<>(UpdateState.class);

    static {
        TRANSITIONS.put(PENDING, EnumSet.of(APPLIED, FAILED));
        TRANSITIONS.put(APPLIED, EnumSet.of(ROLLED_BACK));
        TRANSITIONS.put(FAILED, EnumSet.of(ROLLED_BACK));
        TRANSITIONS.put(ROLLED_BACK, EnumSet.noneOf(UpdateState.class));
    }

    private final String wireName;

    UpdateState(String wireName) {
        this.wireName = wireName;
    }

    /** Lower-case name stored in the {@code updates.state} column. */
    public String wireName() {
        return wireName;
    }

    public boolean canTransitionTo(UpdateState target) {
        return TRANSITIONS.get(this).contains(target);
    }

    public Set<UpdateState> allowedTargets() {
        return Collections.unmodifiableSet(TRANSITIONS.get(this));
    }

    public boolean isRollbackable() {
        return canTransitionTo(ROLLED_BACK);
    }

    /**
     * Parses a stored or user-supplied state name. Accepts both the wire form
     * ({@code rolled_back}) and the enum constant ({@code ROLLED_BACK}).
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static UpdateState fromWireName(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Update state must not be null");
        }
        for (UpdateState state : values()) {
            if (state.wireName.equalsIgnoreCase(value) || state.name().equalsIgnoreCase(value)) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown update state: " + value);
    }
}

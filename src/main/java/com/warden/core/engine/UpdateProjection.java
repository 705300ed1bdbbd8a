package com.warden.core.engine;

import com.warden.core.events.Event;
import com.warden.core.events.EventKind;
import com.warden.core.model.UpdateState;

import java.util.List;
import java.util.Optional;

/**
 * Derives an update's lifecycle state from its events.
 * <p>
 * Replay starts from {@code pending}: {@code update.started} confirms it, the
 * outcome events move it, and {@code update.rollback_started} leaves it where
 * it is until the matching {@code update.rolled_back}. Kinds outside the core
 * set are ignored.
 */
public final class UpdateProjection {

    private UpdateProjection() {}

    /**
     * @param updateId the record the events belong to, used for error reporting
     * @param events   the record's events in append order
     * @throws InvalidTransitionException if the history contains an illegal transition
     */
    public static UpdateState replay(long updateId, List<Event> events) {
        return project(updateId, events).state();
    }

    /**
     * Replays the history and also reports whether the attempt was confirmed
     * started and whether a rollback is still open.
     *
     * @throws InvalidTransitionException if the history contains an illegal transition
     */
    public static Projection project(long updateId, List<Event> events) {
        UpdateState state = UpdateState.PENDING;
        boolean started = false;
        boolean rollingBack = false;
        for (Event event : events) {
            Optional<EventKind> kind = event.knownKind();
            if (kind.isEmpty()) {
                continue;
            }
            switch (kind.get()) {
                case UPDATE_STARTED -> {
                    if (started || state != UpdateState.PENDING) {
                        throw new InvalidTransitionException(updateId, state, UpdateState.PENDING);
                    }
                    started = true;
                }
                case UPDATE_APPLIED -> state = advance(updateId, state, UpdateState.APPLIED);
                case UPDATE_FAILED -> state = advance(updateId, state, UpdateState.FAILED);
                case UPDATE_ROLLBACK_STARTED -> {
                    if (!state.isRollbackable() || rollingBack) {
                        throw new InvalidTransitionException(updateId, state, UpdateState.ROLLED_BACK);
                    }
                    rollingBack = true;
                }
                case UPDATE_ROLLED_BACK -> {
                    state = advance(updateId, state, UpdateState.ROLLED_BACK);
                    rollingBack = false;
                }
            }
        }
        return new Projection(state, started, rollingBack);
    }

    /**
     * True when the history ends in a state the state machine reaches only after
     * the applier returned, i.e. no crash recovery is needed.
     */
    public static boolean isResolved(UpdateState projected) {
        return projected != UpdateState.PENDING;
    }

    /**
     * @param state       the replayed lifecycle state
     * @param started     whether {@code update.started} was seen
     * @param rollingBack whether a {@code update.rollback_started} has no matching {@code update.rolled_back}
     */
    public record Projection(UpdateState state, boolean started, boolean rollingBack) {}

    private static UpdateState advance(long updateId, UpdateState from, UpdateState to) {
        if (!from.canTransitionTo(to)) {
            throw new InvalidTransitionException(updateId, from, to);
        }
        return to;
    }
}

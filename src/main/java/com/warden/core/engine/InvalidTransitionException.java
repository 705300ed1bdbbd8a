package com.warden.core.engine;

import com.warden.core.WardenException;
import com.warden.core.model.UpdateState;

/**
 * A transition that the lifecycle table does not allow was requested.
 * Nothing was mutated.
 */
public class InvalidTransitionException extends WardenException {

    private final long updateId;
    private final UpdateState from;
    private final UpdateState to;

    public InvalidTransitionException(long updateId, UpdateState from, UpdateState to) {
        super("Update " + updateId + " cannot move from " + from.wireName() + " to " + to.wireName());
        this.updateId = updateId;
        this.from = from;
        this.to = to;
    }

    public long getUpdateId() {
        return updateId;
    }

    public UpdateState getFrom() {
        return from;
    }

    public UpdateState getTo() {
        return to;
    }
}

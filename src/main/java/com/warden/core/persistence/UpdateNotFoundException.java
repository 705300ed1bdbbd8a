package com.warden.core.persistence;

import com.warden.core.WardenException;

/**
 * Thrown when no update record exists for the requested id.
 */
public class UpdateNotFoundException extends WardenException {

    private final long updateId;

    public UpdateNotFoundException(long updateId) {
        super("Update not found: " + updateId);
        this.updateId = updateId;
    }

    public long getUpdateId() {
        return updateId;
    }
}

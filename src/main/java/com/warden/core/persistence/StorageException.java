package com.warden.core.persistence;

import com.warden.core.WardenException;

/**
 * A write to the event log or the update store could not be made durable, or
 * stored data could not be read back. The enclosing ledger transaction is rolled
 * back, so no partial state is left behind.
 */
public class StorageException extends WardenException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}

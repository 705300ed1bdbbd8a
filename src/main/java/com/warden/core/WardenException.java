package com.warden.core;

/**
 * Root of the unchecked errors surfaced by the update ledger.
 */
public class WardenException extends RuntimeException {

    public WardenException(String message) {
        super(message);
    }

    public WardenException(String message, Throwable cause) {
        super(message, cause);
    }
}

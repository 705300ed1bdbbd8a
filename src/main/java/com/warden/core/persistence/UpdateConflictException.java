package com.warden.core.persistence;

import com.warden.core.WardenException;

/**
 * Another attempt for the same {@code (name, version)} is still pending.
 * Callers may back off and retry once that attempt resolves.
 */
public class UpdateConflictException extends WardenException {

    private final String name;
    private final String version;

    public UpdateConflictException(String name, String version) {
        super("An attempt for " + (version == null ? name : name + "@" + version) + " is already pending");
        this.name = name;
        this.version = version;
    }

    public String getName() {
        return name;
    }

    public String getVersion() {
        return version;
    }
}

package com.warden.dispatch.cli;

import com.warden.core.engine.InvalidTransitionException;
import com.warden.core.persistence.StorageException;
import com.warden.core.persistence.UpdateConflictException;
import com.warden.core.persistence.UpdateNotFoundException;
import picocli.CommandLine;

/**
 * Process exit codes, and the mapping from uncaught exceptions to them.
 */
public final class ExitCodes implements CommandLine.IExitCodeExceptionMapper {

    public static final int OK = 0;
    /** The applier reported failure; the ledger recorded it. */
    public static final int APPLIER_FAILED = 1;
    /** Conflict, invalid transition or unknown update. Nothing was changed. */
    public static final int REJECTED = 2;
    public static final int STORAGE_ERROR = 3;

    @Override
    public int getExitCode(Throwable exception) {
        if (exception instanceof UpdateConflictException
                || exception instanceof InvalidTransitionException
                || exception instanceof UpdateNotFoundException
                || exception instanceof IllegalArgumentException) {
            return REJECTED;
        }
        if (exception instanceof StorageException) {
            return STORAGE_ERROR;
        }
        return CommandLine.ExitCode.SOFTWARE;
    }
}

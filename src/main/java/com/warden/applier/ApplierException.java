package com.warden.applier;

/**
 * The external applier could not perform or undo an update.
 * <p>
 * The state machine always catches it, records it against the update and
 * hands it back in the outcome.
 */
public class ApplierException extends Exception {

    /** Why the applier call ended without success. */
    public enum Reason {
        /** The applier ran and reported failure. */
        APPLIER_ERROR("applier_error"),
        /** The calling thread was interrupted or the call was cancelled. */
        CANCELLED("cancelled"),
        /** The applier did not finish within its time limit. */
        TIMEOUT("timeout");

        private final String code;

        Reason(String code) {
            this.code = code;
        }

        public String code() {
            return code;
        }
    }

    private final Reason reason;

    public ApplierException(String message) {
        this(message, Reason.APPLIER_ERROR, null);
    }

    public ApplierException(String message, Throwable cause) {
        this(message, Reason.APPLIER_ERROR, cause);
    }

    public ApplierException(String message, Reason reason, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public static ApplierException cancelled(String message, Throwable cause) {
        return new ApplierException(message, Reason.CANCELLED, cause);
    }

    public static ApplierException timedOut(String message) {
        return new ApplierException(message, Reason.TIMEOUT, null);
    }

    public Reason getReason() {
        return reason;
    }
}

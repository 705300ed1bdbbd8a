package com.warden.applier;

/**
 * Performs and undoes the actual effect of an update (installer, migration
 * runner, deployment agent).
 * Implementations: {@link ScriptApplier} (plugin scripts), {@link NoopApplier} (dry runs).
 * <p>
 * Calls may block for as long as the underlying work takes. Implementations
 * should respond to thread interruption by throwing
 * {@link ApplierException#cancelled}.
 */
public interface Applier {

    /**
     * Applies the update.
     *
     * @param name    logical update name
     * @param version version discriminator, may be {@code null}
     * @throws ApplierException if the update could not be applied
     */
    void apply(String name, String version) throws ApplierException;

    /**
     * Best-effort inverse of {@link #apply}.
     *
     * @throws ApplierException if the update could not be undone
     */
    void rollback(String name, String version) throws ApplierException;

    /** Short name for logs and health output. */
    default String describe() {
        return getClass().getSimpleName();
    }
}

package com.warden.core.logging;

import com.warden.core.model.UpdateRecord;
import org.slf4j.MDC;

/**
 * Utility for managing Warden-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setUpdate(UpdateRecord record) {
        setUpdate(record.id(), record.name(), record.version());
    }

    public static void setUpdate(long updateId, String name, String version) {
        MDC.put("updateId", String.valueOf(updateId));
        setIdentity(name, version);
    }

    public static void setIdentity(String name, String version) {
        MDC.put("updateName", name);
        if (version != null) {
            MDC.put("updateVersion", version);
        } else {
            MDC.remove("updateVersion");
        }
    }

    public static void setRecovery(String runId) {
        MDC.put("recoveryRun", runId);
    }

    public static void clearUpdate() {
        MDC.remove("updateId");
        MDC.remove("updateName");
        MDC.remove("updateVersion");
    }

    public static void clear() {
        clearUpdate();
        MDC.remove("recoveryRun");
    }
}

package com.warden.core.recovery;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Recovery settings, bound from {@code warden.recovery.*}.
 */
@Component
@ConfigurationProperties(prefix = "warden.recovery")
public class RecoveryProperties {

    /** Reconcile pending records before any command runs. */
    private boolean onStartup = true;

    public boolean isOnStartup() { return onStartup; }
    public void setOnStartup(boolean onStartup) { this.onStartup = onStartup; }
}

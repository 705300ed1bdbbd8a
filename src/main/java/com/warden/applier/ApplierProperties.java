package com.warden.applier;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Applier selection and limits, bound from {@code warden.applier.*}.
 *
 * <pre>
 * warden:
 *   applier:
 *     provider: script      # script | noop
 *     plugin-dir: ./plugins
 *     timeout-seconds: 600
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "warden.applier")
public class ApplierProperties {

    private static final Set<String> PROVIDERS = Set.of("script", "noop");

    private String provider = "script";
    private String pluginDir = "./plugins";
    private int timeoutSeconds = 600;

    @PostConstruct
    void validate() {
        if (provider == null || !PROVIDERS.contains(provider)) {
            throw new IllegalStateException("warden.applier.provider must be one of " + PROVIDERS + ", got: " + provider);
        }
        if ("script".equals(provider) && (pluginDir == null || pluginDir.isBlank())) {
            throw new IllegalStateException("warden.applier.plugin-dir is required when provider=script");
        }
        if (timeoutSeconds <= 0) {
            throw new IllegalStateException("warden.applier.timeout-seconds must be > 0");
        }
    }

    public String getProvider() { return provider; }
    public void setProvider(String provider) { this.provider = provider; }
    public String getPluginDir() { return pluginDir; }
    public void setPluginDir(String pluginDir) { this.pluginDir = pluginDir; }
    public int getTimeoutSeconds() { return timeoutSeconds; }
    public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
}

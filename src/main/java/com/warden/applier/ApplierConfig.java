package com.warden.applier;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Duration;

@Configuration
public class ApplierConfig {

    @Bean
    @ConditionalOnProperty(name = "warden.applier.provider", havingValue = "script", matchIfMissing = true)
    public Applier scriptApplier(ApplierProperties properties) {
        return new ScriptApplier(Path.of(properties.getPluginDir()), Duration.ofSeconds(properties.getTimeoutSeconds()));
    }

    @Bean
    @ConditionalOnProperty(name = "warden.applier.provider", havingValue = "noop")
    public Applier noopApplier() {
        return new NoopApplier();
    }
}

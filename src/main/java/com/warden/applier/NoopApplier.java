package com.warden.applier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applier that changes nothing. Selected with {@code warden.applier.provider=noop}
 * to record an update lifecycle without touching the system.
 */
public class NoopApplier implements Applier {

    private static final Logger log = LoggerFactory.getLogger(NoopApplier.class);

    @Override
    public void apply(String name, String version) {
        log.info("noop applier: apply {} {}", name, version != null ? version : "-");
    }

    @Override
    public void rollback(String name, String version) {
        log.info("noop applier: rollback {} {}", name, version != null ? version : "-");
    }

    @Override
    public String describe() {
        return "noop";
    }
}

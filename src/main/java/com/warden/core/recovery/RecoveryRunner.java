package com.warden.core.recovery;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Runs recovery once at startup, before the CLI dispatches a command that
 * changes update state. Read-only commands leave the ledger as they find it.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RecoveryRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(RecoveryRunner.class);

    static final Set<String> RECOVERING_COMMANDS = Set.of("serve", "apply", "rollback");

    private final RecoveryService recoveryService;
    private final RecoveryProperties properties;

    public RecoveryRunner(RecoveryService recoveryService, RecoveryProperties properties) {
        this.recoveryService = recoveryService;
        this.properties = properties;
    }

    @Override
    public void run(String... args) {
        if (!properties.isOnStartup()) {
            log.debug("Startup recovery disabled");
            return;
        }
        String command = commandName(args);
        if (command == null || !RECOVERING_COMMANDS.contains(command)) {
            log.debug("No startup recovery for command '{}'", command);
            return;
        }
        recoveryService.recover();
    }

    /** First argument that is not an option, i.e. the subcommand. */
    static String commandName(String... args) {
        for (String arg : args) {
            if (!arg.startsWith("-")) {
                return arg;
            }
        }
        return null;
    }
}

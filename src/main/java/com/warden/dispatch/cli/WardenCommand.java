package com.warden.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Warden.
 */
@Command(
        name = "warden",
        mixinStandardHelpOptions = true,
        version = "Warden 0.1.0",
        description = "Applies updates and keeps an append-only ledger of every transition",
        subcommands = {
                ApplyCommand.class,
                RollbackCommand.class,
                StatusCommand.class,
                ListCommand.class,
                EventsCommand.class,
                RecoverCommand.class,
                VerifyCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class WardenCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}

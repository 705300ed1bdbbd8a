package com.warden.dispatch.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * Parses CLI arguments and delegates to the appropriate command.
 */
@Component
@Order(Ordered.LOWEST_PRECEDENCE)
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);

    private final WardenCommand wardenCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(WardenCommand wardenCommand, IFactory factory) {
        this.wardenCommand = wardenCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        // In serve mode the embedded web server keeps the JVM alive; picocli would return immediately.
        for (String arg : args) {
            if ("serve".equals(arg)) {
                return;
            }
        }
        exitCode = newCommandLine(wardenCommand, factory).execute(args);
    }

    /**
     * Builds the command line with Warden's exit code mapping and error rendering.
     */
    static CommandLine newCommandLine(WardenCommand command, IFactory factory) {
        CommandLine commandLine = new CommandLine(command, factory);
        commandLine.setExitCodeExceptionMapper(new ExitCodes());
        commandLine.setExecutionExceptionHandler((ex, cmd, parseResult) -> {
            log.debug("Command '{}' failed", cmd.getCommandName(), ex);
            ConsoleOutput.error(ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName());
            return cmd.getExitCodeExceptionMapper().getExitCode(ex);
        });
        return commandLine;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}

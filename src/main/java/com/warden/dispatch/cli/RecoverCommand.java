package com.warden.dispatch.cli;

import com.warden.core.recovery.RecoveryReport;
import com.warden.core.recovery.RecoveryService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * CLI command: warden recover
 */
@Command(name = "recover", mixinStandardHelpOptions = true,
        description = "Fail updates left pending by a crashed process")
@Component
public class RecoverCommand implements Callable<Integer> {

    private final RecoveryService recoveryService;

    public RecoverCommand(RecoveryService recoveryService) {
        this.recoveryService = recoveryService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        RecoveryReport report = recoveryService.recover();
        ConsoleOutput.info("Examined " + report.examined() + " records");
        report.inFlight().forEach(id -> ConsoleOutput.info("Update " + id + ": still in progress in another process, left alone"));
        if (report.isClean()) {
            ConsoleOutput.success("Nothing to recover");
            return ExitCodes.OK;
        }
        report.interrupted().forEach(id -> ConsoleOutput.error("Update " + id + ": interrupted, marked failed"));
        report.resynced().forEach(id -> ConsoleOutput.info("Update " + id + ": re-synced from event log"));
        report.rollbacksClosed().forEach(id -> ConsoleOutput.info("Update " + id + ": interrupted rollback closed"));
        report.skipped().forEach(id -> ConsoleOutput.error("Update " + id + ": skipped, see log"));
        return ExitCodes.OK;
    }
}

package com.warden.dispatch.cli;

import com.warden.core.recovery.ProjectionMismatch;
import com.warden.core.recovery.RecoveryService;
import com.warden.core.recovery.VerificationReport;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * CLI command: warden verify
 * <p>
 * Replays every update's events and reports records that disagree with the
 * log. Read-only.
 */
@Command(name = "verify", mixinStandardHelpOptions = true,
        description = "Check stored states against the event log")
@Component
public class VerifyCommand implements Callable<Integer> {

    private final RecoveryService recoveryService;

    public VerifyCommand(RecoveryService recoveryService) {
        this.recoveryService = recoveryService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        VerificationReport report = recoveryService.verify();
        if (report.isConsistent()) {
            ConsoleOutput.success("All " + report.examined() + " records match the event log");
            return ExitCodes.OK;
        }
        for (ProjectionMismatch mismatch : report.mismatches()) {
            ConsoleOutput.error("Update " + mismatch.updateId() + ": " + mismatch.detail());
        }
        ConsoleOutput.error(report.mismatches().size() + " of " + report.examined() + " records inconsistent");
        return ExitCodes.REJECTED;
    }
}

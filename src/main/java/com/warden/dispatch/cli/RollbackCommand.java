package com.warden.dispatch.cli;

import com.warden.core.engine.UpdateStateMachine;
import com.warden.core.model.UpdateOutcome;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: warden rollback &lt;id&gt;
 */
@Command(name = "rollback", mixinStandardHelpOptions = true, description = "Roll back an applied or failed update")
@Component
public class RollbackCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Update ID")
    private long updateId;

    private final UpdateStateMachine stateMachine;

    public RollbackCommand(UpdateStateMachine stateMachine) {
        this.stateMachine = stateMachine;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        UpdateOutcome outcome = stateMachine.rollback(updateId);
        ConsoleOutput.record(outcome.record());
        System.out.println();
        if (outcome.isSuccess()) {
            ConsoleOutput.success("Update " + updateId + " rolled back");
            return ExitCodes.OK;
        }
        ConsoleOutput.error("Update " + updateId + " marked rolled back, but the inverse failed: "
                + outcome.failure().getMessage());
        return ExitCodes.APPLIER_FAILED;
    }
}

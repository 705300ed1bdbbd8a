package com.warden.dispatch.cli;

import com.warden.core.engine.UpdateStateMachine;
import com.warden.core.model.UpdateOutcome;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: warden apply &lt;name&gt; [-v VERSION]
 * <p>
 * Runs one apply attempt. Exits 1 when the applier failed (the failure is
 * recorded), 2 when another attempt for the same identity is still pending.
 */
@Command(name = "apply", mixinStandardHelpOptions = true, description = "Apply an update")
@Component
public class ApplyCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Update name")
    private String name;

    @Option(names = {"-v", "--update-version"}, description = "Update version")
    private String version;

    private final UpdateStateMachine stateMachine;

    public ApplyCommand(UpdateStateMachine stateMachine) {
        this.stateMachine = stateMachine;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Applying " + (version != null ? name + "@" + version : name));

        UpdateOutcome outcome = stateMachine.apply(name, version);
        ConsoleOutput.record(outcome.record());
        System.out.println();
        if (outcome.isSuccess()) {
            ConsoleOutput.success("Update " + outcome.record().id() + " applied");
            return ExitCodes.OK;
        }
        ConsoleOutput.error("Update " + outcome.record().id() + " failed: " + outcome.failure().getMessage());
        ConsoleOutput.info("Roll back with: warden rollback " + outcome.record().id());
        return ExitCodes.APPLIER_FAILED;
    }
}

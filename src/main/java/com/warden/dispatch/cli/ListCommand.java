package com.warden.dispatch.cli;

import com.warden.core.model.UpdateRecord;
import com.warden.core.model.UpdateState;
import com.warden.core.persistence.Ledger;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: warden list [--state S] [-n N]
 */
@Command(name = "list", mixinStandardHelpOptions = true, description = "List updates, newest first")
@Component
public class ListCommand implements Callable<Integer> {

    @Option(names = {"--state", "-s"}, description = "Only updates in this state (pending, applied, failed, rolled_back)")
    private String state;

    @Option(names = {"--limit", "-n"}, description = "Number of results", defaultValue = "20")
    private int limit;

    private final Ledger ledger;

    public ListCommand(Ledger ledger) {
        this.ledger = ledger;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        List<UpdateRecord> records;
        if (state != null) {
            records = ledger.updates().listRecentByState(UpdateState.fromWireName(state), limit);
        } else {
            records = ledger.updates().listAll(limit);
        }

        if (records.isEmpty()) {
            ConsoleOutput.info("No updates found.");
            return ExitCodes.OK;
        }

        ConsoleOutput.info("Updates (" + records.size() + "):");
        System.out.println();
        ConsoleOutput.recordTableHeader();
        records.forEach(ConsoleOutput::recordRow);
        return ExitCodes.OK;
    }
}

package com.warden.dispatch.cli;

import com.warden.core.events.Event;
import com.warden.core.model.UpdateRecord;
import com.warden.core.persistence.Ledger;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: warden status &lt;id&gt;
 * <p>
 * Shows one update record followed by its event history.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show an update and its history")
@Component
public class StatusCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Update ID")
    private long updateId;

    private final Ledger ledger;

    public StatusCommand(Ledger ledger) {
        this.ledger = ledger;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        UpdateRecord record = ledger.updates().get(updateId);
        ConsoleOutput.record(record);

        List<Event> events = ledger.events().readByReference(updateId);
        System.out.println();
        ConsoleOutput.info("History (" + events.size() + " events):");
        events.forEach(ConsoleOutput::event);
        return ExitCodes.OK;
    }
}

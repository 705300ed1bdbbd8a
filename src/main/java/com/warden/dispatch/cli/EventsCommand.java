package com.warden.dispatch.cli;

import com.warden.core.events.Event;
import com.warden.core.persistence.Ledger;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: warden events [--update ID] [--after ID] [-n N]
 * <p>
 * Prints the event log in append order. {@code --after} resumes from the last
 * id seen, so the log can be tailed in pages.
 */
@Command(name = "events", mixinStandardHelpOptions = true, description = "Show the event log")
@Component
public class EventsCommand implements Callable<Integer> {

    @Option(names = {"--update", "-u"}, description = "Only events of this update")
    private Long updateId;

    @Option(names = {"--after", "-a"}, description = "Only events with a greater id", defaultValue = "0")
    private long afterId;

    @Option(names = {"--limit", "-n"}, description = "Number of results", defaultValue = "50")
    private int limit;

    private final Ledger ledger;

    public EventsCommand(Ledger ledger) {
        this.ledger = ledger;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        List<Event> events;
        if (updateId != null) {
            events = ledger.events().readByReference(updateId).stream()
                    .filter(e -> e.id() > afterId)
                    .limit(limit)
                    .toList();
        } else {
            events = ledger.events().readAfter(afterId, limit);
        }

        if (events.isEmpty()) {
            ConsoleOutput.info("No events found.");
            return ExitCodes.OK;
        }
        events.forEach(ConsoleOutput::event);
        if (events.size() == limit) {
            System.out.println();
            ConsoleOutput.info("More may follow: --after " + events.get(events.size() - 1).id());
        }
        return ExitCodes.OK;
    }
}

package com.warden.dispatch.cli;

import com.warden.applier.Applier;
import com.warden.applier.ApplierException;
import com.warden.core.engine.UpdateStateMachine;
import com.warden.core.events.EventKind;
import com.warden.core.health.HealthCheckService;
import com.warden.core.health.HealthStatus;
import com.warden.core.metrics.WardenMetrics;
import com.warden.core.model.UpdateRecord;
import com.warden.core.model.UpdateState;
import com.warden.core.persistence.Ledger;
import com.warden.core.persistence.StorageException;
import com.warden.core.persistence.TestLedgers;
import com.warden.core.recovery.RecoveryService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Answers;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Tests for the Warden CLI command structure.
 * Commands run through picocli against a real SQLite ledger in a temp
 * directory, without a Spring context.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    @TempDir
    Path tempDir;

    private Ledger ledger;
    private Applier applier;
    private HealthCheckService healthCheckService;

    @BeforeEach
    void setUp() {
        ledger = TestLedgers.open(tempDir);
        applier = mock(Applier.class);
        healthCheckService = mock(HealthCheckService.class);
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("database", HealthStatus.Status.UP, "Database connection valid", Map.of()),
                new HealthStatus("ledger", HealthStatus.Status.UP, "Event log readable", Map.of()),
                new HealthStatus("applier", HealthStatus.Status.UP, "Applier available (noop)", Map.of())));
    }

    /**
     * Custom picocli IFactory that provides test dependencies for commands.
     */
    private CommandLine.IFactory createFactory(Ledger ledger) {
        var stateMachine = new UpdateStateMachine(ledger, applier, new WardenMetrics(new SimpleMeterRegistry()));
        var recoveryService = new RecoveryService(ledger, new WardenMetrics(new SimpleMeterRegistry()));
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == ApplyCommand.class) {
                    return (K) new ApplyCommand(stateMachine);
                }
                if (cls == RollbackCommand.class) {
                    return (K) new RollbackCommand(stateMachine);
                }
                if (cls == StatusCommand.class) {
                    return (K) new StatusCommand(ledger);
                }
                if (cls == ListCommand.class) {
                    return (K) new ListCommand(ledger);
                }
                if (cls == EventsCommand.class) {
                    return (K) new EventsCommand(ledger);
                }
                if (cls == RecoverCommand.class) {
                    return (K) new RecoverCommand(recoveryService);
                }
                if (cls == VerifyCommand.class) {
                    return (K) new VerifyCommand(recoveryService);
                }
                if (cls == HealthCommand.class) {
                    return (K) new HealthCommand(healthCheckService);
                }
                if (cls == ServeCommand.class) {
                    return (K) new ServeCommand();
                }
                // Default: use picocli's default factory for other classes
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        return execute(ledger, args);
    }

    private CliResult execute(Ledger ledger, String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = CliRunner.newCommandLine(new WardenCommand(), createFactory(ledger));
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    @Nested
    @DisplayName("Help")
    class HelpTests {

        @Test
        @DisplayName("--help lists every subcommand")
        void helpListsSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            for (String command : List.of("apply", "rollback", "status", "list", "events",
                    "recover", "verify", "health", "serve")) {
                assertTrue(result.output().contains(command), "help should mention " + command);
            }
        }

        @Test
        @DisplayName("--version prints the version")
        void version() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Warden 0.1.0"));
        }

        @Test
        @DisplayName("apply --help documents the version option")
        void applyHelp() {
            CliResult result = execute("apply", "--help");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("-v"));
        }
    }

    @Nested
    @DisplayName("Execution")
    class ExecutionTests {

        @Test
        @DisplayName("apply succeeds with exit 0 and records the update")
        void applySucceeds() {
            CliResult result = execute("apply", "kernel", "-v", "6.1");

            assertEquals(ExitCodes.OK, result.exitCode(), result.output());
            assertTrue(result.output().contains("applied"));
            assertEquals(1, ledger.updates().listByState(UpdateState.APPLIED).size());
        }

        @Test
        @DisplayName("apply exits 1 when the applier fails")
        void applyFails() throws Exception {
            doThrow(new ApplierException("disk full")).when(applier).apply(any(), any());

            CliResult result = execute("apply", "kernel");

            assertEquals(ExitCodes.APPLIER_FAILED, result.exitCode());
            assertTrue(result.output().contains("disk full"));
        }

        @Test
        @DisplayName("apply exits 2 when an attempt is already pending")
        void applyConflict() {
            ledger.updates().create("kernel", "6.1", null);

            CliResult result = execute("apply", "kernel", "-v", "6.1");

            assertEquals(ExitCodes.REJECTED, result.exitCode());
            assertTrue(result.output().contains("already pending"));
        }

        @Test
        @DisplayName("rollback twice exits 2 the second time")
        void rollbackTwice() {
            execute("apply", "kernel");
            long id = ledger.updates().listAll(1).get(0).id();

            assertEquals(ExitCodes.OK, execute("rollback", String.valueOf(id)).exitCode());
            CliResult second = execute("rollback", String.valueOf(id));

            assertEquals(ExitCodes.REJECTED, second.exitCode());
            assertTrue(second.output().contains("cannot move from rolled_back"));
        }

        @Test
        @DisplayName("status shows the record and its history")
        void status() {
            execute("apply", "kernel", "-v", "6.1");
            long id = ledger.updates().listAll(1).get(0).id();

            CliResult result = execute("status", String.valueOf(id));

            assertEquals(ExitCodes.OK, result.exitCode());
            assertTrue(result.output().contains("kernel"));
            assertTrue(result.output().contains("History (2 events)"));
        }

        @Test
        @DisplayName("status of an unknown update exits 2")
        void statusUnknown() {
            CliResult result = execute("status", "999");
            assertEquals(ExitCodes.REJECTED, result.exitCode());
            assertTrue(result.output().contains("999"));
        }

        @Test
        @DisplayName("list filters by state")
        void listByState() throws Exception {
            execute("apply", "good");
            doThrow(new ApplierException("x")).when(applier).apply("bad", null);
            execute("apply", "bad");

            CliResult result = execute("list", "--state", "failed");

            assertEquals(ExitCodes.OK, result.exitCode());
            assertTrue(result.output().contains("bad"));
            assertFalse(result.output().contains("good"));
        }

        @Test
        @DisplayName("list rejects an unknown state with exit 2")
        void listUnknownState() {
            assertEquals(ExitCodes.REJECTED, execute("list", "--state", "done").exitCode());
        }

        @Test
        @DisplayName("events pages with --after")
        void eventsPaging() {
            execute("apply", "kernel");
            long firstId = ledger.events().readAfter(0, 1).get(0).id();

            CliResult result = execute("events", "--after", String.valueOf(firstId), "-n", "5");

            assertEquals(ExitCodes.OK, result.exitCode());
            assertTrue(result.output().contains("[APPLIED]"));
            assertFalse(result.output().contains("[STARTED]"));
        }

        @Test
        @DisplayName("recover fails a crashed attempt")
        void recover() {
            UpdateRecord crashed = ledger.inTransaction(() -> {
                UpdateRecord record = ledger.updates().create("kernel", null, null);
                ledger.events().append(EventKind.UPDATE_STARTED, Map.of("updateId", record.id()));
                return record;
            });

            CliResult result = execute("recover");

            assertEquals(ExitCodes.OK, result.exitCode());
            assertTrue(result.output().contains("interrupted"));
            assertEquals(UpdateState.FAILED, ledger.updates().get(crashed.id()).state());
        }

        @Test
        @DisplayName("verify exits 0 on a consistent ledger and 2 otherwise")
        void verify() {
            execute("apply", "kernel");
            assertEquals(ExitCodes.OK, execute("verify").exitCode());

            long id = ledger.updates().listAll(1).get(0).id();
            ledger.updates().setState(id, UpdateState.FAILED, null);
            assertEquals(ExitCodes.REJECTED, execute("verify").exitCode());
        }

        @Test
        @DisplayName("health shows each component")
        void health() {
            CliResult result = execute("health");
            assertEquals(ExitCodes.OK, result.exitCode());
            assertTrue(result.output().contains("all systems operational"));
        }

        @Test
        @DisplayName("storage failures exit 3")
        void storageFailure() {
            Ledger broken = mock(Ledger.class, Answers.RETURNS_DEEP_STUBS);
            when(broken.updates().get(1L)).thenThrow(new StorageException("database is locked"));

            CliResult result = execute(broken, "status", "1");

            assertEquals(ExitCodes.STORAGE_ERROR, result.exitCode());
            assertTrue(result.output().contains("database is locked"));
        }
    }
}

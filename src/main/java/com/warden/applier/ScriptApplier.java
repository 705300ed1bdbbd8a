package com.warden.applier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

/**
 * Applies updates by running plugin scripts.
 * <p>
 * For an update named {@code agent}, {@code apply} runs
 * {@code <plugin-dir>/agent/apply [version]} and {@code rollback} runs
 * {@code <plugin-dir>/agent/rollback [version]} (a {@code .sh} suffix is also
 * accepted). The script's working directory is its plugin directory, and it
 * receives {@code WARDEN_UPDATE_NAME}, {@code WARDEN_UPDATE_VERSION} and
 * {@code WARDEN_ACTION} in its environment. Exit code 0 is success.
 */
public class ScriptApplier implements Applier {

    private static final Logger log = LoggerFactory.getLogger(ScriptApplier.class);

    private static final Pattern SAFE_NAME = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]*");
    private static final int TAIL_LINES = 20;

    private final Path pluginDir;
    private final Duration timeout;

    public ScriptApplier(Path pluginDir, Duration timeout) {
        this.pluginDir = pluginDir.toAbsolutePath().normalize();
        this.timeout = timeout;
    }

    @Override
    public void apply(String name, String version) throws ApplierException {
        run("apply", name, version);
    }

    @Override
    public void rollback(String name, String version) throws ApplierException {
        run("rollback", name, version);
    }

    @Override
    public String describe() {
        return "script (" + pluginDir + ")";
    }

    public Path getPluginDir() {
        return pluginDir;
    }

    /**
     * Resolves the script for an action, rejecting names that could escape the
     * plugin directory.
     */
    Path resolveScript(String name, String action) throws ApplierException {
        if (name == null || !SAFE_NAME.matcher(name).matches() || name.contains("..")) {
            throw new ApplierException("Invalid update name for script applier: " + name);
        }
        Path updateDir = pluginDir.resolve(name).normalize();
        if (!updateDir.startsWith(pluginDir)) {
            throw new ApplierException("Update name escapes plugin directory: " + name);
        }
        for (Path candidate : List.of(updateDir.resolve(action), updateDir.resolve(action + ".sh"))) {
            if (Files.isRegularFile(candidate)) {
                if (!Files.isExecutable(candidate)) {
                    throw new ApplierException("Script is not executable: " + candidate);
                }
                return candidate;
            }
        }
        throw new ApplierException("No " + action + " script for '" + name + "' in " + updateDir);
    }

    private void run(String action, String name, String version) throws ApplierException {
        Path script = resolveScript(name, action);
        List<String> command = new ArrayList<>();
        command.add(script.toString());
        if (version != null) {
            command.add(version);
        }

        log.info("Running {} script for {} {}: {}", action, name, version != null ? version : "-", script);

        Process process;
        try {
            ProcessBuilder builder = new ProcessBuilder(command)
                    .directory(script.getParent().toFile())
                    .redirectErrorStream(true);
            Map<String, String> env = builder.environment();
            env.put("WARDEN_UPDATE_NAME", name);
            env.put("WARDEN_UPDATE_VERSION", version != null ? version : "");
            env.put("WARDEN_ACTION", action);
            process = builder.start();
        } catch (IOException e) {
            throw new ApplierException("Failed to start " + action + " script " + script, e);
        }

        OutputDrain drain = new OutputDrain(process, name + "/" + action);
        Thread drainer = new Thread(drain, "warden-script-" + name);
        drainer.setDaemon(true);
        drainer.start();

        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw ApplierException.timedOut(action + " script for " + name + " timed out after " + timeout.toSeconds() + "s");
            }
            drainer.join(TimeUnit.SECONDS.toMillis(5));
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw ApplierException.cancelled(action + " script for " + name + " was cancelled", e);
        }

        int exitCode = process.exitValue();
        if (exitCode != 0) {
            String lastLine = drain.lastLine();
            throw new ApplierException(action + " script for " + name + " exited with code " + exitCode
                    + (lastLine != null ? ": " + lastLine : ""));
        }
        log.info("{} script for {} completed", action, name);
    }

    /** Streams script output into the log, keeping the tail for error messages. */
    private static final class OutputDrain implements Runnable {

        private final Process process;
        private final String label;
        private final Deque<String> tail = new ArrayDeque<>();

        OutputDrain(Process process, String label) {
            this.process = process;
            this.label = label;
        }

        @Override
        public void run() {
            try (var reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    log.info("[{}] {}", label, line);
                    synchronized (tail) {
                        tail.addLast(line);
                        if (tail.size() > TAIL_LINES) {
                            tail.removeFirst();
                        }
                    }
                }
            } catch (IOException e) {
                log.debug("Output stream for {} closed: {}", label, e.getMessage());
            }
        }

        String lastLine() {
            synchronized (tail) {
                for (var it = tail.descendingIterator(); it.hasNext(); ) {
                    String line = it.next();
                    if (!line.isBlank()) {
                        return line.strip();
                    }
                }
                return null;
            }
        }
    }
}

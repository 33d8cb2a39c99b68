package io.quorum.cli.worker;

import io.quorum.core.partition.WorkUnit;
import io.quorum.core.roster.WorkerRole;
import io.quorum.core.worker.InvocationException;
import io.quorum.core.worker.PromptPayload;
import io.quorum.core.worker.Worker;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/// Worker that delegates each analysis to an external command.
///
/// The command runs through `/bin/sh -c` in the corpus directory. The rendered
/// prompt is written to its standard input and whatever it prints on standard
/// output is the raw worker output. The unit and role are also exported as
/// environment variables, so one script can serve every role:
///
/// | Variable | Value |
/// |----------|-------|
/// | `QUORUM_ROLE` | role id, e.g. `design` |
/// | `QUORUM_UNIT_ID` | unit id, e.g. `U3` |
/// | `QUORUM_UNIT_LABEL` | unit label, usually its directory |
/// | `QUORUM_UNIT_PATTERNS` | the unit's resource globs, space separated |
///
/// A non-zero exit status is reported as a transient failure so the dispatcher
/// retries it once. A command that cannot be started is a permanent failure.
///
/// @implNote Thread-safe. Output is buffered in temporary files, so a command that
/// writes before it finishes reading its input cannot block on a full pipe.
/// Interrupting the calling thread (timeout or cancellation) kills the process.
public class CommandWorker implements Worker {

    private static final Logger logger = Logger.getLogger(CommandWorker.class.getName());

    private static final int MAX_ERROR_CHARS = 500;

    private final String command;
    private final Path workingDirectory;

    /// @param command shell command line, not blank
    /// @param workingDirectory directory the command runs in, not null
    public CommandWorker(String command, Path workingDirectory) {
        if (command == null || command.isBlank()) {
            throw new IllegalArgumentException("command must not be blank");
        }
        this.command = command;
        this.workingDirectory = workingDirectory;
    }

    @Override
    public String invoke(WorkUnit unit, WorkerRole role, PromptPayload payload)
            throws InvocationException {
        Path stdout = null;
        Path stderr = null;
        Process process = null;
        try {
            stdout = Files.createTempFile("quorum-" + unit.id() + "-" + role.id(), ".out");
            stderr = Files.createTempFile("quorum-" + unit.id() + "-" + role.id(), ".err");

            ProcessBuilder builder =
                    new ProcessBuilder(List.of("/bin/sh", "-c", command))
                            .directory(workingDirectory.toFile())
                            .redirectOutput(stdout.toFile())
                            .redirectError(stderr.toFile());
            Map<String, String> env = builder.environment();
            env.put("QUORUM_ROLE", role.id());
            env.put("QUORUM_UNIT_ID", unit.id());
            env.put("QUORUM_UNIT_LABEL", unit.label());
            env.put("QUORUM_UNIT_PATTERNS", String.join(" ", unit.resourcePatterns()));

            try {
                process = builder.start();
            } catch (IOException e) {
                throw new InvocationException(
                        "cannot start worker command: " + e.getMessage(), false, e);
            }

            try (OutputStream in = process.getOutputStream()) {
                in.write(payload.text().getBytes(StandardCharsets.UTF_8));
            } catch (IOException e) {
                // The command may exit without reading its input
                logger.fine("Worker command closed stdin early: " + e.getMessage());
            }

            int exit = process.waitFor();
            if (exit != 0) {
                throw InvocationException.transientFailure(
                        "worker command exited with status " + exit + errorTail(stderr));
            }
            return Files.readString(stdout, StandardCharsets.UTF_8);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw InvocationException.permanentFailure("worker command interrupted");
        } catch (IOException e) {
            throw new InvocationException("worker command I/O failed: " + e.getMessage(), true, e);
        } finally {
            if (process != null && process.isAlive()) {
                process.destroyForcibly();
            }
            deleteQuietly(stdout);
            deleteQuietly(stderr);
        }
    }

    private static String errorTail(Path stderr) throws IOException {
        String text = Files.readString(stderr, StandardCharsets.UTF_8).strip();
        if (text.isEmpty()) {
            return "";
        }
        if (text.length() > MAX_ERROR_CHARS) {
            text = "..." + text.substring(text.length() - MAX_ERROR_CHARS);
        }
        return ": " + text;
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            logger.fine("Could not delete " + file + ": " + e.getMessage());
        }
    }

    public String getCommand() {
        return command;
    }
}

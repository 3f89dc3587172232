package com.teknolojikpanda.findings.triage.sink;

import com.teknolojikpanda.findings.synth.api.TaskTracker;
import com.teknolojikpanda.findings.synth.api.TaskTrackerException;
import com.teknolojikpanda.findings.synth.model.TaskPriority;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Creates tasks with the beads command line ({@code bd create}). The new task id is read from
 * the command output.
 */
public class BeadsCliTaskTracker implements TaskTracker {

    private static final Logger log = LoggerFactory.getLogger(BeadsCliTaskTracker.class);
    private static final Pattern TASK_ID = Pattern.compile("\\bbd-[a-z0-9]+\\b");

    /**
     * Runs an external command. Replaced in tests.
     */
    @FunctionalInterface
    public interface CommandRunner {
        @Nonnull
        CommandResult run(@Nonnull List<String> command) throws IOException, InterruptedException;
    }

    public static final class CommandResult {
        private final int exitCode;
        private final String output;

        public CommandResult(int exitCode, @Nonnull String output) {
            this.exitCode = exitCode;
            this.output = Objects.requireNonNull(output, "output");
        }

        public int getExitCode() {
            return exitCode;
        }

        @Nonnull
        public String getOutput() {
            return output;
        }
    }

    private final String executable;
    private final CommandRunner runner;

    public BeadsCliTaskTracker(@Nonnull String executable, @Nonnull CommandRunner runner) {
        this.executable = Objects.requireNonNull(executable, "executable");
        this.runner = Objects.requireNonNull(runner, "runner");
    }

    /**
     * Runs {@code bd} from the PATH inside {@code workingDirectory}.
     */
    public static BeadsCliTaskTracker inDirectory(@Nonnull Path workingDirectory, @Nonnull Duration timeout) {
        return new BeadsCliTaskTracker("bd", new ProcessCommandRunner(workingDirectory, timeout));
    }

    @Nonnull
    @Override
    public String createTask(@Nonnull String title,
                             @Nonnull String description,
                             @Nonnull TaskPriority priority,
                             @Nonnull List<String> labels) throws TaskTrackerException {
        List<String> command = buildCommand(title, description, priority, labels);
        CommandResult result;
        try {
            result = runner.run(command);
        } catch (IOException e) {
            throw new TaskTrackerException("Failed to run " + executable + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TaskTrackerException("Interrupted while running " + executable, e);
        }
        if (result.getExitCode() != 0) {
            throw new TaskTrackerException(executable + " create exited with " + result.getExitCode()
                    + ": " + abbreviate(result.getOutput()));
        }
        Matcher matcher = TASK_ID.matcher(result.getOutput());
        if (!matcher.find()) {
            throw new TaskTrackerException("No task id in " + executable + " output: " + abbreviate(result.getOutput()));
        }
        String id = matcher.group();
        log.debug("Created beads task {} for '{}'", id, title);
        return id;
    }

    List<String> buildCommand(String title, String description, TaskPriority priority, List<String> labels) {
        List<String> command = new ArrayList<>();
        command.add(executable);
        command.add("create");
        command.add(title);
        if (!description.isEmpty()) {
            command.add("--body");
            command.add(description);
        }
        command.add("--priority");
        command.add(String.valueOf(priority.getLevel()));
        if (!labels.isEmpty()) {
            command.add("--labels");
            command.add(String.join(",", labels));
        }
        return command;
    }

    private static String abbreviate(String output) {
        String trimmed = output.trim().replace('\n', ' ');
        return trimmed.length() > 200 ? trimmed.substring(0, 200) + "..." : trimmed;
    }

    /**
     * {@link ProcessBuilder} based runner; stderr is merged into the output.
     */
    public static final class ProcessCommandRunner implements CommandRunner {
        private final Path workingDirectory;
        private final Duration timeout;

        public ProcessCommandRunner(@Nonnull Path workingDirectory, @Nonnull Duration timeout) {
            this.workingDirectory = Objects.requireNonNull(workingDirectory, "workingDirectory");
            this.timeout = Objects.requireNonNull(timeout, "timeout");
        }

        @Nonnull
        @Override
        public CommandResult run(@Nonnull List<String> command) throws IOException, InterruptedException {
            Process process = new ProcessBuilder(command)
                    .directory(workingDirectory.toFile())
                    .redirectErrorStream(true)
                    .start();
            ByteArrayOutputStream buffer = new ByteArrayOutputStream();
            Thread pump = new Thread(() -> copy(process.getInputStream(), buffer), "bd-output");
            pump.setDaemon(true);
            pump.start();
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new IOException("Command timed out after " + timeout.toMillis() + " ms");
            }
            pump.join(TimeUnit.SECONDS.toMillis(1));
            String output;
            synchronized (buffer) {
                output = new String(buffer.toByteArray(), StandardCharsets.UTF_8);
            }
            return new CommandResult(process.exitValue(), output);
        }

        private static void copy(InputStream in, ByteArrayOutputStream out) {
            byte[] chunk = new byte[4096];
            try (InputStream input = in) {
                int read;
                while ((read = input.read(chunk)) != -1) {
                    synchronized (out) {
                        out.write(chunk, 0, read);
                    }
                }
            } catch (IOException e) {
                log.debug("Stopped reading command output: {}", e.getMessage());
            }
        }
    }
}

package io.minicron.core.exec;

import io.minicron.core.log.RunStatus;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs job commands through {@code /bin/sh -c}. A command that outlives its timeout is killed
 * together with the processes it spawned.
 */
public final class ShellCommandExecutor implements CommandExecutor {
    private static final Logger LOG = LoggerFactory.getLogger(ShellCommandExecutor.class);
    private static final long KILL_GRACE_MILLIS = 500;
    private static final long DRAIN_GRACE_MILLIS = 2_000;
    private static final AtomicLong SEQUENCE = new AtomicLong();

    private final Path workingDirectory;
    private final int maxOutputBytes;

    public ShellCommandExecutor(Path workingDirectory, int maxOutputBytes) {
        if (maxOutputBytes < 0) {
            throw new IllegalArgumentException("maxOutputBytes must not be negative");
        }
        this.workingDirectory = workingDirectory;
        this.maxOutputBytes = maxOutputBytes;
    }

    @Override
    public ExecutionResult run(String command, Duration timeout) throws IOException {
        Objects.requireNonNull(command, "command must not be null");
        Objects.requireNonNull(timeout, "timeout must not be null");

        ProcessBuilder builder = new ProcessBuilder("/bin/sh", "-c", command);
        if (workingDirectory != null) {
            builder.directory(workingDirectory.toFile());
        }
        long started = System.nanoTime();
        Process process = builder.start();
        process.getOutputStream().close();

        long seq = SEQUENCE.incrementAndGet();
        OutputCapture stdout = new OutputCapture(process.getInputStream(), maxOutputBytes, "minicron-stdout-" + seq).start();
        OutputCapture stderr = new OutputCapture(process.getErrorStream(), maxOutputBytes, "minicron-stderr-" + seq).start();

        try {
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                LOG.warn("Command exceeded timeout of {}ms, killing pid {}", timeout.toMillis(), process.pid());
                terminate(process);
                return new ExecutionResult(
                    RunStatus.TIMED_OUT,
                    null,
                    stdout.await(DRAIN_GRACE_MILLIS),
                    stderr.await(DRAIN_GRACE_MILLIS),
                    elapsedSince(started)
                );
            }
            int exitCode = process.exitValue();
            return ExecutionResult.exited(
                exitCode,
                stdout.await(DRAIN_GRACE_MILLIS),
                stderr.await(DRAIN_GRACE_MILLIS),
                elapsedSince(started)
            );
        } catch (InterruptedException e) {
            terminate(process);
            Thread.currentThread().interrupt();
            return new ExecutionResult(
                RunStatus.INTERRUPTED,
                null,
                "",
                "execution interrupted while the scheduler was stopping",
                elapsedSince(started)
            );
        }
    }

    private static void terminate(Process process) {
        // The shell goes first so it cannot start the next command once a child dies.
        List<ProcessHandle> descendants = process.descendants().collect(Collectors.toList());
        process.destroyForcibly();
        descendants.forEach(ProcessHandle::destroy);
        try {
            process.waitFor(KILL_GRACE_MILLIS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        descendants.stream().filter(ProcessHandle::isAlive).forEach(ProcessHandle::destroyForcibly);
    }

    private static Duration elapsedSince(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos);
    }
}

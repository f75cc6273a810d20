package io.minicron.core.exec;

import io.minicron.core.log.RunStatus;
import java.time.Duration;
import java.util.Objects;

public record ExecutionResult(
    RunStatus status,
    Integer exitCode,
    String stdout,
    String stderr,
    Duration duration
) {

    public ExecutionResult {
        Objects.requireNonNull(status, "status must not be null");
        stdout = stdout == null ? "" : stdout;
        stderr = stderr == null ? "" : stderr;
        duration = duration == null ? Duration.ZERO : duration;
    }

    public static ExecutionResult exited(int exitCode, String stdout, String stderr, Duration duration) {
        return new ExecutionResult(
            exitCode == 0 ? RunStatus.SUCCEEDED : RunStatus.FAILED,
            exitCode,
            stdout,
            stderr,
            duration
        );
    }

    public static ExecutionResult error(String message, Duration duration) {
        return new ExecutionResult(RunStatus.ERROR, null, "", message, duration);
    }
}

package io.minicron.core.log;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.minicron.core.exec.ExecutionResult;
import java.time.Duration;
import java.time.Instant;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ExecutionLogEntry(
    @JsonProperty("job_id") String jobId,
    @JsonProperty("started_at") Instant startedAt,
    @JsonProperty("finished_at") Instant finishedAt,
    @JsonProperty("exit_status") RunStatus exitStatus,
    @JsonProperty("exit_code") Integer exitCode,
    @JsonProperty("stdout_excerpt") String stdoutExcerpt,
    @JsonProperty("stderr_excerpt") String stderrExcerpt,
    @JsonProperty("triggered_by") TriggerSource triggeredBy,
    @JsonProperty("duration_ms") long durationMs
) {

    public static ExecutionLogEntry completed(
        String jobId,
        Instant startedAt,
        Instant finishedAt,
        TriggerSource triggeredBy,
        ExecutionResult result
    ) {
        return new ExecutionLogEntry(
            jobId,
            startedAt,
            finishedAt,
            result.status(),
            result.exitCode(),
            result.stdout(),
            result.stderr(),
            triggeredBy,
            result.duration().toMillis()
        );
    }

    public static ExecutionLogEntry skipped(String jobId, Instant at, Instant runningSince) {
        return new ExecutionLogEntry(
            jobId,
            at,
            at,
            RunStatus.SKIPPED,
            null,
            "",
            "previous execution still running since " + runningSince,
            TriggerSource.SCHEDULER,
            0
        );
    }

    public static ExecutionLogEntry interrupted(String jobId, Instant startedAt, Instant recoveredAt) {
        return new ExecutionLogEntry(
            jobId,
            startedAt,
            recoveredAt,
            RunStatus.INTERRUPTED,
            null,
            "",
            "execution did not finish before the scheduler stopped",
            TriggerSource.SCHEDULER,
            Math.max(0, Duration.between(startedAt, recoveredAt).toMillis())
        );
    }
}

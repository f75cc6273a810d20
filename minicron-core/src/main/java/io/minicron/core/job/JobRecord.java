package io.minicron.core.job;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.minicron.core.log.RunStatus;
import java.time.Instant;

@JsonIgnoreProperties(ignoreUnknown = true)
public record JobRecord(
    String id,
    String name,
    @JsonProperty("cron_expression") String cronExpression,
    String command,
    String description,
    boolean enabled,
    @JsonProperty("timeout_seconds") Integer timeoutSeconds,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("updated_at") Instant updatedAt,
    @JsonProperty("last_run_at") Instant lastRunAt,
    @JsonProperty("last_status") RunStatus lastStatus,
    @JsonProperty("next_run_at") Instant nextRunAt,
    JobState state,
    @JsonProperty("consecutive_failures") int consecutiveFailures
) {

    public JobRecord {
        state = state == null ? JobState.IDLE : state;
        description = description == null ? "" : description;
    }

    JobRecord withRunning(Instant startedAt, Instant next) {
        return new JobRecord(id, name, cronExpression, command, description, enabled, timeoutSeconds,
            createdAt, updatedAt, startedAt, lastStatus, next, JobState.RUNNING, consecutiveFailures);
    }

    JobRecord withCompletion(RunStatus status, Instant next) {
        int failures = status.isSuccess() ? 0 : consecutiveFailures + 1;
        return new JobRecord(id, name, cronExpression, command, description, enabled, timeoutSeconds,
            createdAt, updatedAt, lastRunAt, status, next, JobState.IDLE, failures);
    }

    JobRecord withNextRunAt(Instant next) {
        return new JobRecord(id, name, cronExpression, command, description, enabled, timeoutSeconds,
            createdAt, updatedAt, lastRunAt, lastStatus, next, state, consecutiveFailures);
    }
}

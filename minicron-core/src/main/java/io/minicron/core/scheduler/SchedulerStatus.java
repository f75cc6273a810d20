package io.minicron.core.scheduler;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

public record SchedulerStatus(
    boolean running,
    @JsonProperty("poll_interval_ms") long pollIntervalMs,
    @JsonProperty("total_jobs") int totalJobs,
    @JsonProperty("enabled_jobs") int enabledJobs,
    @JsonProperty("running_jobs") int runningJobs,
    @JsonProperty("max_concurrent_runs") int maxConcurrentRuns,
    @JsonProperty("last_tick_at") Instant lastTickAt
) {
}

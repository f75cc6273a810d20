package io.minicron.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.minicron.core.scheduler.SchedulerSettings;
import java.time.Duration;
import java.time.ZoneId;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SchedulerConfig(
    long pollIntervalMs,
    int maxConcurrentRuns,
    int queueCapacity,
    int defaultTimeoutSeconds,
    int maxOutputBytes,
    String timezone,
    String workingDirectory,
    int cooldownAfterFailures,
    int cooldownSeconds,
    int shutdownGraceSeconds
) {

    public static SchedulerConfig defaults() {
        return new SchedulerConfig(
            30_000,
            4,
            0,
            300,
            16_384,
            "",
            "",
            0,
            0,
            10
        );
    }

    public SchedulerSettings toSettings() {
        return new SchedulerSettings(
            Duration.ofMillis(pollIntervalMs),
            maxConcurrentRuns,
            queueCapacity,
            Duration.ofSeconds(defaultTimeoutSeconds),
            cooldownAfterFailures,
            Duration.ofSeconds(cooldownSeconds),
            Duration.ofSeconds(shutdownGraceSeconds)
        );
    }

    public ZoneId zone() {
        return timezone == null || timezone.isBlank() ? ZoneId.systemDefault() : ZoneId.of(timezone.trim());
    }
}

package io.minicron.core.scheduler;

import java.time.Duration;
import java.util.Objects;

// The poll interval may not exceed one minute or occurrences could be missed.
public record SchedulerSettings(
    Duration pollInterval,
    int maxConcurrentRuns,
    int queueCapacity,
    Duration defaultTimeout,
    int cooldownAfterFailures,
    Duration cooldown,
    Duration shutdownGrace
) {
    public static final Duration MAX_POLL_INTERVAL = Duration.ofMinutes(1);

    public SchedulerSettings {
        Objects.requireNonNull(pollInterval, "pollInterval must not be null");
        Objects.requireNonNull(defaultTimeout, "defaultTimeout must not be null");
        cooldown = cooldown == null ? Duration.ZERO : cooldown;
        shutdownGrace = shutdownGrace == null ? Duration.ZERO : shutdownGrace;
        if (pollInterval.isZero() || pollInterval.isNegative() || pollInterval.compareTo(MAX_POLL_INTERVAL) > 0) {
            throw new IllegalArgumentException("pollInterval must be between 1ms and 60s");
        }
        if (maxConcurrentRuns < 1) {
            throw new IllegalArgumentException("maxConcurrentRuns must be >= 1");
        }
        if (queueCapacity < 0) {
            throw new IllegalArgumentException("queueCapacity must be >= 0");
        }
        if (defaultTimeout.isZero() || defaultTimeout.isNegative()) {
            throw new IllegalArgumentException("defaultTimeout must be positive");
        }
        if (cooldownAfterFailures < 0 || cooldown.isNegative()) {
            throw new IllegalArgumentException("cooldown settings must not be negative");
        }
    }

    public static SchedulerSettings defaults() {
        return new SchedulerSettings(
            Duration.ofSeconds(30),
            4,
            0,
            Duration.ofMinutes(5),
            0,
            Duration.ZERO,
            Duration.ofSeconds(10)
        );
    }

    public SchedulerSettings withPollInterval(Duration interval) {
        return new SchedulerSettings(
            interval, maxConcurrentRuns, queueCapacity, defaultTimeout, cooldownAfterFailures, cooldown, shutdownGrace);
    }

    public SchedulerSettings withMaxConcurrentRuns(int max) {
        return new SchedulerSettings(
            pollInterval, max, queueCapacity, defaultTimeout, cooldownAfterFailures, cooldown, shutdownGrace);
    }

    public SchedulerSettings withCooldown(int afterFailures, Duration duration) {
        return new SchedulerSettings(
            pollInterval, maxConcurrentRuns, queueCapacity, defaultTimeout, afterFailures, duration, shutdownGrace);
    }

    boolean cooldownEnabled() {
        return cooldownAfterFailures > 0 && !cooldown.isZero();
    }
}

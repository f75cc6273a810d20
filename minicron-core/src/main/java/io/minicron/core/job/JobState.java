package io.minicron.core.job;

import com.fasterxml.jackson.annotation.JsonProperty;

// Only IDLE and RUNNING are persisted. DUE and COOLDOWN are derived from the clock.
public enum JobState {
    @JsonProperty("idle") IDLE,
    @JsonProperty("due") DUE,
    @JsonProperty("running") RUNNING,
    @JsonProperty("cooldown") COOLDOWN
}

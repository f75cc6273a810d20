package io.minicron.core.log;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum TriggerSource {
    @JsonProperty("scheduler") SCHEDULER,
    @JsonProperty("manual") MANUAL
}

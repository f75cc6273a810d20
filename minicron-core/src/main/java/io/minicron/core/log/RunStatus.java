package io.minicron.core.log;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum RunStatus {
    @JsonProperty("succeeded") SUCCEEDED,
    @JsonProperty("failed") FAILED,
    @JsonProperty("timed_out") TIMED_OUT,
    @JsonProperty("error") ERROR,
    @JsonProperty("interrupted") INTERRUPTED,
    @JsonProperty("skipped") SKIPPED;

    public boolean isSuccess() {
        return this == SUCCEEDED;
    }
}

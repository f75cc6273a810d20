package io.minicron.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record MinicronConfig(
    SchedulerConfig scheduler,
    GatewayConfig gateway,
    StorageConfig storage
) {

    public static MinicronConfig defaults() {
        return new MinicronConfig(
            SchedulerConfig.defaults(),
            GatewayConfig.defaults(),
            StorageConfig.defaults()
        );
    }
}

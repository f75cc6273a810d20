package io.minicron.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record GatewayConfig(
    String host,
    int port,
    List<String> allowedOrigins
) {

    public static GatewayConfig defaults() {
        return new GatewayConfig(
            "127.0.0.1",
            8787,
            List.of("http://localhost", "http://127.0.0.1")
        );
    }
}

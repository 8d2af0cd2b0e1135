package io.tiergate.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record GatewayConfig(
    String host,
    int port
) {

    public GatewayConfig {
        host = host == null || host.isBlank() ? "0.0.0.0" : host.trim();
        port = port < 0 ? 8788 : port;
    }

    public static GatewayConfig defaults() {
        return new GatewayConfig("0.0.0.0", 8788);
    }
}

package io.tiergate.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Locale;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StoreConfig(
    String backend,
    String path,
    int busyTimeoutMs,
    int retryAttempts
) {

    public StoreConfig {
        backend = backend == null || backend.isBlank() ? "sqlite" : backend.trim().toLowerCase(Locale.ROOT);
        path = path == null || path.isBlank() ? "~/.tiergate/data" : path.trim();
        busyTimeoutMs = busyTimeoutMs <= 0 ? 5_000 : busyTimeoutMs;
        retryAttempts = Math.max(1, retryAttempts);
    }

    public static StoreConfig defaults() {
        return new StoreConfig("sqlite", "~/.tiergate/data", 5_000, 3);
    }
}

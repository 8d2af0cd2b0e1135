package io.tiergate.core.config;

import java.nio.file.Path;

public final class ConfigPaths {

    private ConfigPaths() {
    }

    public static Path defaultConfigPath() {
        String override = System.getenv("TIERGATE_CONFIG");
        if (override != null && !override.isBlank()) {
            return expand(override.trim());
        }
        return Path.of(System.getProperty("user.home"), ".tiergate", "config.json");
    }

    public static Path resolveDataDir(String rawPath) {
        if (rawPath == null || rawPath.isBlank()) {
            return Path.of(System.getProperty("user.home"), ".tiergate", "data");
        }
        return expand(rawPath);
    }

    private static Path expand(String rawPath) {
        if (rawPath.startsWith("~/")) {
            return Path.of(System.getProperty("user.home")).resolve(rawPath.substring(2));
        }
        return Path.of(rawPath);
    }
}

package io.tiergate.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.tiergate.core.config.model.PaymentsConfig;
import io.tiergate.core.config.model.TiergateConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Loads {@code config.json} deep-merged over {@link TiergateConfig#defaults()}. Payment secrets may come
 * from the environment instead of the file.
 */
public final class ConfigService {
    static final String ENV_WEBHOOK_SECRET = "TIERGATE_WEBHOOK_SECRET";
    static final String ENV_KEY_ID = "RAZORPAY_KEY_ID";
    static final String ENV_KEY_SECRET = "RAZORPAY_KEY_SECRET";

    private final ObjectMapper mapper;
    private final Map<String, String> environment;

    public ConfigService() {
        this(System.getenv());
    }

    public ConfigService(Map<String, String> environment) {
        this.environment = environment == null ? Map.of() : Map.copyOf(environment);
        mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public TiergateConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            return applyEnvironment(TiergateConfig.defaults());
        }

        JsonNode defaultsNode = mapper.valueToTree(TiergateConfig.defaults());
        JsonNode existingNode = mapper.readTree(Files.readString(configPath));
        JsonNode merged = deepMerge(defaultsNode, existingNode);
        return applyEnvironment(mapper.treeToValue(merged, TiergateConfig.class));
    }

    public void save(Path configPath, TiergateConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Files.createDirectories(configPath.toAbsolutePath().getParent());
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        Files.writeString(configPath, json + System.lineSeparator());
    }

    public InitResult init(Path configPath, boolean overwrite) throws IOException {
        boolean created = !Files.exists(configPath);
        boolean overwritten = false;

        TiergateConfig config;
        if (created || overwrite) {
            config = TiergateConfig.defaults();
            overwritten = !created && overwrite;
            save(configPath, config);
        } else {
            config = load(configPath);
        }

        Path dataDir = ConfigPaths.resolveDataDir(config.store().path());
        Files.createDirectories(dataDir);
        return new InitResult(configPath, dataDir, created, overwritten);
    }

    public String toPrettyJson(TiergateConfig config) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize config", e);
        }
    }

    private TiergateConfig applyEnvironment(TiergateConfig config) {
        PaymentsConfig payments = config.payments();
        return config.withPayments(payments.withSecrets(
            envOr(ENV_WEBHOOK_SECRET, payments.webhookSecret()),
            envOr(ENV_KEY_ID, payments.keyId()),
            envOr(ENV_KEY_SECRET, payments.keySecret())
        ));
    }

    private String envOr(String key, String fallback) {
        String value = environment.get(key);
        return value == null || value.isBlank() ? fallback : value.trim();
    }

    private JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (base == null) {
            return override;
        }
        if (override == null) {
            return base;
        }
        if (!base.isObject() || !override.isObject()) {
            return override;
        }

        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            JsonNode existing = merged.get(entry.getKey());
            merged.set(entry.getKey(), deepMerge(existing, entry.getValue()));
        });
        return merged;
    }
}

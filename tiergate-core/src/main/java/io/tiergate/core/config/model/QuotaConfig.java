package io.tiergate.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record QuotaConfig(
    String timezone,
    int freeDailyLimit,
    Map<String, Integer> tierLimits
) {

    public QuotaConfig {
        timezone = timezone == null || timezone.isBlank() ? "UTC" : timezone.trim();
        try {
            ZoneId.of(timezone);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Unknown quota timezone '" + timezone + "'", e);
        }
        freeDailyLimit = Math.max(0, freeDailyLimit);
        tierLimits = normalize(tierLimits);
    }

    public static QuotaConfig defaults() {
        return new QuotaConfig("UTC", 3, Map.of());
    }

    public int limitFor(String tier) {
        if (tier == null || tier.isBlank()) {
            return freeDailyLimit;
        }
        Integer limit = tierLimits.get(tier.trim().toLowerCase(Locale.ROOT));
        return limit == null ? freeDailyLimit : limit;
    }

    public ZoneId zoneId() {
        return ZoneId.of(timezone);
    }

    private static Map<String, Integer> normalize(Map<String, Integer> limits) {
        if (limits == null || limits.isEmpty()) {
            return Map.of();
        }
        Map<String, Integer> normalized = new LinkedHashMap<>();
        limits.forEach((tier, limit) -> {
            if (tier != null && !tier.isBlank() && limit != null) {
                normalized.put(tier.trim().toLowerCase(Locale.ROOT), Math.max(0, limit));
            }
        });
        return Map.copyOf(normalized);
    }
}

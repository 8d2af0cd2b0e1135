package io.tiergate.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.LinkedHashMap;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record PaymentsConfig(
    String currency,
    String webhookSecret,
    String keyId,
    String keySecret,
    String apiBase,
    Map<String, PlanConfig> plans,
    Map<String, DiscountConfig> discounts
) {

    public PaymentsConfig {
        currency = currency == null || currency.isBlank() ? "INR" : currency.trim();
        webhookSecret = webhookSecret == null ? "" : webhookSecret;
        keyId = keyId == null ? "" : keyId;
        keySecret = keySecret == null ? "" : keySecret;
        apiBase = apiBase == null || apiBase.isBlank() ? "https://api.razorpay.com/v1" : apiBase.trim();
        plans = plans == null ? Map.of() : Map.copyOf(plans);
        discounts = discounts == null ? Map.of() : Map.copyOf(discounts);
    }

    public static PaymentsConfig defaults() {
        Map<String, PlanConfig> plans = new LinkedHashMap<>();
        plans.put("monthly", new PlanConfig("Monthly Premium", 30, 4_900, "30 days of unlimited downloads"));
        plans.put("quarterly", new PlanConfig("Quarterly Premium", 90, 12_900, "90 days of unlimited downloads"));
        plans.put("yearly", new PlanConfig("Yearly Premium", 365, 49_900, "365 days of unlimited downloads"));
        return new PaymentsConfig("INR", "", "", "", "https://api.razorpay.com/v1", plans, Map.of());
    }

    public boolean webhookConfigured() {
        return !webhookSecret.isBlank();
    }

    public boolean apiConfigured() {
        return !keyId.isBlank() && !keySecret.isBlank();
    }

    public PaymentsConfig withSecrets(String webhookSecret, String keyId, String keySecret) {
        return new PaymentsConfig(currency, webhookSecret, keyId, keySecret, apiBase, plans, discounts);
    }
}

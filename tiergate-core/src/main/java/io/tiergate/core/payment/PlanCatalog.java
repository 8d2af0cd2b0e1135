package io.tiergate.core.payment;

import io.tiergate.core.config.model.PlanConfig;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Purchasable plans keyed by id. A plan is also found by its {@code <id>_premium} alias, the form older
 * checkout links put into the order notes.
 */
public final class PlanCatalog {
    private static final String ALIAS_SUFFIX = "_premium";

    private final Map<String, Plan> plans;
    private final String currency;

    public PlanCatalog(Map<String, PlanConfig> configured, String currency) {
        Map<String, Plan> built = new LinkedHashMap<>();
        if (configured != null) {
            configured.forEach((id, config) -> {
                if (config != null) {
                    Plan plan = new Plan(id, config.name(), config.durationDays(), config.priceMinor(), config.description());
                    built.put(plan.id().toLowerCase(Locale.ROOT), plan);
                }
            });
        }
        this.plans = Map.copyOf(built);
        this.currency = currency == null || currency.isBlank() ? "INR" : currency.trim().toUpperCase(Locale.ROOT);
    }

    public Optional<Plan> find(String planId) {
        if (planId == null || planId.isBlank()) {
            return Optional.empty();
        }
        String key = planId.trim().toLowerCase(Locale.ROOT);
        Plan plan = plans.get(key);
        if (plan == null && key.endsWith(ALIAS_SUFFIX)) {
            plan = plans.get(key.substring(0, key.length() - ALIAS_SUFFIX.length()));
        }
        return Optional.ofNullable(plan);
    }

    public List<Plan> all() {
        List<Plan> all = new ArrayList<>(plans.values());
        all.sort((a, b) -> Integer.compare(a.durationDays(), b.durationDays()));
        return all;
    }

    public String currency() {
        return currency;
    }
}

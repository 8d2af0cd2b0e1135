package io.tiergate.core.payment;

import io.tiergate.core.config.model.DiscountConfig;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class DiscountCatalog {
    private static final Logger LOG = LoggerFactory.getLogger(DiscountCatalog.class);

    private final Map<String, Discount> discounts;

    public DiscountCatalog(Map<String, DiscountConfig> configured) {
        Map<String, Discount> built = new LinkedHashMap<>();
        if (configured != null) {
            configured.forEach((code, config) -> {
                if (code == null || code.isBlank() || config == null) {
                    return;
                }
                Discount discount = new Discount(
                    code,
                    config.percentage(),
                    config.maxDiscountMinor(),
                    parseDate(code, config.validUntil()),
                    config.description()
                );
                built.put(key(code), discount);
            });
        }
        this.discounts = Map.copyOf(built);
    }

    public static DiscountCatalog empty() {
        return new DiscountCatalog(Map.of());
    }

    /**
     * Returns the code when it is known and still valid on {@code today}.
     */
    public Optional<Discount> find(String code, LocalDate today) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(discounts.get(key(code))).filter(discount -> discount.validOn(today));
    }

    /**
     * Amount a buyer of {@code plan} is expected to pay with {@code code}; the list price when the code
     * is absent, unknown or expired.
     */
    public long acceptedAmount(Plan plan, String code, LocalDate today) {
        return find(code, today)
            .map(discount -> plan.priceMinor() - discount.discountFor(plan.priceMinor()))
            .orElse(plan.priceMinor());
    }

    private static String key(String code) {
        return code.trim().toUpperCase(Locale.ROOT);
    }

    private static LocalDate parseDate(String code, String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(raw.trim());
        } catch (DateTimeParseException e) {
            LOG.warn("Discount code {} has an unreadable validUntil '{}', treating it as expired", code, raw);
            return LocalDate.MIN;
        }
    }
}

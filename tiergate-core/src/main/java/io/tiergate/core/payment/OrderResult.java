package io.tiergate.core.payment;

import java.util.Map;

/**
 * Order as known to the payment processor. {@code notes} carries the user, plan and discount code the
 * order was created for.
 */
public record OrderResult(
    String orderId,
    long amountMinor,
    String currency,
    String status,
    String receipt,
    Map<String, String> notes
) {
    public OrderResult {
        orderId = orderId == null ? "" : orderId;
        currency = currency == null ? "" : currency;
        status = status == null ? "" : status;
        receipt = receipt == null ? "" : receipt;
        notes = notes == null ? Map.of() : Map.copyOf(notes);
    }

    public String note(String key) {
        return notes.getOrDefault(key, "");
    }
}

package io.tiergate.core.payment;

/**
 * Typed payment confirmation. Built only by {@link PaymentEventParser} or from a verified checkout
 * callback, after required fields were checked.
 */
public record PaymentEvent(
    String eventType,
    String paymentId,
    String orderId,
    String userId,
    String planId,
    long amountMinor,
    String currency,
    String status,
    String discountCode,
    String rawPayload,
    String signature,
    SignatureScheme scheme
) {
    public PaymentEvent {
        eventType = eventType == null ? "" : eventType.trim();
        paymentId = paymentId == null ? "" : paymentId.trim();
        orderId = orderId == null ? "" : orderId.trim();
        userId = userId == null ? "" : userId.trim();
        planId = planId == null ? "" : planId.trim();
        currency = currency == null ? "" : currency.trim();
        status = status == null ? "" : status.trim();
        discountCode = discountCode == null ? "" : discountCode.trim();
        rawPayload = rawPayload == null ? "" : rawPayload;
        signature = signature == null ? "" : signature.trim();
        scheme = scheme == null ? SignatureScheme.WEBHOOK : scheme;
    }
}

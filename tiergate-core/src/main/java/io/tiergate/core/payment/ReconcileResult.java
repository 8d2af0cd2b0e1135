package io.tiergate.core.payment;

import java.time.Instant;

public record ReconcileResult(
    ReconcileOutcome outcome,
    PaymentState state,
    String paymentId,
    String userId,
    String planId,
    Instant expiresAt,
    String message
) {
    public ReconcileResult {
        paymentId = paymentId == null ? "" : paymentId;
        userId = userId == null ? "" : userId;
        planId = planId == null ? "" : planId;
        message = message == null ? "" : message;
    }

    static ReconcileResult applied(PaymentEvent event, Instant expiresAt) {
        return new ReconcileResult(ReconcileOutcome.APPLIED, PaymentState.APPLIED,
            event.paymentId(), event.userId(), event.planId(), expiresAt, "Subscription extended");
    }

    static ReconcileResult duplicate(PaymentEvent event) {
        return new ReconcileResult(ReconcileOutcome.DUPLICATE, PaymentState.APPLIED,
            event.paymentId(), event.userId(), event.planId(), null, "Payment already applied");
    }

    static ReconcileResult ignored(String eventType) {
        return new ReconcileResult(ReconcileOutcome.IGNORED, PaymentState.VERIFIED,
            "", "", "", null, "Event " + eventType + " does not change entitlements");
    }

    static ReconcileResult rejected(ReconcileOutcome outcome, String paymentId, String userId, String message) {
        return new ReconcileResult(outcome, PaymentState.REJECTED, paymentId, userId, "", null, message);
    }

    /**
     * Duplicates and ignored events count as success: the processor must not redeliver them.
     */
    public boolean success() {
        return outcome == ReconcileOutcome.APPLIED
            || outcome == ReconcileOutcome.DUPLICATE
            || outcome == ReconcileOutcome.IGNORED;
    }
}

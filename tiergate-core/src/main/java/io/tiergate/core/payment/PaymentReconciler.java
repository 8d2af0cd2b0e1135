package io.tiergate.core.payment;

import io.tiergate.core.entitlement.EntitlementChange;
import io.tiergate.core.entitlement.EntitlementStore;
import io.tiergate.core.observability.AuditEvent;
import io.tiergate.core.observability.ObservabilityService;
import io.tiergate.core.quota.QuotaBoundary;
import io.tiergate.core.subscription.SubscriptionEngine;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies payment confirmations to entitlements exactly once.
 *
 * <p>An event is verified, then validated against the plan catalog. The ledger entry and the subscription
 * extension are then written by one atomic store operation, so only the first delivery of a payment id
 * extends the subscription; every later one is reported as {@link ReconcileOutcome#DUPLICATE}. Rejected
 * events are logged and audited but never applied and never enter the ledger.
 *
 * <p>Store failures propagate and leave neither the ledger entry nor the extension behind, so a retry or a
 * redelivery applies the payment.
 */
public final class PaymentReconciler {
    private static final Logger LOG = LoggerFactory.getLogger(PaymentReconciler.class);

    private final EntitlementStore store;
    private final SubscriptionEngine subscriptions;
    private final PlanCatalog plans;
    private final DiscountCatalog discounts;
    private final WebhookSignatureVerifier verifier;
    private final PaymentEventParser parser;
    private final QuotaBoundary boundary;
    private final Clock clock;
    private final ObservabilityService observability;
    private final OrderLookup orderLookup;

    public PaymentReconciler(
        EntitlementStore store,
        SubscriptionEngine subscriptions,
        PlanCatalog plans,
        DiscountCatalog discounts,
        WebhookSignatureVerifier verifier,
        QuotaBoundary boundary,
        Clock clock,
        ObservabilityService observability,
        OrderLookup orderLookup
    ) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.subscriptions = Objects.requireNonNull(subscriptions, "subscriptions must not be null");
        this.plans = Objects.requireNonNull(plans, "plans must not be null");
        this.discounts = discounts == null ? DiscountCatalog.empty() : discounts;
        this.verifier = Objects.requireNonNull(verifier, "verifier must not be null");
        this.parser = new PaymentEventParser();
        this.boundary = Objects.requireNonNull(boundary, "boundary must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.observability = observability;
        this.orderLookup = orderLookup;
    }

    /**
     * Handles a raw processor webhook. The signature is checked before the body is interpreted, so an
     * unauthenticated body is never parsed into an event.
     */
    public ReconcileResult onWebhook(String rawBody, String signature) throws IOException {
        if (!verifier.verifyWebhook(rawBody, signature)) {
            return reject(ReconcileOutcome.UNVERIFIED, "", "", "verification",
                verifier.webhookConfigured() ? "Invalid webhook signature" : "Webhook secret is not configured");
        }
        Optional<PaymentEvent> event;
        try {
            event = parser.parse(rawBody, signature);
        } catch (PaymentValidationException e) {
            return reject(ReconcileOutcome.INVALID, "", "", "validation", e.getMessage());
        }
        if (event.isEmpty()) {
            String eventType = parser.eventType(rawBody);
            LOG.debug("Ignoring webhook event {}", eventType);
            return ReconcileResult.ignored(eventType);
        }
        return onPaymentConfirmed(event.get());
    }

    /**
     * Handles the checkout callback: {@code orderId}, {@code paymentId} and the checkout signature. The
     * user, plan and amount are taken from the order the processor holds, never from the caller.
     */
    public ReconcileResult onCheckoutCompleted(String orderId, String paymentId, String signature) throws IOException {
        if (!verifier.verifyCheckout(orderId, paymentId, signature)) {
            return reject(ReconcileOutcome.UNVERIFIED, paymentId, "", "verification", "Invalid checkout signature");
        }
        if (orderLookup == null) {
            return reject(ReconcileOutcome.INVALID, paymentId, "", "validation", "Order lookup is not configured");
        }
        Optional<OrderResult> order = orderLookup.fetchOrder(orderId);
        if (order.isEmpty()) {
            return reject(ReconcileOutcome.INVALID, paymentId, "", "validation", "Unknown order " + orderId);
        }
        OrderResult found = order.get();
        PaymentEvent event = new PaymentEvent(
            "checkout.completed",
            paymentId,
            orderId,
            found.note("user_id"),
            found.note("plan_id"),
            found.amountMinor(),
            found.currency(),
            "captured",
            found.note("discount_code"),
            "",
            signature,
            SignatureScheme.CHECKOUT
        );
        return onPaymentConfirmed(event);
    }

    public ReconcileResult onPaymentConfirmed(PaymentEvent event) throws IOException {
        Plan plan;
        try {
            verifier.verify(event);
            plan = validate(event);
        } catch (PaymentVerificationException e) {
            return reject(ReconcileOutcome.UNVERIFIED, event.paymentId(), event.userId(), "verification", e.getMessage());
        } catch (PaymentValidationException e) {
            return reject(ReconcileOutcome.INVALID, event.paymentId(), event.userId(), "validation", e.getMessage());
        }

        Optional<EntitlementChange> applied = store.applyPayment(
            event.userId(),
            event.paymentId(),
            subscriptions.purchase(plan.id(), plan.durationDays(), clock.instant())
        );
        if (applied.isEmpty()) {
            LOG.info("Payment {} for user {} was already applied, skipping", event.paymentId(), event.userId());
            audit(AuditEvent.PAYMENT_DUPLICATE, event.userId(), Map.of(
                "payment_id", event.paymentId(),
                "plan_id", plan.id()
            ));
            return ReconcileResult.duplicate(event);
        }

        Instant expiresAt = applied.get().after().subscriptionExpiresAt();
        LOG.info("Applied payment {} for user {}: plan {} until {}", event.paymentId(), event.userId(), plan.id(), expiresAt);
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("payment_id", event.paymentId());
        attributes.put("order_id", event.orderId());
        attributes.put("plan_id", plan.id());
        attributes.put("amount_minor", event.amountMinor());
        attributes.put("currency", event.currency());
        attributes.put("discount_code", event.discountCode());
        attributes.put("expires_at", expiresAt.toString());
        audit(AuditEvent.PAYMENT_APPLIED, event.userId(), attributes);
        return ReconcileResult.applied(event, expiresAt);
    }

    private Plan validate(PaymentEvent event) throws PaymentValidationException {
        if (event.paymentId().isBlank()) {
            throw new PaymentValidationException("Payment id is missing");
        }
        if (event.userId().isBlank()) {
            throw new PaymentValidationException("User id is missing for payment " + event.paymentId());
        }
        Plan plan = plans.find(event.planId())
            .orElseThrow(() -> new PaymentValidationException("Unknown plan '" + event.planId() + "'"));
        if (!plans.currency().equalsIgnoreCase(event.currency())) {
            throw new PaymentValidationException(
                "Currency " + event.currency() + " does not match " + plans.currency() + " for payment " + event.paymentId()
            );
        }
        long accepted = discounts.acceptedAmount(plan, event.discountCode(), boundary.dayOf(clock.instant()));
        if (event.amountMinor() != plan.priceMinor() && event.amountMinor() != accepted) {
            throw new PaymentValidationException(
                "Amount " + event.amountMinor() + " does not match plan " + plan.id() + " (expected " + accepted + ")"
            );
        }
        return plan;
    }

    private ReconcileResult reject(ReconcileOutcome outcome, String paymentId, String userId, String reason, String message) {
        if (outcome == ReconcileOutcome.UNVERIFIED) {
            LOG.error("Rejected payment notification {}: {}", paymentId, message);
        } else {
            LOG.warn("Rejected payment notification {}: {}", paymentId, message);
        }
        audit(AuditEvent.PAYMENT_REJECTED, userId, Map.of(
            "payment_id", paymentId == null ? "" : paymentId,
            "reason", reason,
            "message", message == null ? "" : message
        ));
        return ReconcileResult.rejected(outcome, paymentId, userId, message);
    }

    private void audit(String type, String userId, Map<String, Object> attributes) {
        if (observability != null) {
            observability.recordQuietly(type, userId, attributes);
        }
    }
}

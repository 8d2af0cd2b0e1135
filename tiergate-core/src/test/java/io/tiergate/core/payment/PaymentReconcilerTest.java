package io.tiergate.core.payment;

import static io.tiergate.core.payment.PaymentFixtures.captured;
import static io.tiergate.core.payment.PaymentFixtures.sign;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.tiergate.core.MutableClock;
import io.tiergate.core.config.model.DiscountConfig;
import io.tiergate.core.config.model.PaymentsConfig;
import io.tiergate.core.config.model.QuotaConfig;
import io.tiergate.core.entitlement.EntitlementChange;
import io.tiergate.core.entitlement.EntitlementDefaults;
import io.tiergate.core.entitlement.EntitlementStore;
import io.tiergate.core.entitlement.InMemoryEntitlementStore;
import io.tiergate.core.entitlement.StoreRetry;
import io.tiergate.core.entitlement.TransientStoreException;
import io.tiergate.core.entitlement.UserEntitlement;
import io.tiergate.core.observability.EntitlementSummary;
import io.tiergate.core.observability.InMemoryAuditStore;
import io.tiergate.core.observability.ObservabilityService;
import io.tiergate.core.quota.QuotaBoundary;
import io.tiergate.core.subscription.SubscriptionEngine;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.UnaryOperator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PaymentReconcilerTest {
    private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");

    private MutableClock clock;
    private QuotaBoundary boundary;
    private FlakyStore store;
    private ObservabilityService observability;
    private PaymentReconciler reconciler;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        boundary = new QuotaBoundary(ZoneOffset.UTC);
        store = new FlakyStore(new InMemoryEntitlementStore(
            new EntitlementDefaults(QuotaConfig.defaults(), boundary, clock)
        ));
        observability = new ObservabilityService(new InMemoryAuditStore(), clock);
        reconciler = reconciler(null);
    }

    @Test
    void shouldApplyCapturedPaymentOnce() throws Exception {
        String body = captured("pay_001", "u1", "monthly", 4_900);

        ReconcileResult first = reconciler.onWebhook(body, sign(body));
        ReconcileResult second = reconciler.onWebhook(body, sign(body));

        assertThat(first.outcome()).isEqualTo(ReconcileOutcome.APPLIED);
        assertThat(first.state()).isEqualTo(PaymentState.APPLIED);
        assertThat(first.expiresAt()).isEqualTo(NOW.plus(Duration.ofDays(30)));
        assertThat(second.outcome()).isEqualTo(ReconcileOutcome.DUPLICATE);
        assertThat(second.success()).isTrue();

        UserEntitlement record = store.get("u1");
        assertThat(record.subscriptionExpiresAt()).isEqualTo(NOW.plus(Duration.ofDays(30)));
        assertThat(record.subscriptionPlanId()).isEqualTo("monthly");
        assertThat(record.processedPaymentIds()).containsExactly("pay_001");

        EntitlementSummary summary = observability.summary();
        assertThat(summary.paymentsApplied()).isEqualTo(1);
        assertThat(summary.paymentsDuplicate()).isEqualTo(1);
        assertThat(summary.revenueMinor()).isEqualTo(4_900);
    }

    @Test
    void shouldApplyConcurrentDeliveriesExactlyOnce() throws Exception {
        String body = captured("pay_002", "u2", "monthly", 4_900);
        String signature = sign(body);
        int deliveries = 8;
        ExecutorService pool = Executors.newFixedThreadPool(deliveries);
        CountDownLatch go = new CountDownLatch(1);
        List<ReconcileOutcome> outcomes = new ArrayList<>();
        try {
            List<Future<ReconcileResult>> futures = new ArrayList<>();
            for (int i = 0; i < deliveries; i++) {
                futures.add(pool.submit(() -> {
                    go.await();
                    return reconciler.onWebhook(body, signature);
                }));
            }
            go.countDown();
            for (Future<ReconcileResult> future : futures) {
                outcomes.add(future.get(30, TimeUnit.SECONDS).outcome());
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(outcomes).filteredOn(o -> o == ReconcileOutcome.APPLIED).hasSize(1);
        assertThat(outcomes).filteredOn(o -> o == ReconcileOutcome.DUPLICATE).hasSize(deliveries - 1);
        assertThat(store.get("u2").subscriptionExpiresAt()).isEqualTo(NOW.plus(Duration.ofDays(30)));
    }

    @Test
    void shouldStackTwoDistinctPayments() throws Exception {
        String first = captured("pay_a", "u3", "monthly", 4_900);
        String second = captured("pay_b", "u3", "quarterly", 12_900);

        reconciler.onWebhook(first, sign(first));
        ReconcileResult result = reconciler.onWebhook(second, sign(second));

        assertThat(result.expiresAt()).isEqualTo(NOW.plus(Duration.ofDays(120)));
        assertThat(store.get("u3").processedPaymentIds()).containsExactlyInAnyOrder("pay_a", "pay_b");
    }

    @Test
    void shouldRejectTamperedSignatureWithoutLedgerEntry() throws Exception {
        String body = captured("pay_003", "u4", "yearly", 49_900);
        String valid = sign(body);
        String forged = valid.substring(0, valid.length() - 1) + (valid.endsWith("0") ? "1" : "0");

        ReconcileResult result = reconciler.onWebhook(body, forged);

        assertThat(result.outcome()).isEqualTo(ReconcileOutcome.UNVERIFIED);
        assertThat(result.state()).isEqualTo(PaymentState.REJECTED);
        UserEntitlement record = store.get("u4");
        assertThat(record.processedPaymentIds()).isEmpty();
        assertThat(record.subscriptionExpiresAt()).isNull();
        assertThat(observability.summary().paymentsRejected()).isEqualTo(1);
    }

    @Test
    void shouldRejectBodyChangedAfterSigning() throws Exception {
        String body = captured("pay_004", "u5", "monthly", 4_900);
        String signature = sign(body);
        String altered = body.replace("\"u5\"", "\"attacker\"");

        assertThat(reconciler.onWebhook(altered, signature).outcome()).isEqualTo(ReconcileOutcome.UNVERIFIED);
        assertThat(store.get("attacker").subscriptionExpiresAt()).isNull();
    }

    @Test
    void shouldRejectEverythingWhenSecretIsMissing() throws Exception {
        PaymentReconciler unconfigured = new PaymentReconciler(
            store, new SubscriptionEngine(store), plans(), DiscountCatalog.empty(),
            new WebhookSignatureVerifier("", ""), boundary, clock, observability, null
        );
        String body = captured("pay_005", "u6", "monthly", 4_900);

        ReconcileResult result = unconfigured.onWebhook(body, sign(body));

        assertThat(result.outcome()).isEqualTo(ReconcileOutcome.UNVERIFIED);
        assertThat(result.message()).contains("not configured");
    }

    @Test
    void shouldRejectUnknownPlan() throws Exception {
        String body = captured("pay_006", "u7", "lifetime", 4_900);

        ReconcileResult result = reconciler.onWebhook(body, sign(body));

        assertThat(result.outcome()).isEqualTo(ReconcileOutcome.INVALID);
        assertThat(result.message()).contains("lifetime");
        assertThat(store.get("u7").processedPaymentIds()).isEmpty();
    }

    @Test
    void shouldAcceptPlanAlias() throws Exception {
        String body = captured("pay_007", "u8", "monthly_premium", 4_900);

        ReconcileResult result = reconciler.onWebhook(body, sign(body));

        assertThat(result.outcome()).isEqualTo(ReconcileOutcome.APPLIED);
        assertThat(store.get("u8").subscriptionPlanId()).isEqualTo("monthly");
    }

    @Test
    void shouldRejectAmountMismatch() throws Exception {
        String body = captured("pay_008", "u9", "yearly", 100);

        ReconcileResult result = reconciler.onWebhook(body, sign(body));

        assertThat(result.outcome()).isEqualTo(ReconcileOutcome.INVALID);
        assertThat(result.success()).isFalse();
        assertThat(store.get("u9").subscriptionExpiresAt()).isNull();
    }

    @Test
    void shouldRejectCurrencyMismatch() throws Exception {
        String body = captured("pay_009", "u10", "monthly", 4_900, "USD", "", "captured");

        assertThat(reconciler.onWebhook(body, sign(body)).outcome()).isEqualTo(ReconcileOutcome.INVALID);
    }

    @Test
    void shouldRejectPaymentThatIsNotCaptured() throws Exception {
        String body = captured("pay_010", "u11", "monthly", 4_900, "INR", "", "authorized");

        assertThat(reconciler.onWebhook(body, sign(body)).outcome()).isEqualTo(ReconcileOutcome.INVALID);
    }

    @Test
    void shouldAcceptDiscountedAmountWhileCodeIsValid() throws Exception {
        // 10% of 4900 is 490, under the 1000 cap
        String body = captured("pay_011", "u12", "monthly", 4_410, "INR", "welcome10", "captured");

        ReconcileResult result = reconciler.onWebhook(body, sign(body));

        assertThat(result.outcome()).isEqualTo(ReconcileOutcome.APPLIED);
        assertThat(observability.summary().revenueMinor()).isEqualTo(4_410);
    }

    @Test
    void shouldRejectDiscountedAmountAfterCodeExpired() throws Exception {
        clock.set(Instant.parse("2026-04-01T00:00:00Z"));
        String body = captured("pay_012", "u13", "monthly", 4_410, "INR", "WELCOME10", "captured");

        assertThat(reconciler.onWebhook(body, sign(body)).outcome()).isEqualTo(ReconcileOutcome.INVALID);
    }

    @Test
    void shouldIgnoreUnrelatedEventTypes() throws Exception {
        String body = "{\"event\":\"refund.created\",\"payload\":{}}";

        ReconcileResult result = reconciler.onWebhook(body, sign(body));

        assertThat(result.outcome()).isEqualTo(ReconcileOutcome.IGNORED);
        assertThat(result.state()).isEqualTo(PaymentState.VERIFIED);
        assertThat(result.success()).isTrue();
    }

    @Test
    void shouldRejectMalformedBody() throws Exception {
        String body = "{not json";

        assertThat(reconciler.onWebhook(body, sign(body)).outcome()).isEqualTo(ReconcileOutcome.INVALID);
    }

    @Test
    void shouldLeaveNoLedgerEntryWhenPaymentWriteFails() throws Exception {
        String body = captured("pay_013", "u14", "monthly", 4_900);
        store.failingApplies.set(1);

        assertThatThrownBy(() -> reconciler.onWebhook(body, sign(body)))
            .isInstanceOf(TransientStoreException.class)
            .hasMessageContaining("timed out");
        UserEntitlement untouched = store.get("u14");
        assertThat(untouched.processedPaymentIds()).isEmpty();
        assertThat(untouched.subscriptionExpiresAt()).isNull();

        ReconcileResult redelivered = reconciler.onWebhook(body, sign(body));
        assertThat(redelivered.outcome()).isEqualTo(ReconcileOutcome.APPLIED);
        assertThat(store.get("u14").subscriptionExpiresAt()).isEqualTo(NOW.plus(Duration.ofDays(30)));
    }

    @Test
    void shouldApplyPaymentWhenRetriedAfterTransientFailure() throws Exception {
        String body = captured("pay_x", "u16", "monthly", 4_900);
        store.failingApplies.set(1);

        ReconcileResult result = new StoreRetry(3, 0).call(() -> reconciler.onWebhook(body, sign(body)));

        assertThat(result.outcome()).isEqualTo(ReconcileOutcome.APPLIED);
        assertThat(result.expiresAt()).isEqualTo(NOW.plus(Duration.ofDays(30)));
        UserEntitlement record = store.get("u16");
        assertThat(record.subscriptionExpiresAt()).isEqualTo(NOW.plus(Duration.ofDays(30)));
        assertThat(record.processedPaymentIds()).containsExactly("pay_x");
        assertThat(observability.summary().paymentsApplied()).isEqualTo(1);
        assertThat(observability.summary().paymentsDuplicate()).isZero();
    }

    @Test
    void shouldApplyCheckoutFromOrderAndTreatWebhookAsDuplicate() throws Exception {
        OrderResult order = new OrderResult("order_77", 12_900, "INR", "paid", "r1",
            Map.of("user_id", "u15", "plan_id", "quarterly"));
        PaymentReconciler withOrders = reconciler(orderId -> "order_77".equals(orderId) ? Optional.of(order) : Optional.empty());

        ReconcileResult checkout = withOrders.onCheckoutCompleted(
            "order_77", "pay_014", PaymentFixtures.signCheckout("order_77", "pay_014")
        );
        String body = captured("pay_014", "u15", "quarterly", 12_900);
        ReconcileResult webhook = withOrders.onWebhook(body, sign(body));

        assertThat(checkout.outcome()).isEqualTo(ReconcileOutcome.APPLIED);
        assertThat(checkout.expiresAt()).isEqualTo(NOW.plus(Duration.ofDays(90)));
        assertThat(webhook.outcome()).isEqualTo(ReconcileOutcome.DUPLICATE);
    }

    @Test
    void shouldRejectCheckoutWithBadSignatureOrUnknownOrder() throws Exception {
        PaymentReconciler withOrders = reconciler(orderId -> Optional.empty());

        ReconcileResult forged = withOrders.onCheckoutCompleted("order_1", "pay_015", "deadbeef");
        ReconcileResult unknown = withOrders.onCheckoutCompleted(
            "order_1", "pay_015", PaymentFixtures.signCheckout("order_1", "pay_015")
        );
        ReconcileResult noLookup = reconciler.onCheckoutCompleted(
            "order_1", "pay_015", PaymentFixtures.signCheckout("order_1", "pay_015")
        );

        assertThat(forged.outcome()).isEqualTo(ReconcileOutcome.UNVERIFIED);
        assertThat(unknown.outcome()).isEqualTo(ReconcileOutcome.INVALID);
        assertThat(noLookup.outcome()).isEqualTo(ReconcileOutcome.INVALID);
    }

    private PaymentReconciler reconciler(OrderLookup orders) {
        DiscountCatalog discounts = new DiscountCatalog(Map.of(
            "WELCOME10", new DiscountConfig(10, 1_000, "2026-03-31", "Launch offer")
        ));
        return new PaymentReconciler(
            store,
            new SubscriptionEngine(store),
            plans(),
            discounts,
            new WebhookSignatureVerifier(PaymentFixtures.WEBHOOK_SECRET, PaymentFixtures.KEY_SECRET),
            boundary,
            clock,
            observability,
            orders
        );
    }

    private static PlanCatalog plans() {
        PaymentsConfig defaults = PaymentsConfig.defaults();
        return new PlanCatalog(defaults.plans(), defaults.currency());
    }

    /**
     * Store whose next payment writes time out after the delegate has started them.
     */
    private static final class FlakyStore implements EntitlementStore {
        private final EntitlementStore delegate;
        private final AtomicInteger failingApplies = new AtomicInteger();

        FlakyStore(EntitlementStore delegate) {
            this.delegate = delegate;
        }

        @Override
        public UserEntitlement get(String userId) throws IOException {
            return delegate.get(userId);
        }

        @Override
        public void save(UserEntitlement record) throws IOException {
            delegate.save(record);
        }

        @Override
        public EntitlementChange update(String userId, UnaryOperator<UserEntitlement> mutation) throws IOException {
            return delegate.update(userId, mutation);
        }

        @Override
        public Optional<EntitlementChange> applyPayment(
            String userId,
            String paymentId,
            UnaryOperator<UserEntitlement> grant
        ) throws IOException {
            if (failingApplies.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
                try {
                    return delegate.applyPayment(userId, paymentId, current -> {
                        throw new IllegalStateException("connection reset");
                    });
                } catch (IllegalStateException e) {
                    throw new TransientStoreException("Store timed out applying " + paymentId, e);
                }
            }
            return delegate.applyPayment(userId, paymentId, grant);
        }

        @Override
        public List<String> userIds() throws IOException {
            return delegate.userIds();
        }
    }
}

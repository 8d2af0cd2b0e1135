package io.tiergate.core.runtime;

import io.tiergate.core.access.AccessDecision;
import io.tiergate.core.api.WebhookServer;
import io.tiergate.core.config.ConfigPaths;
import io.tiergate.core.config.model.PaymentsConfig;
import io.tiergate.core.config.model.StoreConfig;
import io.tiergate.core.config.model.TiergateConfig;
import io.tiergate.core.entitlement.EntitlementDefaults;
import io.tiergate.core.entitlement.EntitlementStore;
import io.tiergate.core.entitlement.FileEntitlementStore;
import io.tiergate.core.entitlement.InMemoryEntitlementStore;
import io.tiergate.core.entitlement.SqliteEntitlementStore;
import io.tiergate.core.entitlement.StoreRetry;
import io.tiergate.core.entitlement.UserEntitlement;
import io.tiergate.core.observability.AuditStore;
import io.tiergate.core.observability.FileAuditStore;
import io.tiergate.core.observability.InMemoryAuditStore;
import io.tiergate.core.observability.ObservabilityService;
import io.tiergate.core.payment.DiscountCatalog;
import io.tiergate.core.payment.OrderResult;
import io.tiergate.core.payment.PaymentReconciler;
import io.tiergate.core.payment.Plan;
import io.tiergate.core.payment.PlanCatalog;
import io.tiergate.core.payment.RazorpayOrderClient;
import io.tiergate.core.payment.WebhookSignatureVerifier;
import io.tiergate.core.quota.QuotaBoundary;
import io.tiergate.core.quota.QuotaEngine;
import io.tiergate.core.quota.ResetScheduler;
import io.tiergate.core.subscription.SubscriptionEngine;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires the entitlement services for one configuration. Every collaborator shares the same store, clock
 * and quota boundary.
 */
public final class EntitlementRuntime {
    private static final Logger LOG = LoggerFactory.getLogger(EntitlementRuntime.class);

    private final TiergateConfig config;
    private final Clock clock;
    private final Path dataDir;
    private final QuotaBoundary boundary;
    private final EntitlementDefaults defaults;
    private final EntitlementStore store;
    private final ObservabilityService observability;
    private final QuotaEngine quotaEngine;
    private final SubscriptionEngine subscriptionEngine;
    private final PlanCatalog planCatalog;
    private final DiscountCatalog discountCatalog;
    private final RazorpayOrderClient orderClient;
    private final PaymentReconciler reconciler;
    private final AccessDecision accessDecision;
    private final StoreRetry retry;

    private EntitlementRuntime(TiergateConfig config, Clock clock, Path dataDir, EntitlementStore store,
                               AuditStore auditStore, QuotaBoundary boundary, EntitlementDefaults defaults) {
        this.config = config;
        this.clock = clock;
        this.dataDir = dataDir;
        this.boundary = boundary;
        this.defaults = defaults;
        this.store = store;
        this.observability = new ObservabilityService(auditStore, clock);
        this.quotaEngine = new QuotaEngine(store, boundary, clock);
        this.subscriptionEngine = new SubscriptionEngine(store);
        PaymentsConfig payments = config.payments();
        this.planCatalog = new PlanCatalog(payments.plans(), payments.currency());
        this.discountCatalog = new DiscountCatalog(payments.discounts());
        this.orderClient = payments.apiConfigured()
            ? new RazorpayOrderClient(payments.apiBase(), payments.keyId(), payments.keySecret(), clock)
            : null;
        this.reconciler = new PaymentReconciler(
            store,
            subscriptionEngine,
            planCatalog,
            discountCatalog,
            new WebhookSignatureVerifier(payments.webhookSecret(), payments.keySecret()),
            boundary,
            clock,
            observability,
            orderClient
        );
        this.accessDecision = new AccessDecision(subscriptionEngine, quotaEngine, observability);
        this.retry = new StoreRetry(config.store().retryAttempts());
    }

    public static EntitlementRuntime create(TiergateConfig config, Clock clock) throws IOException {
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(clock, "clock must not be null");
        QuotaBoundary boundary = new QuotaBoundary(config.quota().zoneId());
        EntitlementDefaults defaults = new EntitlementDefaults(config.quota(), boundary, clock);
        StoreConfig storeConfig = config.store();
        Path dataDir = ConfigPaths.resolveDataDir(storeConfig.path());

        EntitlementStore store;
        AuditStore auditStore;
        switch (storeConfig.backend()) {
            case "memory" -> {
                store = new InMemoryEntitlementStore(defaults);
                auditStore = new InMemoryAuditStore();
            }
            case "file" -> {
                store = new FileEntitlementStore(
                    dataDir.resolve("entitlements.json"),
                    defaults,
                    Duration.ofMillis(storeConfig.busyTimeoutMs())
                );
                auditStore = new FileAuditStore(dataDir.resolve("audit").resolve("events.json"));
            }
            case "sqlite" -> {
                store = new SqliteEntitlementStore(dataDir.resolve("entitlements.db"), defaults, storeConfig.busyTimeoutMs());
                auditStore = new FileAuditStore(dataDir.resolve("audit").resolve("events.json"));
            }
            default -> throw new IllegalArgumentException("Unknown store backend: " + storeConfig.backend());
        }
        LOG.info("Entitlement store: {} ({})", storeConfig.backend(), "memory".equals(storeConfig.backend()) ? "volatile" : dataDir);
        return new EntitlementRuntime(config, clock, dataDir, store, auditStore, boundary, defaults);
    }

    public WebhookServer newServer() {
        return newServer(config.gateway().host(), config.gateway().port());
    }

    public WebhookServer newServer(String host, int port) {
        return new WebhookServer(
            host,
            port,
            reconciler,
            accessDecision,
            quotaEngine,
            subscriptionEngine,
            planCatalog,
            observability,
            retry,
            clock
        );
    }

    public ResetScheduler newResetScheduler() {
        return new ResetScheduler(quotaEngine, observability, clock);
    }

    /**
     * Creates a processor order for {@code planId}, priced with {@code discountCode} when it is valid today.
     */
    public OrderResult placeOrder(String userId, String planId, String discountCode) throws IOException {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be blank");
        }
        if (orderClient == null) {
            throw new IllegalStateException("Razorpay API credentials are not configured");
        }
        Plan plan = planCatalog.find(planId)
            .orElseThrow(() -> new IllegalArgumentException("Unknown plan '" + planId + "'"));
        long amount = discountCatalog.acceptedAmount(plan, discountCode, boundary.dayOf(clock.instant()));
        return orderClient.createOrder(userId.trim(), plan, discountCode, amount, planCatalog.currency());
    }

    /**
     * Moves {@code userId} to {@code tier}; the daily limit follows {@code quota.tierLimits}. Usage already
     * counted today is kept and clamped to the new limit.
     */
    public UserEntitlement assignTier(String userId, String tier) throws IOException {
        if (!defaults.knowsTier(tier)) {
            throw new IllegalArgumentException("Unknown tier '" + tier + "'");
        }
        String normalized = tier.trim().toLowerCase(Locale.ROOT);
        UserEntitlement after = retry.call(() -> store.update(userId, current ->
            current.withTier(normalized, defaults.limitFor(normalized), clock.instant())
        )).after();
        LOG.info("User {} moved to tier {} (daily limit {})", after.userId(), after.tier(), after.dailyLimit());
        return after;
    }

    public TiergateConfig config() {
        return config;
    }

    public Clock clock() {
        return clock;
    }

    public Path dataDir() {
        return dataDir;
    }

    public QuotaBoundary boundary() {
        return boundary;
    }

    public EntitlementStore store() {
        return store;
    }

    public ObservabilityService observability() {
        return observability;
    }

    public QuotaEngine quotaEngine() {
        return quotaEngine;
    }

    public SubscriptionEngine subscriptionEngine() {
        return subscriptionEngine;
    }

    public PlanCatalog planCatalog() {
        return planCatalog;
    }

    public DiscountCatalog discountCatalog() {
        return discountCatalog;
    }

    public PaymentReconciler reconciler() {
        return reconciler;
    }

    public AccessDecision accessDecision() {
        return accessDecision;
    }

    public StoreRetry retry() {
        return retry;
    }
}

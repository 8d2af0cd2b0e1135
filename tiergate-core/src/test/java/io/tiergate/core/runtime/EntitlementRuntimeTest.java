package io.tiergate.core.runtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.tiergate.core.MutableClock;
import io.tiergate.core.config.model.DiscountConfig;
import io.tiergate.core.config.model.GatewayConfig;
import io.tiergate.core.config.model.PaymentsConfig;
import io.tiergate.core.config.model.QuotaConfig;
import io.tiergate.core.config.model.StoreConfig;
import io.tiergate.core.config.model.TiergateConfig;
import io.tiergate.core.entitlement.FileEntitlementStore;
import io.tiergate.core.entitlement.InMemoryEntitlementStore;
import io.tiergate.core.entitlement.SqliteEntitlementStore;
import io.tiergate.core.entitlement.UserEntitlement;
import io.tiergate.core.payment.OrderResult;
import io.tiergate.core.quota.QuotaResult;
import io.tiergate.core.quota.ResetScheduler;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class EntitlementRuntimeTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-10T12:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    @Test
    void shouldSelectStoreBackendFromConfig() throws Exception {
        assertThat(EntitlementRuntime.create(config("memory", PaymentsConfig.defaults()), CLOCK).store())
            .isInstanceOf(InMemoryEntitlementStore.class);

        EntitlementRuntime file = EntitlementRuntime.create(config("file", PaymentsConfig.defaults()), CLOCK);
        file.accessDecision().canDownload("u1", CLOCK.instant());
        assertThat(file.store()).isInstanceOf(FileEntitlementStore.class);
        assertThat(Files.exists(tempDir.resolve("entitlements.json"))).isTrue();
        assertThat(Files.exists(tempDir.resolve("audit").resolve("events.json"))).isTrue();

        EntitlementRuntime sqlite = EntitlementRuntime.create(config("sqlite", PaymentsConfig.defaults()), CLOCK);
        assertThat(sqlite.store()).isInstanceOf(SqliteEntitlementStore.class);
        assertThat(Files.exists(tempDir.resolve("entitlements.db"))).isTrue();
        assertThat(sqlite.retry().maxAttempts()).isEqualTo(3);
    }

    @Test
    void shouldRejectUnknownBackend() {
        assertThatThrownBy(() -> EntitlementRuntime.create(config("redis", PaymentsConfig.defaults()), CLOCK))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("redis");
    }

    @Test
    void shouldKeepUsageAcrossRuntimesOnDurableBackend() throws Exception {
        EntitlementRuntime first = EntitlementRuntime.create(config("sqlite", PaymentsConfig.defaults()), CLOCK);
        first.accessDecision().canDownload("u1", CLOCK.instant());

        EntitlementRuntime restarted = EntitlementRuntime.create(config("sqlite", PaymentsConfig.defaults()), CLOCK);

        assertThat(restarted.quotaEngine().peek("u1").remaining()).isEqualTo(1);
        try (ResetScheduler scheduler = restarted.newResetScheduler()) {
            assertThat(scheduler.runOnce()).isZero();
        }
    }

    @Test
    void shouldApplyRaisedLimitToExistingUsers() throws Exception {
        for (String backend : List.of("file", "sqlite")) {
            Path dataDir = tempDir.resolve(backend);
            MutableClock clock = new MutableClock(Instant.parse("2026-03-10T12:00:00Z"));
            EntitlementRuntime original = EntitlementRuntime.create(
                config(backend, dataDir, new QuotaConfig("UTC", 3, Map.of())), clock
            );
            original.quotaEngine().checkAndConsume("u1");

            EntitlementRuntime raised = EntitlementRuntime.create(
                config(backend, dataDir, new QuotaConfig("UTC", 10, Map.of("free", 10))), clock
            );
            assertThat(raised.quotaEngine().peek("u1").remaining()).as(backend).isEqualTo(9);

            clock.advance(Duration.ofDays(1));
            raised.quotaEngine().resetAll(clock.instant());

            QuotaResult nextDay = raised.quotaEngine().peek("u1");
            assertThat(nextDay.limit()).as(backend).isEqualTo(10);
            assertThat(nextDay.remaining()).as(backend).isEqualTo(10);
        }
    }

    @Test
    void shouldMoveUserBetweenConfiguredTiers() throws Exception {
        EntitlementRuntime runtime = EntitlementRuntime.create(
            config("sqlite", tempDir, new QuotaConfig("UTC", 2, Map.of("pro", 20))), CLOCK
        );
        runtime.quotaEngine().checkAndConsume("u1");
        runtime.quotaEngine().checkAndConsume("u1");
        assertThat(runtime.quotaEngine().checkAndConsume("u1").allowed()).isFalse();

        UserEntitlement pro = runtime.assignTier("u1", "Pro");

        assertThat(pro.tier()).isEqualTo("pro");
        assertThat(pro.dailyLimit()).isEqualTo(20);
        assertThat(pro.dailyUsed()).isEqualTo(2);
        assertThat(runtime.quotaEngine().checkAndConsume("u1").remaining()).isEqualTo(17);

        UserEntitlement free = runtime.assignTier("u1", "free");
        assertThat(free.dailyLimit()).isEqualTo(2);
        assertThat(free.dailyUsed()).isEqualTo(2);
        assertThatThrownBy(() -> runtime.assignTier("u1", "gold"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("gold");
    }

    @Test
    void shouldPlaceDiscountedOrder() throws Exception {
        try (MockWebServer razorpay = new MockWebServer()) {
            razorpay.enqueue(new MockResponse().setResponseCode(200).setBody(
                "{\"id\":\"order_rt\",\"amount\":4410,\"currency\":\"INR\",\"status\":\"created\"}"
            ));
            razorpay.start();
            PaymentsConfig payments = new PaymentsConfig(
                "INR", "whsec", "rzp_key", "rzp_secret", razorpay.url("/v1").toString(),
                PaymentsConfig.defaults().plans(),
                Map.of("WELCOME10", new DiscountConfig(10, 1_000, "2026-12-31", ""))
            );
            EntitlementRuntime runtime = EntitlementRuntime.create(config("memory", payments), CLOCK);

            OrderResult order = runtime.placeOrder("u1", "monthly", "WELCOME10");

            assertThat(order.orderId()).isEqualTo("order_rt");
            JsonNode sent = new ObjectMapper().readTree(razorpay.takeRequest().getBody().readUtf8());
            assertThat(sent.path("amount").asLong()).isEqualTo(4_410);
            assertThat(sent.path("notes").path("plan_id").asText()).isEqualTo("monthly");
            assertThatThrownBy(() -> runtime.placeOrder("u1", "lifetime", ""))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    void shouldRefuseOrdersWithoutApiCredentials() throws Exception {
        EntitlementRuntime runtime = EntitlementRuntime.create(config("memory", PaymentsConfig.defaults()), CLOCK);

        assertThatThrownBy(() -> runtime.placeOrder("u1", "monthly", ""))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("credentials");
        assertThatThrownBy(() -> runtime.placeOrder(" ", "monthly", ""))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private TiergateConfig config(String backend, PaymentsConfig payments) {
        return new TiergateConfig(
            new QuotaConfig("UTC", 2, Map.of()),
            payments,
            new StoreConfig(backend, tempDir.toString(), 2_000, 3),
            GatewayConfig.defaults()
        );
    }

    private static TiergateConfig config(String backend, Path dataDir, QuotaConfig quota) {
        return new TiergateConfig(
            quota,
            PaymentsConfig.defaults(),
            new StoreConfig(backend, dataDir.toString(), 2_000, 3),
            GatewayConfig.defaults()
        );
    }
}

package io.tiergate.core.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.tiergate.core.access.AccessDecision;
import io.tiergate.core.access.AccessResult;
import io.tiergate.core.entitlement.StoreRetry;
import io.tiergate.core.entitlement.TransientStoreException;
import io.tiergate.core.observability.EntitlementSummary;
import io.tiergate.core.observability.ObservabilityService;
import io.tiergate.core.payment.Plan;
import io.tiergate.core.payment.PlanCatalog;
import io.tiergate.core.payment.PaymentReconciler;
import io.tiergate.core.payment.ReconcileOutcome;
import io.tiergate.core.payment.ReconcileResult;
import io.tiergate.core.quota.QuotaEngine;
import io.tiergate.core.quota.QuotaResult;
import io.tiergate.core.subscription.SubscriptionEngine;
import io.tiergate.core.subscription.SubscriptionStatus;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.PathHandler;
import io.undertow.util.Headers;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP surface of the entitlement service: the processor webhook, the checkout callback, the download
 * checkpoint used by the chat transport, and read-only status endpoints.
 *
 * <p>Handlers run on Undertow worker threads. Store calls are retried on transient failures; when the store
 * stays unavailable the answer is 503 so neither a download nor a payment is decided silently.
 */
public final class WebhookServer implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(WebhookServer.class);
    public static final String SIGNATURE_HEADER = "X-Razorpay-Signature";

    private final ObjectMapper mapper;
    private final String host;
    private final int requestedPort;
    private final PaymentReconciler reconciler;
    private final AccessDecision accessDecision;
    private final QuotaEngine quotaEngine;
    private final SubscriptionEngine subscriptionEngine;
    private final PlanCatalog planCatalog;
    private final ObservabilityService observabilityService;
    private final StoreRetry retry;
    private final Clock clock;
    private final AtomicBoolean running;
    private Undertow server;
    private int actualPort;

    public WebhookServer(
        String host,
        int port,
        PaymentReconciler reconciler,
        AccessDecision accessDecision,
        QuotaEngine quotaEngine,
        SubscriptionEngine subscriptionEngine,
        PlanCatalog planCatalog,
        ObservabilityService observabilityService,
        StoreRetry retry,
        Clock clock
    ) {
        this.host = host == null || host.isBlank() ? "0.0.0.0" : host;
        this.requestedPort = port;
        this.reconciler = Objects.requireNonNull(reconciler, "reconciler must not be null");
        this.accessDecision = Objects.requireNonNull(accessDecision, "accessDecision must not be null");
        this.quotaEngine = Objects.requireNonNull(quotaEngine, "quotaEngine must not be null");
        this.subscriptionEngine = Objects.requireNonNull(subscriptionEngine, "subscriptionEngine must not be null");
        this.planCatalog = Objects.requireNonNull(planCatalog, "planCatalog must not be null");
        this.observabilityService = observabilityService;
        this.retry = retry == null ? StoreRetry.none() : retry;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.running = new AtomicBoolean(false);
    }

    public void start() {
        if (running.getAndSet(true)) {
            return;
        }
        PathHandler routes = Handlers.path()
            .addExactPath("/healthz", this::handleHealth)
            .addExactPath("/webhooks/payments", exchange -> blocking(exchange, this::handleWebhook))
            .addExactPath("/payments/checkout", exchange -> blocking(exchange, this::handleCheckout))
            .addExactPath("/access/check", exchange -> blocking(exchange, this::handleAccessCheck))
            .addPrefixPath("/entitlements", exchange -> blocking(exchange, this::handleEntitlement))
            .addExactPath("/plans", exchange -> blocking(exchange, this::handlePlans))
            .addExactPath("/audit/events", exchange -> blocking(exchange, this::handleAuditEvents))
            .addExactPath("/audit/summary", exchange -> blocking(exchange, this::handleAuditSummary));

        server = Undertow.builder()
            .addHttpListener(requestedPort, host)
            .setHandler(routes)
            .build();
        server.start();
        this.actualPort = resolveBoundPort(server, requestedPort);
        LOG.info("Entitlement gateway listening on {}:{}", host, actualPort);
    }

    public int port() {
        return actualPort;
    }

    @Override
    public void close() {
        running.set(false);
        if (server != null) {
            server.stop();
        }
    }

    private void handleHealth(HttpServerExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod().toString())) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        sendJson(exchange, 200, Map.of("status", "ok"));
    }

    private void handleWebhook(HttpServerExchange exchange) throws IOException {
        if (!"POST".equalsIgnoreCase(exchange.getRequestMethod().toString())) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        String rawBody = readRawBody(exchange);
        String signature = header(exchange, SIGNATURE_HEADER);
        ReconcileResult result = retry.call(() -> reconciler.onWebhook(rawBody, signature));
        sendReconcileResult(exchange, result, webhookStatusFor(result.outcome()));
    }

    private void handleCheckout(HttpServerExchange exchange) throws IOException {
        if (!"POST".equalsIgnoreCase(exchange.getRequestMethod().toString())) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        JsonNode body = readJsonBody(exchange);
        String orderId = readString(body, "razorpay_order_id", readString(body, "order_id", ""));
        String paymentId = readString(body, "razorpay_payment_id", readString(body, "payment_id", ""));
        String signature = readString(body, "razorpay_signature", readString(body, "signature", ""));
        if (orderId.isBlank() || paymentId.isBlank() || signature.isBlank()) {
            sendJson(exchange, 400, Map.of("error", "order_id, payment_id and signature are required"));
            return;
        }
        ReconcileResult result = retry.call(() -> reconciler.onCheckoutCompleted(orderId, paymentId, signature));
        sendReconcileResult(exchange, result, checkoutStatusFor(result.outcome()));
    }

    private void handleAccessCheck(HttpServerExchange exchange) throws IOException {
        if (!"POST".equalsIgnoreCase(exchange.getRequestMethod().toString())) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        String userId = readString(readJsonBody(exchange), "user_id", "");
        if (userId.isBlank()) {
            sendJson(exchange, 400, Map.of("error", "user_id is required"));
            return;
        }
        AccessResult result = retry.call(() -> accessDecision.canDownload(userId, clock.instant()));
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("user_id", userId);
        payload.put("allowed", result.allowed());
        payload.put("reason", result.reason().wireName());
        payload.put("remaining", result.remaining());
        payload.put("resets_at", iso(result.resetsAt()));
        payload.put("subscription_expires_at", iso(result.subscriptionExpiresAt()));
        sendJson(exchange, 200, payload);
    }

    private void handleEntitlement(HttpServerExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod().toString())) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        String relative = exchange.getRelativePath();
        String userId = (relative.startsWith("/") ? relative.substring(1) : relative).trim();
        if (userId.isBlank() || userId.contains("/")) {
            sendJson(exchange, 404, Map.of("error", "not_found"));
            return;
        }
        Instant now = clock.instant();
        QuotaResult quota = retry.call(() -> quotaEngine.peek(userId, now));
        SubscriptionStatus subscription = retry.call(() -> subscriptionEngine.status(userId, now));

        Map<String, Object> quotaPayload = new LinkedHashMap<>();
        quotaPayload.put("remaining", quota.remaining());
        quotaPayload.put("limit", quota.limit());
        quotaPayload.put("resets_at", iso(quota.resetsAt()));

        Map<String, Object> subscriptionPayload = new LinkedHashMap<>();
        subscriptionPayload.put("active", subscription.active());
        subscriptionPayload.put("plan_id", subscription.planId());
        subscriptionPayload.put("expires_at", iso(subscription.expiresAt()));
        subscriptionPayload.put("remaining_days", subscription.remainingDays());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("user_id", userId);
        payload.put("quota", quotaPayload);
        payload.put("subscription", subscriptionPayload);
        sendJson(exchange, 200, payload);
    }

    private void handlePlans(HttpServerExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod().toString())) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        List<Map<String, Object>> plans = new ArrayList<>();
        for (Plan plan : planCatalog.all()) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("id", plan.id());
            row.put("name", plan.name());
            row.put("duration_days", plan.durationDays());
            row.put("price_minor", plan.priceMinor());
            row.put("description", plan.description());
            plans.add(row);
        }
        sendJson(exchange, 200, Map.of("currency", planCatalog.currency(), "plans", plans));
    }

    private void handleAuditEvents(HttpServerExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod().toString())) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        if (observabilityService == null) {
            sendJson(exchange, 503, Map.of("error", "observability_not_configured"));
            return;
        }
        int limit = parseQueryInt(exchange, "limit", 100, 1, 1000);
        String userId = queryParam(exchange, "user_id");
        var events = userId.isBlank()
            ? observabilityService.recent(limit)
            : observabilityService.forUser(userId, limit);
        sendJson(exchange, 200, Map.of("events", events));
    }

    private void handleAuditSummary(HttpServerExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod().toString())) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        if (observabilityService == null) {
            sendJson(exchange, 503, Map.of("error", "observability_not_configured"));
            return;
        }
        EntitlementSummary summary = observabilityService.summary();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("downloads_allowed", summary.downloadsAllowed());
        payload.put("downloads_denied", summary.downloadsDenied());
        payload.put("subscription_downloads", summary.subscriptionDownloads());
        payload.put("denial_rate", summary.denialRate());
        payload.put("payments_applied", summary.paymentsApplied());
        payload.put("payments_duplicate", summary.paymentsDuplicate());
        payload.put("payments_rejected", summary.paymentsRejected());
        payload.put("revenue_minor", summary.revenueMinor());
        payload.put("quota_resets", summary.quotaResets());
        payload.put("active_users_24h", summary.activeUsers24h());
        payload.put("audit_events", summary.auditEvents());
        sendJson(exchange, 200, payload);
    }

    private void sendReconcileResult(HttpServerExchange exchange, ReconcileResult result, int status) throws IOException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("status", result.outcome().wireName());
        if (!result.paymentId().isBlank()) {
            payload.put("payment_id", result.paymentId());
        }
        if (result.expiresAt() != null) {
            payload.put("expires_at", result.expiresAt().toString());
        }
        if (!result.success()) {
            payload.put("error", result.message());
        }
        sendJson(exchange, status, payload);
    }

    /**
     * The processor redelivers anything that is not acknowledged, so an invalid but authentic event is
     * acknowledged and dropped. Only a signature failure is answered with an error.
     */
    static int webhookStatusFor(ReconcileOutcome outcome) {
        return outcome == ReconcileOutcome.UNVERIFIED ? 401 : 200;
    }

    static int checkoutStatusFor(ReconcileOutcome outcome) {
        return switch (outcome) {
            case APPLIED, DUPLICATE, IGNORED -> 200;
            case INVALID -> 400;
            case UNVERIFIED -> 401;
        };
    }

    /**
     * Moves the exchange off the IO thread and maps failures to status codes.
     */
    private void blocking(HttpServerExchange exchange, Endpoint endpoint) {
        if (exchange.isInIoThread()) {
            exchange.dispatch(() -> blocking(exchange, endpoint));
            return;
        }
        try {
            endpoint.handle(exchange);
        } catch (TransientStoreException e) {
            LOG.warn("Store unavailable for {} {}: {}", exchange.getRequestMethod(), exchange.getRequestPath(), e.getMessage());
            sendError(exchange, 503, "temporarily_unavailable");
        } catch (JsonProcessingException e) {
            sendError(exchange, 400, "invalid_json");
        } catch (IllegalArgumentException e) {
            sendError(exchange, 400, e.getMessage() == null ? "bad_request" : e.getMessage());
        } catch (Exception e) {
            LOG.error("Request {} {} failed", exchange.getRequestMethod(), exchange.getRequestPath(), e);
            sendError(exchange, 500, "internal_error");
        }
    }

    private void sendError(HttpServerExchange exchange, int status, String error) {
        try {
            sendJson(exchange, status, Map.of("error", error));
        } catch (IOException e) {
            LOG.debug("Could not send error response: {}", e.getMessage());
        }
    }

    private void sendJson(HttpServerExchange exchange, int status, Map<String, ?> payload) throws IOException {
        byte[] body = mapper.writeValueAsBytes(payload);
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseHeaders().put(Headers.CONTENT_LENGTH, String.valueOf(body.length));
        exchange.getResponseSender().send(ByteBuffer.wrap(body));
    }

    private String readRawBody(HttpServerExchange exchange) throws IOException {
        exchange.startBlocking();
        return new String(exchange.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
    }

    private JsonNode readJsonBody(HttpServerExchange exchange) throws IOException {
        String raw = readRawBody(exchange);
        if (raw.isBlank()) {
            return mapper.createObjectNode();
        }
        return mapper.readTree(raw);
    }

    private String readString(JsonNode body, String field, String fallback) {
        if (body == null || !body.has(field) || body.get(field).isNull()) {
            return fallback;
        }
        JsonNode value = body.get(field);
        String text = value.isValueNode() ? value.asText("").trim() : "";
        return text.isEmpty() ? fallback : text;
    }

    private int parseQueryInt(HttpServerExchange exchange, String key, int fallback, int min, int max) {
        try {
            int parsed = Integer.parseInt(queryParam(exchange, key));
            return Math.max(min, Math.min(max, parsed));
        } catch (NumberFormatException ignored) {
            return fallback;
        }
    }

    private String queryParam(HttpServerExchange exchange, String key) {
        Deque<String> values = exchange.getQueryParameters().get(key);
        String value = values == null || values.isEmpty() ? "" : values.peekFirst();
        return value == null ? "" : value.trim();
    }

    private String header(HttpServerExchange exchange, String name) {
        String value = exchange.getRequestHeaders().getFirst(name);
        return value == null ? "" : value;
    }

    private static String iso(Instant instant) {
        return instant == null ? null : instant.toString();
    }

    private static int resolveBoundPort(Undertow undertow, int fallbackPort) {
        List<Undertow.ListenerInfo> listeners = undertow.getListenerInfo();
        if (!listeners.isEmpty() && listeners.get(0).getAddress() instanceof InetSocketAddress socketAddress) {
            return socketAddress.getPort();
        }
        return fallbackPort;
    }

    @FunctionalInterface
    private interface Endpoint {
        void handle(HttpServerExchange exchange) throws Exception;
    }
}

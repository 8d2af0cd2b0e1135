package io.tiergate.core.payment;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import okhttp3.Credentials;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Razorpay Orders API client. Amounts are in minor units. 429 and 5xx answers and I/O failures are
 * retried with exponential backoff; other error answers fail immediately.
 */
public final class RazorpayOrderClient implements OrderLookup {
    private static final Logger LOG = LoggerFactory.getLogger(RazorpayOrderClient.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final int MAX_RECEIPT_LENGTH = 40;

    private final HttpUrl apiBase;
    private final String keyId;
    private final String keySecret;
    private final Clock clock;
    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final int maxAttempts;

    public RazorpayOrderClient(String apiBase, String keyId, String keySecret, Clock clock) {
        this(apiBase, keyId, keySecret, clock, 3);
    }

    public RazorpayOrderClient(String apiBase, String keyId, String keySecret, Clock clock, int maxAttempts) {
        this.apiBase = HttpUrl.get(Objects.requireNonNull(apiBase, "apiBase must not be null"));
        this.keyId = keyId == null ? "" : keyId;
        this.keySecret = keySecret == null ? "" : keySecret;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.maxAttempts = Math.max(1, maxAttempts);
        this.client = new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(10))
            .readTimeout(Duration.ofSeconds(30))
            .writeTimeout(Duration.ofSeconds(10))
            .build();
        this.mapper = new ObjectMapper();
    }

    public OrderResult createOrder(String userId, Plan plan, String discountCode, long amountMinor, String currency)
        throws IOException {
        if (keyId.isBlank() || keySecret.isBlank()) {
            throw new IOException("Razorpay API credentials are not configured");
        }
        Map<String, String> notes = new LinkedHashMap<>();
        notes.put("user_id", userId);
        notes.put("plan_id", plan.id());
        notes.put("discount_code", discountCode == null ? "" : discountCode);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("amount", amountMinor);
        payload.put("currency", currency);
        payload.put("receipt", receipt(userId));
        payload.put("notes", notes);

        Request request = new Request.Builder()
            .url(apiBase.newBuilder().addPathSegment("orders").build())
            .post(RequestBody.create(mapper.writeValueAsString(payload), JSON))
            .header("Authorization", Credentials.basic(keyId, keySecret))
            .header("Accept", "application/json")
            .build();
        JsonNode body = execute(request).orElseThrow(() -> new IOException("Razorpay returned no order"));
        OrderResult order = toOrder(body);
        LOG.info("Created order {} for user {} plan {} amount {} {}", order.orderId(), userId, plan.id(), amountMinor, currency);
        return order;
    }

    @Override
    public Optional<OrderResult> fetchOrder(String orderId) throws IOException {
        if (keyId.isBlank() || keySecret.isBlank()) {
            throw new IOException("Razorpay API credentials are not configured");
        }
        if (orderId == null || orderId.isBlank()) {
            return Optional.empty();
        }
        Request request = new Request.Builder()
            .url(apiBase.newBuilder().addPathSegment("orders").addPathSegment(orderId.trim()).build())
            .get()
            .header("Authorization", Credentials.basic(keyId, keySecret))
            .header("Accept", "application/json")
            .build();
        return execute(request).map(this::toOrder);
    }

    String receipt(String userId) {
        String receipt = "tiergate_" + userId + "_" + clock.instant().getEpochSecond();
        return receipt.length() <= MAX_RECEIPT_LENGTH ? receipt : receipt.substring(0, MAX_RECEIPT_LENGTH);
    }

    private Optional<JsonNode> execute(Request request) throws IOException {
        long delayMs = 250;
        for (int attempt = 1; ; attempt++) {
            try (Response response = client.newCall(request).execute()) {
                ResponseBody responseBody = response.body();
                String text = responseBody == null ? "" : responseBody.string();
                if (response.isSuccessful()) {
                    return Optional.of(mapper.readTree(text.isBlank() ? "{}" : text));
                }
                if (response.code() == 404) {
                    return Optional.empty();
                }
                boolean retryable = response.code() == 429 || response.code() >= 500;
                if (!retryable || attempt >= maxAttempts) {
                    throw new RazorpayApiException(response.code(), errorDescription(text));
                }
                LOG.warn("Razorpay answered HTTP {} (attempt {}/{}), retrying", response.code(), attempt, maxAttempts);
            } catch (RazorpayApiException e) {
                throw e;
            } catch (IOException e) {
                if (attempt >= maxAttempts) {
                    throw e;
                }
                LOG.warn("Razorpay call failed (attempt {}/{}), retrying: {}", attempt, maxAttempts, e.getMessage());
            }
            sleep(delayMs);
            delayMs = Math.min(delayMs * 2, 2000);
        }
    }

    private OrderResult toOrder(JsonNode node) {
        Map<String, String> notes = new LinkedHashMap<>();
        JsonNode notesNode = node.path("notes");
        if (notesNode.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = notesNode.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                notes.put(field.getKey(), field.getValue().asText(""));
            }
        }
        return new OrderResult(
            node.path("id").asText(""),
            node.path("amount").asLong(0),
            node.path("currency").asText(""),
            node.path("status").asText(""),
            node.path("receipt").asText(""),
            notes
        );
    }

    private String errorDescription(String body) {
        try {
            JsonNode error = mapper.readTree(body).path("error");
            String description = error.path("description").asText("");
            return description.isBlank() ? body : description;
        } catch (IOException e) {
            return body;
        }
    }

    private void sleep(long delayMs) throws IOException {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while retrying Razorpay call", ie);
        }
    }

    /**
     * Non-retryable error answer from the API.
     */
    public static final class RazorpayApiException extends IOException {
        private final int statusCode;

        public RazorpayApiException(int statusCode, String description) {
            super("Razorpay request failed: HTTP " + statusCode + " " + description);
            this.statusCode = statusCode;
        }

        public int statusCode() {
            return statusCode;
        }
    }
}

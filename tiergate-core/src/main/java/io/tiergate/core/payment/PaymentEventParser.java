package io.tiergate.core.payment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Optional;
import java.util.Set;

/**
 * Turns a processor webhook body into a {@link PaymentEvent}. Only captured-payment notifications are
 * returned; other event types parse to empty. Required fields are checked here so nothing downstream
 * sees a partial event.
 */
public final class PaymentEventParser {
    public static final String PAYMENT_CAPTURED = "payment.captured";
    public static final String ORDER_PAID = "order.paid";
    private static final Set<String> SUPPORTED = Set.of(PAYMENT_CAPTURED, ORDER_PAID);

    private final ObjectMapper mapper;

    public PaymentEventParser() {
        this(new ObjectMapper());
    }

    public PaymentEventParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public Optional<PaymentEvent> parse(String rawBody, String signature) throws PaymentValidationException {
        JsonNode root = readTree(rawBody);
        String eventType = root.path("event").asText("");
        if (eventType.isBlank()) {
            throw new PaymentValidationException("Webhook body has no event type");
        }
        if (!SUPPORTED.contains(eventType)) {
            return Optional.empty();
        }

        JsonNode entity = root.path("payload").path("payment").path("entity");
        if (!entity.isObject()) {
            throw new PaymentValidationException("Event " + eventType + " carries no payment entity");
        }
        JsonNode notes = entity.path("notes");
        JsonNode amount = entity.path("amount");
        if (!amount.canConvertToLong() || !amount.isIntegralNumber()) {
            throw new PaymentValidationException("Payment amount must be an integer in minor units");
        }

        PaymentEvent event = new PaymentEvent(
            eventType,
            required(entity, "id", "payment id"),
            entity.path("order_id").asText(""),
            required(notes, "user_id", "notes.user_id"),
            required(notes, "plan_id", "notes.plan_id"),
            amount.asLong(),
            required(entity, "currency", "currency"),
            required(entity, "status", "status"),
            notes.path("discount_code").asText(""),
            rawBody,
            signature,
            SignatureScheme.WEBHOOK
        );
        if (!"captured".equalsIgnoreCase(event.status())) {
            throw new PaymentValidationException("Payment " + event.paymentId() + " is " + event.status() + ", not captured");
        }
        return Optional.of(event);
    }

    String eventType(String rawBody) {
        try {
            return readTree(rawBody).path("event").asText("");
        } catch (PaymentValidationException e) {
            return "";
        }
    }

    private JsonNode readTree(String rawBody) throws PaymentValidationException {
        if (rawBody == null || rawBody.isBlank()) {
            throw new PaymentValidationException("Webhook body is empty");
        }
        try {
            JsonNode root = mapper.readTree(rawBody);
            if (root == null || !root.isObject()) {
                throw new PaymentValidationException("Webhook body must be a JSON object");
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new PaymentValidationException("Webhook body is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static String required(JsonNode node, String field, String label) throws PaymentValidationException {
        JsonNode value = node.path(field);
        String text = value.isValueNode() ? value.asText("").trim() : "";
        if (text.isEmpty()) {
            throw new PaymentValidationException("Missing required field " + label);
        }
        return text;
    }
}

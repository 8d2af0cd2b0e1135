package io.tiergate.core.payment;

import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

/**
 * HMAC-SHA256 signatures used by the payment processor. Comparison runs in constant time. A blank secret
 * never verifies anything.
 */
public final class WebhookSignatureVerifier {
    private static final String ALGORITHM = "HmacSHA256";

    private final String webhookSecret;
    private final String keySecret;

    public WebhookSignatureVerifier(String webhookSecret, String keySecret) {
        this.webhookSecret = webhookSecret == null ? "" : webhookSecret;
        this.keySecret = keySecret == null ? "" : keySecret;
    }

    public boolean verifyWebhook(String rawBody, String signature) {
        return matches(webhookSecret, rawBody == null ? "" : rawBody, signature);
    }

    public boolean verifyCheckout(String orderId, String paymentId, String signature) {
        return matches(keySecret, orderId + "|" + paymentId, signature);
    }

    public void verify(PaymentEvent event) throws PaymentVerificationException {
        boolean valid = switch (event.scheme()) {
            case WEBHOOK -> verifyWebhook(event.rawPayload(), event.signature());
            case CHECKOUT -> verifyCheckout(event.orderId(), event.paymentId(), event.signature());
        };
        if (!valid) {
            throw new PaymentVerificationException(
                "Invalid " + event.scheme().name().toLowerCase(Locale.ROOT) + " signature for payment " + event.paymentId()
            );
        }
    }

    public boolean webhookConfigured() {
        return !webhookSecret.isBlank();
    }

    public static String sign(String payload, String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalArgumentException("Signing secret must not be blank");
        }
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(payload.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }

    private static boolean matches(String secret, String payload, String signature) {
        if (secret.isBlank() || signature == null || signature.isBlank()) {
            return false;
        }
        byte[] expected = sign(payload, secret).getBytes(StandardCharsets.UTF_8);
        byte[] actual = signature.trim().toLowerCase(Locale.ROOT).getBytes(StandardCharsets.UTF_8);
        return MessageDigest.isEqual(expected, actual);
    }
}

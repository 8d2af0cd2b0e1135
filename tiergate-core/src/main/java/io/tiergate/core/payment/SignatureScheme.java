package io.tiergate.core.payment;

/**
 * How a payment event is authenticated.
 */
public enum SignatureScheme {
    /** HMAC-SHA256 of the raw webhook body under the webhook secret. */
    WEBHOOK,
    /** HMAC-SHA256 of {@code orderId|paymentId} under the API key secret, as returned by checkout. */
    CHECKOUT
}

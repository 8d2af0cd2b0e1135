package io.tiergate.core.payment;

/**
 * Signature did not match the shared secret. May indicate a forged notification.
 */
public class PaymentVerificationException extends Exception {

    public PaymentVerificationException(String message) {
        super(message);
    }
}

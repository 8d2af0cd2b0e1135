package io.tiergate.core.payment;

/**
 * Malformed payment event, unknown plan, or an amount or currency that does not match the plan.
 */
public class PaymentValidationException extends Exception {

    public PaymentValidationException(String message) {
        super(message);
    }

    public PaymentValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}

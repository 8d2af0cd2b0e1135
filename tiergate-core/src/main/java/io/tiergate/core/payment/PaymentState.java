package io.tiergate.core.payment;

/**
 * Where a payment notification ended up. {@code VERIFIED} is an authentic notification with nothing to
 * apply, such as an event type that does not change entitlements.
 */
public enum PaymentState {
    VERIFIED,
    APPLIED,
    REJECTED
}

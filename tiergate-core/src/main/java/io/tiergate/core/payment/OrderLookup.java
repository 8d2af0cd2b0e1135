package io.tiergate.core.payment;

import java.io.IOException;
import java.util.Optional;

@FunctionalInterface
public interface OrderLookup {
    Optional<OrderResult> fetchOrder(String orderId) throws IOException;
}

package io.tiergate.cli;

import io.tiergate.core.payment.OrderResult;
import io.tiergate.core.runtime.EntitlementRuntime;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "order", description = "Create a payment order for a plan")
public final class OrderCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", description = "User id")
    String userId;

    @Parameters(index = "1", description = "Plan id, e.g. monthly")
    String planId;

    @Option(names = {"--discount"}, description = "Discount code")
    String discountCode;

    public OrderCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            EntitlementRuntime runtime = context.openRuntime();
            OrderResult order = runtime.placeOrder(userId, planId, discountCode == null ? "" : discountCode);
            System.out.println("Order: " + order.orderId());
            System.out.println("Amount: " + order.amountMinor() + " " + order.currency());
            System.out.println("Receipt: " + order.receipt());
            return 0;
        } catch (Exception e) {
            System.err.println("Order command failed: " + e.getMessage());
            return 1;
        }
    }
}

package io.tiergate.cli;

import io.tiergate.core.runtime.EntitlementRuntime;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "reset", description = "Reset daily quota of every user last reset before today")
public final class ResetCommand implements Callable<Integer> {
    private final CliContext context;

    public ResetCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            EntitlementRuntime runtime = context.openRuntime();
            int reset = runtime.newResetScheduler().runOnce();
            System.out.println("Reset " + reset + " record(s) for " + runtime.boundary().dayOf(context.clock().instant()));
            return 0;
        } catch (Exception e) {
            System.err.println("Reset command failed: " + e.getMessage());
            return 1;
        }
    }
}

package io.tiergate.cli;

import io.tiergate.core.config.ConfigPaths;
import io.tiergate.core.config.model.TiergateConfig;
import io.tiergate.core.payment.Plan;
import io.tiergate.core.payment.PlanCatalog;
import java.nio.file.Files;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show configuration status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            TiergateConfig config = context.configService().load(context.configPath());
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Store backend: " + config.store().backend());
            System.out.println("Data directory: " + ConfigPaths.resolveDataDir(config.store().path()));
            System.out.println("Reset timezone: " + config.quota().zoneId());
            System.out.println("Free daily limit: " + config.quota().freeDailyLimit());
            System.out.println("Gateway: " + config.gateway().host() + ":" + config.gateway().port());
            System.out.println("Webhook secret configured: " + config.payments().webhookConfigured());
            System.out.println("Razorpay API configured: " + config.payments().apiConfigured());
            PlanCatalog plans = new PlanCatalog(config.payments().plans(), config.payments().currency());
            for (Plan plan : plans.all()) {
                System.out.printf("Plan %s: %s, %d days, %d %s%n",
                    plan.id(), plan.name(), plan.durationDays(), plan.priceMinor(), plans.currency());
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}

package io.tiergate.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TiergateConfig(
    QuotaConfig quota,
    PaymentsConfig payments,
    StoreConfig store,
    GatewayConfig gateway
) {

    public TiergateConfig {
        quota = quota == null ? QuotaConfig.defaults() : quota;
        payments = payments == null ? PaymentsConfig.defaults() : payments;
        store = store == null ? StoreConfig.defaults() : store;
        gateway = gateway == null ? GatewayConfig.defaults() : gateway;
    }

    public static TiergateConfig defaults() {
        return new TiergateConfig(
            QuotaConfig.defaults(),
            PaymentsConfig.defaults(),
            StoreConfig.defaults(),
            GatewayConfig.defaults()
        );
    }

    public TiergateConfig withPayments(PaymentsConfig updated) {
        return new TiergateConfig(quota, updated, store, gateway);
    }
}

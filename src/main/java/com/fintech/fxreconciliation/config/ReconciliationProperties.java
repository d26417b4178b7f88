package com.fintech.fxreconciliation.config;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Binds the {@code reconciliation.*} block of application.yml.
 * <p>
 * Example:
 * <pre>
 * reconciliation:
 *   discrepancy-threshold-usd: 0.50
 *   fx-deviation-alert-pct: 3.0
 *   market-rates:
 *     MXN: 17.50
 * </pre>
 */
@Data
@Validated
@ConfigurationProperties(prefix = "reconciliation")
public class ReconciliationProperties {

    @NotNull
    @DecimalMin("0.00")
    private BigDecimal discrepancyThresholdUsd = ReconciliationSettings.DEFAULT_DISCREPANCY_THRESHOLD_USD;

    @NotNull
    private BigDecimal fxDeviationAlertPct = ReconciliationSettings.DEFAULT_FX_DEVIATION_ALERT_PCT;

    private Map<String, BigDecimal> marketRates = new LinkedHashMap<>();

    private Cors cors = new Cors();

    /**
     * Snapshot of the bound values for a single reconciliation pass.
     * Falls back to the built-in rate table when none is configured.
     */
    public ReconciliationSettings toSettings() {
        if (marketRates.isEmpty()) {
            return ReconciliationSettings.defaults().toBuilder()
                    .discrepancyThresholdUsd(discrepancyThresholdUsd)
                    .fxDeviationAlertPct(fxDeviationAlertPct)
                    .build();
        }

        ReconciliationSettings.ReconciliationSettingsBuilder builder = ReconciliationSettings.builder()
                .discrepancyThresholdUsd(discrepancyThresholdUsd)
                .fxDeviationAlertPct(fxDeviationAlertPct);
        marketRates.forEach((currency, rate) ->
                builder.marketRate(currency.trim().toUpperCase(Locale.ROOT), rate));
        return builder.build();
    }

    @Data
    public static class Cors {
        private List<String> allowedOrigins = new ArrayList<>(List.of("*"));
    }
}

package com.fintech.fxreconciliation.config;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable configuration for one reconciliation pass.
 * <p>
 * Passed into the engine and the pattern detector on every call so tests and
 * deployments can override thresholds or market rates without global state.
 */
@Value
@Builder(toBuilder = true)
public class ReconciliationSettings {

    public static final BigDecimal DEFAULT_DISCREPANCY_THRESHOLD_USD = new BigDecimal("0.50");
    public static final BigDecimal DEFAULT_FX_DEVIATION_ALERT_PCT = new BigDecimal("3.0");

    /**
     * A matched pair is flagged when |actual - expected| is strictly greater than this.
     */
    @Builder.Default
    BigDecimal discrepancyThresholdUsd = DEFAULT_DISCREPANCY_THRESHOLD_USD;

    /**
     * FX deviation (percent) above which a settlement counts as adverse.
     */
    @Builder.Default
    BigDecimal fxDeviationAlertPct = DEFAULT_FX_DEVIATION_ALERT_PCT;

    /**
     * Local-currency units per 1 USD, keyed by upper-case currency code.
     */
    @Singular
    Map<String, BigDecimal> marketRates;

    /**
     * Returns the reference rate for a currency, or null when none is usable.
     * Rates of zero or below are treated as missing.
     */
    public BigDecimal marketRateFor(String currency) {
        if (currency == null) {
            return null;
        }
        BigDecimal rate = marketRates.get(currency.toUpperCase(Locale.ROOT));
        if (rate == null || rate.signum() <= 0) {
            return null;
        }
        return rate;
    }

    /**
     * Settings with the standard thresholds and the reference rate table the
     * service ships with.
     */
    public static ReconciliationSettings defaults() {
        return ReconciliationSettings.builder()
                .marketRate("MXN", new BigDecimal("17.50"))
                .marketRate("BRL", new BigDecimal("5.00"))
                .marketRate("IDR", new BigDecimal("15500.0"))
                .marketRate("KES", new BigDecimal("130.0"))
                .marketRate("COP", new BigDecimal("4000.0"))
                .build();
    }
}

package com.fintech.fxreconciliation.service;

import com.fintech.fxreconciliation.config.ReconciliationSettings;
import com.fintech.fxreconciliation.model.Alert;
import com.fintech.fxreconciliation.model.AlertSeverity;
import com.fintech.fxreconciliation.model.AlertType;
import com.fintech.fxreconciliation.model.ReconciledTransaction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Scans a reconciled set for anomalies that only show up in aggregate.
 * <p>
 * Rules, evaluated and emitted in this order:
 * 1. Processor: a processor with at least 2 flagged transactions and a high flag rate or dollar total
 * 2. Currency: same grouping by currency, triggered by flag rate only
 * 3. Large discrepancy: flagged transactions off by more than $50
 * 4. Adverse FX: settlements priced worse than market by more than the configured percentage
 * <p>
 * Only matched transactions are considered.
 */
@Service
@Slf4j
public class PatternDetector {

    static final int MAX_EXAMPLE_IDS = 5;

    private static final int MIN_FLAGGED_IN_GROUP = 2;
    private static final BigDecimal ALERT_RATE = new BigDecimal("0.15");
    private static final BigDecimal HIGH_RATE = new BigDecimal("0.25");
    private static final BigDecimal PROCESSOR_ALERT_USD = new BigDecimal("15");
    private static final BigDecimal PROCESSOR_HIGH_USD = new BigDecimal("40");
    private static final BigDecimal LARGE_DISCREPANCY_USD = new BigDecimal("50");
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    /**
     * @throws NullPointerException if the list or settings are null
     */
    public List<Alert> detect(List<ReconciledTransaction> transactions, ReconciliationSettings settings) {
        Objects.requireNonNull(transactions, "transactions");
        Objects.requireNonNull(settings, "settings");

        List<ReconciledTransaction> matched = transactions.stream()
                .filter(ReconciledTransaction::isMatched)
                .collect(Collectors.toList());

        List<Alert> alerts = new ArrayList<>();
        detectProcessorIssues(matched, alerts);
        detectCurrencyAnomalies(matched, alerts);
        detectLargeDiscrepancies(matched, alerts);
        detectAdverseFxRates(matched, settings.getFxDeviationAlertPct(), alerts);

        log.debug("Pattern detection over {} matched transactions raised {} alert(s)",
                matched.size(), alerts.size());
        return alerts;
    }

    private void detectProcessorIssues(List<ReconciledTransaction> matched, List<Alert> alerts) {
        group(matched, ReconciledTransaction::getPaymentProcessor).forEach((processor, stats) -> {
            if (stats.flagged < MIN_FLAGGED_IN_GROUP) {
                return;
            }
            BigDecimal rate = stats.rate();
            boolean rateTriggered = rate.compareTo(ALERT_RATE) > 0;
            if (!rateTriggered && stats.totalDifference.compareTo(PROCESSOR_ALERT_USD) <= 0) {
                return;
            }
            boolean high = rate.compareTo(HIGH_RATE) > 0
                    || stats.totalDifference.compareTo(PROCESSOR_HIGH_USD) > 0;

            alerts.add(Alert.builder()
                    .type(AlertType.PROCESSOR)
                    .severity(high ? AlertSeverity.HIGH : AlertSeverity.MEDIUM)
                    .title("Processor Issue: " + processor)
                    .message(String.format("%d of %d transactions flagged (%s%% rate), $%s total discrepancy",
                            stats.flagged, stats.total, wholePercent(rate), dollars(stats.totalDifference)))
                    .processor(processor)
                    .flaggedCount(stats.flagged)
                    .totalCount(stats.total)
                    .discrepancyRatePct(ratePct(rate))
                    .totalDifferenceUsd(dollars(stats.totalDifference))
                    .build());
        });
    }

    private void detectCurrencyAnomalies(List<ReconciledTransaction> matched, List<Alert> alerts) {
        group(matched, ReconciledTransaction::getCustomerCurrency).forEach((currency, stats) -> {
            BigDecimal rate = stats.rate();
            if (stats.flagged < MIN_FLAGGED_IN_GROUP || rate.compareTo(ALERT_RATE) <= 0) {
                return;
            }

            alerts.add(Alert.builder()
                    .type(AlertType.CURRENCY)
                    .severity(rate.compareTo(HIGH_RATE) > 0 ? AlertSeverity.HIGH : AlertSeverity.MEDIUM)
                    .title("Currency Anomaly: " + currency)
                    .message(String.format("%d of %d %s transactions flagged (%s%% rate), $%s total discrepancy",
                            stats.flagged, stats.total, currency, wholePercent(rate), dollars(stats.totalDifference)))
                    .currency(currency)
                    .flaggedCount(stats.flagged)
                    .totalCount(stats.total)
                    .discrepancyRatePct(ratePct(rate))
                    .totalDifferenceUsd(dollars(stats.totalDifference))
                    .build());
        });
    }

    private void detectLargeDiscrepancies(List<ReconciledTransaction> matched, List<Alert> alerts) {
        List<ReconciledTransaction> large = matched.stream()
                .filter(ReconciledTransaction::isDiscrepancy)
                .filter(t -> t.getDifference() != null
                        && t.getDifference().abs().compareTo(LARGE_DISCREPANCY_USD) > 0)
                .collect(Collectors.toList());
        if (large.isEmpty()) {
            return;
        }

        BigDecimal total = large.stream()
                .map(t -> t.getDifference().abs())
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        alerts.add(Alert.builder()
                .type(AlertType.LARGE_DISCREPANCY)
                .severity(AlertSeverity.CRITICAL)
                .title("Large Discrepancies Detected")
                .message(String.format("%d transaction(s) with discrepancy > $%s USD",
                        large.size(), LARGE_DISCREPANCY_USD.toPlainString()))
                .count(large.size())
                .transactionIds(exampleIds(large))
                .totalDifferenceUsd(dollars(total))
                .build());
    }

    private void detectAdverseFxRates(List<ReconciledTransaction> matched, BigDecimal threshold,
                                      List<Alert> alerts) {
        List<ReconciledTransaction> adverse = matched.stream()
                .filter(t -> t.getFxDeviationPct() != null
                        && t.getFxDeviationPct().compareTo(threshold) > 0)
                .collect(Collectors.toList());
        if (adverse.isEmpty()) {
            return;
        }

        alerts.add(Alert.builder()
                .type(AlertType.FX_RATE)
                .severity(AlertSeverity.HIGH)
                .title("Adverse FX Rates Detected")
                .message(String.format("%d transaction(s) settled at FX rates more than %s%% worse than market reference",
                        adverse.size(), threshold.setScale(0, RoundingMode.HALF_EVEN).toPlainString()))
                .count(adverse.size())
                .transactionIds(exampleIds(adverse))
                .build());
    }

    private Map<String, GroupStats> group(List<ReconciledTransaction> matched,
                                          Function<ReconciledTransaction, String> key) {
        Map<String, GroupStats> groups = new LinkedHashMap<>();
        for (ReconciledTransaction t : matched) {
            groups.computeIfAbsent(key.apply(t), k -> new GroupStats()).add(t);
        }
        return groups;
    }

    private List<String> exampleIds(List<ReconciledTransaction> transactions) {
        return transactions.stream()
                .limit(MAX_EXAMPLE_IDS)
                .map(ReconciledTransaction::getTransactionId)
                .collect(Collectors.toList());
    }

    private static String wholePercent(BigDecimal rate) {
        return rate.multiply(HUNDRED).setScale(0, RoundingMode.HALF_EVEN).toPlainString();
    }

    private static BigDecimal ratePct(BigDecimal rate) {
        return rate.multiply(HUNDRED).setScale(1, RoundingMode.HALF_UP);
    }

    private static BigDecimal dollars(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP);
    }

    /**
     * Running totals for one processor or currency.
     */
    private static final class GroupStats {
        private int total;
        private int flagged;
        private BigDecimal totalDifference = BigDecimal.ZERO;

        void add(ReconciledTransaction t) {
            total++;
            if (t.isDiscrepancy()) {
                flagged++;
                // invalid-input records are flagged without a difference
                if (t.getDifference() != null) {
                    totalDifference = totalDifference.add(t.getDifference().abs());
                }
            }
        }

        BigDecimal rate() {
            return BigDecimal.valueOf(flagged).divide(BigDecimal.valueOf(total), MathContext.DECIMAL64);
        }
    }
}

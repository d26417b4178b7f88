package com.fintech.fxreconciliation.service;

import com.fintech.fxreconciliation.dto.ReconciliationResult;
import com.fintech.fxreconciliation.dto.ReconciliationResult.DimensionStats;
import com.fintech.fxreconciliation.model.Alert;
import com.fintech.fxreconciliation.model.MatchStatus;
import com.fintech.fxreconciliation.model.ReconciledTransaction;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Rolls a reconciled set up into the totals and per-currency / per-processor
 * breakdowns shown on the dashboard.
 */
@Service
public class ReconciliationAggregator {

    public ReconciliationResult summarize(List<ReconciledTransaction> transactions, List<Alert> alerts) {
        Objects.requireNonNull(transactions, "transactions");
        Objects.requireNonNull(alerts, "alerts");

        int matched = 0;
        int unmatchedOrders = 0;
        int unmatchedSettlements = 0;
        int flagged = 0;
        BigDecimal totalDiscrepancy = BigDecimal.ZERO;

        for (ReconciledTransaction t : transactions) {
            switch (t.getStatus()) {
                case MATCHED -> matched++;
                case UNMATCHED_ORDER -> unmatchedOrders++;
                case UNMATCHED_SETTLEMENT -> unmatchedSettlements++;
            }
            if (t.isDiscrepancy()) {
                flagged++;
                totalDiscrepancy = totalDiscrepancy.add(absDifference(t));
            }
        }

        return ReconciliationResult.builder()
                .totalOrders(matched + unmatchedOrders)
                .totalSettlements(matched + unmatchedSettlements)
                .matched(matched)
                .unmatchedOrders(unmatchedOrders)
                .unmatchedSettlements(unmatchedSettlements)
                .flaggedCount(flagged)
                .totalDiscrepancyUsd(totalDiscrepancy.setScale(2, RoundingMode.HALF_UP))
                .transactions(new ArrayList<>(transactions))
                .patternAlerts(new ArrayList<>(alerts))
                .currencyStats(breakdown(transactions, ReconciledTransaction::getCustomerCurrency))
                .processorStats(breakdown(transactions, ReconciledTransaction::getPaymentProcessor))
                .build();
    }

    /**
     * Matched transactions only, keyed in first-seen order.
     */
    private Map<String, DimensionStats> breakdown(List<ReconciledTransaction> transactions,
                                                  Function<ReconciledTransaction, String> key) {
        Map<String, DimensionStats> stats = new LinkedHashMap<>();
        for (ReconciledTransaction t : transactions) {
            String k = key.apply(t);
            if (t.getStatus() != MatchStatus.MATCHED || k == null || k.isEmpty()) {
                continue;
            }
            DimensionStats s = stats.computeIfAbsent(k, ignored -> DimensionStats.builder()
                    .discrepancyUsd(BigDecimal.ZERO)
                    .build());
            s.setVolumeCount(s.getVolumeCount() + 1);
            if (t.isDiscrepancy()) {
                s.setDiscrepancyCount(s.getDiscrepancyCount() + 1);
                s.setDiscrepancyUsd(s.getDiscrepancyUsd().add(absDifference(t)));
            }
        }
        stats.values().forEach(s -> s.setDiscrepancyUsd(s.getDiscrepancyUsd().setScale(2, RoundingMode.HALF_UP)));
        return stats;
    }

    private static BigDecimal absDifference(ReconciledTransaction t) {
        return t.getDifference() == null ? BigDecimal.ZERO : t.getDifference().abs();
    }
}

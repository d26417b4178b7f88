package com.fintech.fxreconciliation.dto;

import com.fintech.fxreconciliation.model.Alert;
import com.fintech.fxreconciliation.model.ReconciledTransaction;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything one reconciliation pass produces.
 * Serialised as the response body of the reconcile endpoint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReconciliationResult {

    /**
     * Distinct order ids; a repeated id in the orders file counts once.
     */
    private int totalOrders;

    /**
     * Distinct settlement ids; a repeated id in the settlements file counts once.
     */
    private int totalSettlements;

    private int matched;
    private int unmatchedOrders;
    private int unmatchedSettlements;
    private int flaggedCount;

    /**
     * Sum of |difference| over flagged matched transactions, 2 decimals.
     */
    @Builder.Default
    private BigDecimal totalDiscrepancyUsd = BigDecimal.ZERO.setScale(2);

    @Builder.Default
    private List<ReconciledTransaction> transactions = new ArrayList<>();

    @Builder.Default
    private List<Alert> patternAlerts = new ArrayList<>();

    @Builder.Default
    private Map<String, DimensionStats> currencyStats = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, DimensionStats> processorStats = new LinkedHashMap<>();

    /**
     * Volume and discrepancy totals for one currency or processor.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DimensionStats {
        private int volumeCount;
        private int discrepancyCount;
        private BigDecimal discrepancyUsd;
    }
}

package com.fintech.fxreconciliation.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * One aggregate anomaly found across a reconciled set.
 * <p>
 * Only the fields relevant to the {@link AlertType} are populated:
 * <ul>
 *   <li>PROCESSOR / CURRENCY: the group key, flagged and total counts, rate and dollar total</li>
 *   <li>LARGE_DISCREPANCY: count, dollar total and example identifiers</li>
 *   <li>FX_RATE: count and example identifiers</li>
 * </ul>
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Alert {

    AlertType type;
    AlertSeverity severity;
    String title;
    String message;

    String processor;
    String currency;

    Integer flaggedCount;
    Integer totalCount;

    /**
     * Share of flagged transactions in the group, 1 decimal.
     */
    BigDecimal discrepancyRatePct;

    BigDecimal totalDifferenceUsd;

    Integer count;

    /**
     * Up to five example identifiers, in reconciliation order.
     */
    List<String> transactionIds;
}

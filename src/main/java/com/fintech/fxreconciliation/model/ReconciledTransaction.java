package com.fintech.fxreconciliation.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * The joined view of one transaction identifier.
 * <p>
 * For {@link MatchStatus#MATCHED} records every order and settlement field is present along
 * with the derived amounts. Unmatched records only carry the fields of the side that exists.
 * Currency amounts are rounded to 4 decimals and percentages to 2 decimals when built.
 */
@Value
@Builder
public class ReconciledTransaction {

    String transactionId;
    String orderDate;
    String settlementDate;
    String customerCurrency;
    BigDecimal originalAmount;
    String paymentProcessor;
    BigDecimal fxRateApplied;
    BigDecimal feesDeducted;
    BigDecimal expectedUsd;
    BigDecimal actualUsd;

    /**
     * actual - expected; positive means the merchant received more than expected.
     */
    BigDecimal difference;

    BigDecimal differencePct;

    /**
     * How far the applied FX rate is from the market reference, in percent.
     * Positive means the merchant got fewer dollars than at market. Null when no
     * reference rate is configured for the currency.
     */
    BigDecimal fxDeviationPct;

    MatchStatus status;

    @JsonProperty("is_discrepancy")
    boolean discrepancy;

    String discrepancyReason;

    @JsonIgnore
    public boolean isMatched() {
        return status == MatchStatus.MATCHED;
    }
}

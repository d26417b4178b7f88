package com.fintech.fxreconciliation.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * USD payout reported by a payment processor after FX conversion and fee deduction.
 */
@Value
@Builder
public class Settlement {

    String transactionId;
    String settlementDate;
    BigDecimal usdAmountReceived;

    /**
     * Local-currency units per 1 USD used by the processor.
     */
    BigDecimal fxRateApplied;

    /**
     * Fees withheld by the processor, in USD.
     */
    BigDecimal feesDeducted;
}

package com.fintech.fxreconciliation.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * A customer purchase recorded in the merchant's local currency.
 * <p>
 * The order date is carried through as text; its format is never interpreted.
 */
@Value
@Builder
public class Order {

    String transactionId;
    String orderDate;

    /**
     * Upper-cased 3-letter currency code, e.g. MXN.
     */
    String customerCurrency;

    /**
     * Amount charged to the customer, in {@link #customerCurrency}.
     */
    BigDecimal originalAmount;

    String paymentProcessor;
}

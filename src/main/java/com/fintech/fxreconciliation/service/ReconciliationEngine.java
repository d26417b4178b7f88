package com.fintech.fxreconciliation.service;

import com.fintech.fxreconciliation.config.ReconciliationSettings;
import com.fintech.fxreconciliation.model.MatchStatus;
import com.fintech.fxreconciliation.model.Order;
import com.fintech.fxreconciliation.model.ReconciledTransaction;
import com.fintech.fxreconciliation.model.Settlement;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Joins orders and settlements on transaction identifier and checks that the
 * USD actually settled matches what the order amount, FX rate and fees imply.
 * <p>
 * Key behaviours:
 * 1. Output order: orders in input order, then settlements that matched no order
 * 2. Duplicate identifiers: the last record wins but keeps the first record's position
 * 3. A non-positive FX rate or negative order amount is flagged, never divided by
 * <p>
 * Stateless; one instance serves concurrent requests.
 */
@Service
@Slf4j
public class ReconciliationEngine {

    static final String NO_SETTLEMENT_REASON = "No matching settlement record";
    static final String NO_ORDER_REASON = "No matching order record";

    private static final BigDecimal LARGE_DISCREPANCY_USD = new BigDecimal("100");
    private static final BigDecimal HIGH_DEVIATION_PCT = new BigDecimal("5");
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private static final MathContext MATH = MathContext.DECIMAL64;
    private static final int AMOUNT_SCALE = 4;
    private static final int PERCENT_SCALE = 2;

    /**
     * Reconciles the two record sets.
     *
     * @return one record per distinct transaction identifier across both inputs
     * @throws NullPointerException if either list, any element, or the settings are null
     */
    public List<ReconciledTransaction> reconcile(List<Order> orders,
                                                 List<Settlement> settlements,
                                                 ReconciliationSettings settings) {
        Objects.requireNonNull(orders, "orders");
        Objects.requireNonNull(settlements, "settlements");
        Objects.requireNonNull(settings, "settings");

        Map<String, Order> ordersById = indexById(orders, Order::getTransactionId, "order");
        Map<String, Settlement> settlementsById =
                indexById(settlements, Settlement::getTransactionId, "settlement");

        Set<String> matchedIds = new HashSet<>();
        List<ReconciledTransaction> transactions =
                new ArrayList<>(ordersById.size() + settlementsById.size());

        for (Order order : ordersById.values()) {
            Settlement settlement = settlementsById.get(order.getTransactionId());
            if (settlement != null) {
                matchedIds.add(order.getTransactionId());
                transactions.add(match(order, settlement, settings));
            } else {
                transactions.add(unmatchedOrder(order));
            }
        }

        for (Settlement settlement : settlementsById.values()) {
            if (!matchedIds.contains(settlement.getTransactionId())) {
                transactions.add(unmatchedSettlement(settlement));
            }
        }

        log.debug("Reconciled {} orders and {} settlements into {} transactions ({} matched)",
                ordersById.size(), settlementsById.size(), transactions.size(), matchedIds.size());

        return transactions;
    }

    private <T> Map<String, T> indexById(List<T> records, Function<T, String> idOf, String kind) {
        Map<String, T> index = new LinkedHashMap<>();
        int duplicates = 0;
        for (T record : records) {
            Objects.requireNonNull(record, kind);
            String id = Objects.requireNonNull(idOf.apply(record), kind + " transaction id");
            if (index.put(id, record) != null) {
                duplicates++;
            }
        }
        if (duplicates > 0) {
            log.warn("Found {} duplicate {} transaction id(s); the last occurrence of each was kept",
                    duplicates, kind);
        }
        return index;
    }

    private ReconciledTransaction match(Order order, Settlement settlement, ReconciliationSettings settings) {
        BigDecimal original = order.getOriginalAmount();
        BigDecimal fxRate = settlement.getFxRateApplied();
        BigDecimal fees = settlement.getFeesDeducted();
        BigDecimal actual = settlement.getUsdAmountReceived();

        ReconciledTransaction.ReconciledTransactionBuilder builder = ReconciledTransaction.builder()
                .transactionId(order.getTransactionId())
                .orderDate(order.getOrderDate())
                .settlementDate(settlement.getSettlementDate())
                .customerCurrency(order.getCustomerCurrency())
                .originalAmount(original)
                .paymentProcessor(order.getPaymentProcessor())
                .fxRateApplied(fxRate)
                .feesDeducted(amount(fees))
                .actualUsd(amount(actual))
                .status(MatchStatus.MATCHED);

        String invalidInput = invalidInputReason(original, fxRate);
        if (invalidInput != null) {
            log.warn("Transaction {} cannot be priced: {}", order.getTransactionId(), invalidInput);
            return builder
                    .discrepancy(true)
                    .discrepancyReason(invalidInput)
                    .build();
        }

        BigDecimal expected = original.divide(fxRate, MATH).subtract(fees, MATH);
        BigDecimal difference = actual.subtract(expected, MATH);
        BigDecimal absDifference = difference.abs();
        BigDecimal differencePct = expected.signum() > 0
                ? absDifference.divide(expected, MATH).multiply(HUNDRED, MATH)
                : BigDecimal.ZERO;

        boolean discrepancy = absDifference.compareTo(settings.getDiscrepancyThresholdUsd()) > 0;

        return builder
                .expectedUsd(amount(expected))
                .difference(amount(difference))
                .differencePct(percent(differencePct))
                .fxDeviationPct(fxDeviation(fxRate, settings.marketRateFor(order.getCustomerCurrency())))
                .discrepancy(discrepancy)
                .discrepancyReason(discrepancy ? classify(absDifference, differencePct) : null)
                .build();
    }

    /**
     * Exactly one reason applies: dollar size first, then relative size.
     */
    private String classify(BigDecimal absDifference, BigDecimal differencePct) {
        if (absDifference.compareTo(LARGE_DISCREPANCY_USD) > 0) {
            return String.format("Large discrepancy ($%s)", dollars(absDifference));
        }
        if (differencePct.compareTo(HIGH_DEVIATION_PCT) > 0) {
            return String.format("High %% deviation (%s%%)",
                    differencePct.setScale(1, RoundingMode.HALF_UP).toPlainString());
        }
        return String.format("Settlement mismatch ($%s)", dollars(absDifference));
    }

    private String invalidInputReason(BigDecimal original, BigDecimal fxRate) {
        if (fxRate.signum() <= 0) {
            return String.format("Invalid FX rate applied (%s)", fxRate.toPlainString());
        }
        if (original.signum() < 0) {
            return String.format("Invalid original amount (%s)", original.toPlainString());
        }
        return null;
    }

    // Positive: more local currency per dollar than market, i.e. fewer dollars for the merchant
    private BigDecimal fxDeviation(BigDecimal fxRate, BigDecimal marketRate) {
        if (marketRate == null) {
            return null;
        }
        return percent(fxRate.subtract(marketRate, MATH)
                .divide(marketRate, MATH)
                .multiply(HUNDRED, MATH));
    }

    private ReconciledTransaction unmatchedOrder(Order order) {
        return ReconciledTransaction.builder()
                .transactionId(order.getTransactionId())
                .orderDate(order.getOrderDate())
                .customerCurrency(order.getCustomerCurrency())
                .originalAmount(order.getOriginalAmount())
                .paymentProcessor(order.getPaymentProcessor())
                .status(MatchStatus.UNMATCHED_ORDER)
                .discrepancy(false)
                .discrepancyReason(NO_SETTLEMENT_REASON)
                .build();
    }

    private ReconciledTransaction unmatchedSettlement(Settlement settlement) {
        return ReconciledTransaction.builder()
                .transactionId(settlement.getTransactionId())
                .settlementDate(settlement.getSettlementDate())
                .fxRateApplied(settlement.getFxRateApplied())
                .feesDeducted(amount(settlement.getFeesDeducted()))
                .actualUsd(amount(settlement.getUsdAmountReceived()))
                .status(MatchStatus.UNMATCHED_SETTLEMENT)
                .discrepancy(false)
                .discrepancyReason(NO_ORDER_REASON)
                .build();
    }

    private static BigDecimal amount(BigDecimal value) {
        return value == null ? null : value.setScale(AMOUNT_SCALE, RoundingMode.HALF_UP);
    }

    private static BigDecimal percent(BigDecimal value) {
        return value.setScale(PERCENT_SCALE, RoundingMode.HALF_UP);
    }

    private static String dollars(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }
}

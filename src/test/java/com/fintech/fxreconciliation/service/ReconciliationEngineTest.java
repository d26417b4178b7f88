package com.fintech.fxreconciliation.service;

import com.fintech.fxreconciliation.config.ReconciliationSettings;
import com.fintech.fxreconciliation.model.MatchStatus;
import com.fintech.fxreconciliation.model.Order;
import com.fintech.fxreconciliation.model.ReconciledTransaction;
import com.fintech.fxreconciliation.model.Settlement;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatNullPointerException;

/**
 * Unit tests for ReconciliationEngine.
 * <p>
 * Tests cover:
 * - Expected vs actual USD and the discrepancy threshold
 * - Reason tiering
 * - FX deviation against market rates
 * - Join coverage, ordering and duplicates
 * - Degenerate inputs
 */
class ReconciliationEngineTest {

    private final ReconciliationEngine engine = new ReconciliationEngine();
    private final ReconciliationSettings settings = ReconciliationSettings.defaults();

    @Nested
    @DisplayName("Amount Check Tests")
    class AmountCheckTests {

        @Test
        @DisplayName("Settlement within tolerance is matched and not flagged")
        void settlementWithinToleranceIsNotFlagged() {
            // Given
            Order order = order("T1", "MXN", "1000", "X");
            Settlement settlement = settlement("T1", "55.14", "17.50", "2.00");

            // When
            ReconciledTransaction tx = reconcileOne(order, settlement);

            // Then
            assertThat(tx.getStatus()).isEqualTo(MatchStatus.MATCHED);
            assertThat(tx.getExpectedUsd()).isEqualByComparingTo("55.1429");
            assertThat(tx.getActualUsd()).isEqualByComparingTo("55.14");
            assertThat(tx.getDifference()).isEqualByComparingTo("-0.0029");
            assertThat(tx.isDiscrepancy()).isFalse();
            assertThat(tx.getDiscrepancyReason()).isNull();
            assertThat(tx.getFxDeviationPct()).isEqualByComparingTo("0.0");
        }

        @Test
        @DisplayName("Overpaid settlement is flagged as a large discrepancy")
        void overpaidSettlementIsLargeDiscrepancy() {
            // Given
            Order order = order("T1", "MXN", "1000", "X");
            Settlement settlement = settlement("T1", "200", "17.50", "2.00");

            // When
            ReconciledTransaction tx = reconcileOne(order, settlement);

            // Then
            assertThat(tx.getDifference()).isEqualByComparingTo("144.8571");
            assertThat(tx.isDiscrepancy()).isTrue();
            assertThat(tx.getDiscrepancyReason()).isEqualTo("Large discrepancy ($144.86)");
        }

        @Test
        @DisplayName("Difference of exactly the threshold is not flagged")
        void differenceAtThresholdIsNotFlagged() {
            ReconciledTransaction tx = reconcileOne(
                    order("T1", "USD", "100", "X"),
                    settlement("T1", "100.50", "1", "0"));

            assertThat(tx.getDifference()).isEqualByComparingTo("0.50");
            assertThat(tx.isDiscrepancy()).isFalse();
        }

        @Test
        @DisplayName("Difference just above the threshold is flagged")
        void differenceJustAboveThresholdIsFlagged() {
            ReconciledTransaction tx = reconcileOne(
                    order("T1", "USD", "100", "X"),
                    settlement("T1", "100.5000001", "1", "0"));

            assertThat(tx.isDiscrepancy()).isTrue();
            assertThat(tx.getDiscrepancyReason()).isEqualTo("Settlement mismatch ($0.50)");
        }

        @Test
        @DisplayName("Threshold comes from the settings passed in")
        void thresholdIsTakenFromSettings() {
            ReconciliationSettings lenient = settings.toBuilder()
                    .discrepancyThresholdUsd(new BigDecimal("5.00"))
                    .build();

            List<ReconciledTransaction> result = engine.reconcile(
                    List.of(order("T1", "USD", "100", "X")),
                    List.of(settlement("T1", "101", "1", "0")),
                    lenient);

            assertThat(result.get(0).isDiscrepancy()).isFalse();
        }

        @Test
        @DisplayName("Amounts are rounded to 4 decimals and percentages to 2")
        void outputsAreRounded() {
            ReconciledTransaction tx = reconcileOne(
                    order("T1", "MXN", "1000", "X"),
                    settlement("T1", "50", "17.50", "2.00"));

            assertThat(tx.getExpectedUsd().scale()).isEqualTo(4);
            assertThat(tx.getDifference().scale()).isEqualTo(4);
            assertThat(tx.getDifferencePct().scale()).isEqualTo(2);
            assertThat(tx.getDifferencePct()).isEqualByComparingTo("9.33");
        }
    }

    @Nested
    @DisplayName("Reason Tiering Tests")
    class ReasonTieringTests {

        @Test
        @DisplayName("Dollar size wins over percentage when both apply")
        void largeDollarWinsOverPercentage() {
            ReconciledTransaction tx = reconcileOne(
                    order("T1", "USD", "100", "X"),
                    settlement("T1", "250", "1", "0"));

            assertThat(tx.getDifferencePct()).isEqualByComparingTo("150.00");
            assertThat(tx.getDiscrepancyReason()).startsWith("Large discrepancy");
        }

        @Test
        @DisplayName("High percentage deviation below the dollar tier")
        void highPercentageDeviation() {
            ReconciledTransaction tx = reconcileOne(
                    order("T1", "USD", "100", "X"),
                    settlement("T1", "110", "1", "0"));

            assertThat(tx.getDiscrepancyReason()).isEqualTo("High % deviation (10.0%)");
        }

        @Test
        @DisplayName("Non-positive expected amount yields zero percentage and generic reason")
        void nonPositiveExpectedAmountUsesZeroPercentage() {
            // 10 / 10 - 5 = -4 expected
            ReconciledTransaction tx = reconcileOne(
                    order("T1", "USD", "10", "X"),
                    settlement("T1", "0", "10", "5"));

            assertThat(tx.getExpectedUsd()).isEqualByComparingTo("-4");
            assertThat(tx.getDifferencePct()).isEqualByComparingTo("0");
            assertThat(tx.getDiscrepancyReason()).isEqualTo("Settlement mismatch ($4.00)");
        }
    }

    @Nested
    @DisplayName("FX Deviation Tests")
    class FxDeviationTests {

        @Test
        @DisplayName("Rate 10% above market gives +10")
        void rateAboveMarketIsPositive() {
            ReconciledTransaction tx = reconcileOne(
                    order("T1", "MXN", "1000", "X"),
                    settlement("T1", "49.95", "19.25", "2.00"));

            assertThat(tx.getFxDeviationPct()).isEqualByComparingTo("10.0");
        }

        @Test
        @DisplayName("Rate below market gives a negative deviation")
        void rateBelowMarketIsNegative() {
            ReconciledTransaction tx = reconcileOne(
                    order("T1", "MXN", "1000", "X"),
                    settlement("T1", "61.49", "15.75", "2.00"));

            assertThat(tx.getFxDeviationPct()).isEqualByComparingTo("-10.0");
        }

        @Test
        @DisplayName("Currency without a reference rate has no deviation")
        void unknownCurrencyHasNullDeviation() {
            ReconciledTransaction tx = reconcileOne(
                    order("T1", "EUR", "100", "X"),
                    settlement("T1", "108", "0.92", "0.70"));

            assertThat(tx.getStatus()).isEqualTo(MatchStatus.MATCHED);
            assertThat(tx.getFxDeviationPct()).isNull();
        }
    }

    @Nested
    @DisplayName("Join Tests")
    class JoinTests {

        @Test
        @DisplayName("Orders and settlements without a counterpart are reported on their own")
        void unmatchedRecordsOnBothSides() {
            // Given
            List<Order> orders = List.of(
                    order("O1", "MXN", "100", "X"),
                    order("O2", "BRL", "200", "Y"));
            List<Settlement> settlements = List.of(settlement("S1", "10", "5.00", "0.30"));

            // When
            List<ReconciledTransaction> result = engine.reconcile(orders, settlements, settings);

            // Then
            assertThat(result).extracting(ReconciledTransaction::getStatus).containsExactly(
                    MatchStatus.UNMATCHED_ORDER, MatchStatus.UNMATCHED_ORDER, MatchStatus.UNMATCHED_SETTLEMENT);

            ReconciledTransaction unmatchedOrder = result.get(0);
            assertThat(unmatchedOrder.getDiscrepancyReason()).isEqualTo("No matching settlement record");
            assertThat(unmatchedOrder.isDiscrepancy()).isFalse();
            assertThat(unmatchedOrder.getSettlementDate()).isNull();
            assertThat(unmatchedOrder.getActualUsd()).isNull();
            assertThat(unmatchedOrder.getExpectedUsd()).isNull();

            ReconciledTransaction unmatchedSettlement = result.get(2);
            assertThat(unmatchedSettlement.getDiscrepancyReason()).isEqualTo("No matching order record");
            assertThat(unmatchedSettlement.isDiscrepancy()).isFalse();
            assertThat(unmatchedSettlement.getOrderDate()).isNull();
            assertThat(unmatchedSettlement.getPaymentProcessor()).isNull();
            assertThat(unmatchedSettlement.getActualUsd()).isEqualByComparingTo("10");
        }

        @Test
        @DisplayName("Orders keep input order and leftover settlements follow")
        void outputOrderIsOrdersThenLeftoverSettlements() {
            List<Order> orders = List.of(
                    order("A", "MXN", "100", "X"),
                    order("B", "MXN", "100", "X"),
                    order("C", "MXN", "100", "X"));
            List<Settlement> settlements = List.of(
                    settlement("C", "5.71", "17.50", "0"),
                    settlement("D", "5.71", "17.50", "0"),
                    settlement("A", "5.71", "17.50", "0"));

            List<ReconciledTransaction> result = engine.reconcile(orders, settlements, settings);

            assertThat(result).extracting(ReconciledTransaction::getTransactionId)
                    .containsExactly("A", "B", "C", "D");
            assertThat(result).extracting(ReconciledTransaction::getStatus).containsExactly(
                    MatchStatus.MATCHED, MatchStatus.UNMATCHED_ORDER,
                    MatchStatus.MATCHED, MatchStatus.UNMATCHED_SETTLEMENT);
        }

        @Test
        @DisplayName("Duplicate identifiers keep the last record at the first position")
        void duplicateIdentifiersAreLastWriteWins() {
            List<Order> orders = List.of(
                    order("A", "USD", "100", "X"),
                    order("B", "USD", "100", "X"),
                    order("A", "USD", "200", "Y"));
            List<Settlement> settlements = List.of(
                    settlement("A", "150", "1", "0"),
                    settlement("A", "200", "1", "0"));

            List<ReconciledTransaction> result = engine.reconcile(orders, settlements, settings);

            assertThat(result).hasSize(2);
            ReconciledTransaction a = result.get(0);
            assertThat(a.getTransactionId()).isEqualTo("A");
            assertThat(a.getOriginalAmount()).isEqualByComparingTo("200");
            assertThat(a.getPaymentProcessor()).isEqualTo("Y");
            assertThat(a.getActualUsd()).isEqualByComparingTo("200");
            assertThat(a.isDiscrepancy()).isFalse();
        }

        @Test
        @DisplayName("Empty inputs give an empty result")
        void emptyInputsGiveEmptyResult() {
            assertThat(engine.reconcile(Collections.emptyList(), Collections.emptyList(), settings)).isEmpty();
        }

        @Test
        @DisplayName("Running twice on the same input gives equal output")
        void reconciliationIsDeterministic() {
            List<Order> orders = List.of(
                    order("A", "MXN", "1000", "X"),
                    order("B", "BRL", "300", "Y"));
            List<Settlement> settlements = List.of(
                    settlement("Z", "12", "5.00", "0"),
                    settlement("B", "58", "5.20", "1.00"),
                    settlement("A", "55.14", "17.50", "2.00"));

            assertThat(engine.reconcile(orders, settlements, settings))
                    .isEqualTo(engine.reconcile(orders, settlements, settings));
        }

        @Test
        @DisplayName("Null lists are rejected")
        void nullListsAreRejected() {
            assertThatNullPointerException()
                    .isThrownBy(() -> engine.reconcile(null, List.of(), settings));
            assertThatNullPointerException()
                    .isThrownBy(() -> engine.reconcile(List.of(), null, settings));
            assertThatNullPointerException()
                    .isThrownBy(() -> engine.reconcile(List.of(), List.of(), null));
        }
    }

    @Nested
    @DisplayName("Degenerate Input Tests")
    class DegenerateInputTests {

        @Test
        @DisplayName("Zero FX rate is flagged instead of dividing")
        void zeroFxRateIsFlagged() {
            ReconciledTransaction tx = reconcileOne(
                    order("T1", "MXN", "1000", "X"),
                    settlement("T1", "55.14", "0", "2.00"));

            assertThat(tx.getStatus()).isEqualTo(MatchStatus.MATCHED);
            assertThat(tx.isDiscrepancy()).isTrue();
            assertThat(tx.getDiscrepancyReason()).isEqualTo("Invalid FX rate applied (0)");
            assertThat(tx.getExpectedUsd()).isNull();
            assertThat(tx.getDifference()).isNull();
            assertThat(tx.getDifferencePct()).isNull();
            assertThat(tx.getFxDeviationPct()).isNull();
            assertThat(tx.getActualUsd()).isEqualByComparingTo("55.14");
        }

        @Test
        @DisplayName("Negative FX rate is flagged")
        void negativeFxRateIsFlagged() {
            ReconciledTransaction tx = reconcileOne(
                    order("T1", "MXN", "1000", "X"),
                    settlement("T1", "55.14", "-17.50", "2.00"));

            assertThat(tx.isDiscrepancy()).isTrue();
            assertThat(tx.getDiscrepancyReason()).startsWith("Invalid FX rate applied");
        }

        @Test
        @DisplayName("Negative order amount is flagged")
        void negativeOriginalAmountIsFlagged() {
            ReconciledTransaction tx = reconcileOne(
                    order("T1", "MXN", "-1000", "X"),
                    settlement("T1", "55.14", "17.50", "2.00"));

            assertThat(tx.isDiscrepancy()).isTrue();
            assertThat(tx.getDiscrepancyReason()).isEqualTo("Invalid original amount (-1000)");
            assertThat(tx.getExpectedUsd()).isNull();
        }
    }

    // Helper methods

    private ReconciledTransaction reconcileOne(Order order, Settlement settlement) {
        List<ReconciledTransaction> result = engine.reconcile(List.of(order), List.of(settlement), settings);
        assertThat(result).hasSize(1);
        return result.get(0);
    }

    private Order order(String id, String currency, String amount, String processor) {
        return Order.builder()
                .transactionId(id)
                .orderDate("2024-01-15")
                .customerCurrency(currency)
                .originalAmount(new BigDecimal(amount))
                .paymentProcessor(processor)
                .build();
    }

    private Settlement settlement(String id, String usdReceived, String fxRate, String fees) {
        return Settlement.builder()
                .transactionId(id)
                .settlementDate("2024-01-17")
                .usdAmountReceived(new BigDecimal(usdReceived))
                .fxRateApplied(new BigDecimal(fxRate))
                .feesDeducted(new BigDecimal(fees))
                .build();
    }
}

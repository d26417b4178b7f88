package com.fintech.fxreconciliation.service;

import com.fintech.fxreconciliation.config.ReconciliationProperties;
import com.fintech.fxreconciliation.config.ReconciliationSettings;
import com.fintech.fxreconciliation.dto.ReconciliationResult;
import com.fintech.fxreconciliation.exception.ReconciliationException;
import com.fintech.fxreconciliation.model.Alert;
import com.fintech.fxreconciliation.model.Order;
import com.fintech.fxreconciliation.model.ReconciledTransaction;
import com.fintech.fxreconciliation.model.Settlement;
import com.fintech.fxreconciliation.parser.CsvRecordParser;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.InputStream;
import java.util.List;

/**
 * Runs the full reconciliation pipeline for one request.
 * <p>
 * Parser, engine, pattern detector and aggregator are each pure functions of
 * their input; this class only sequences them, applies the configured
 * settings and records metrics. Nothing is kept between requests.
 */
@Service
@Slf4j
public class ReconciliationService {

    private final CsvRecordParser recordParser;
    private final ReconciliationEngine engine;
    private final PatternDetector patternDetector;
    private final ReconciliationAggregator aggregator;
    private final ReconciliationProperties properties;
    private final MeterRegistry meterRegistry;

    // Metrics
    private Counter runCounter;
    private Counter matchedCounter;
    private Counter unmatchedCounter;
    private Counter flaggedCounter;
    private Counter alertCounter;
    private Timer reconciliationTimer;

    public ReconciliationService(CsvRecordParser recordParser,
                                 ReconciliationEngine engine,
                                 PatternDetector patternDetector,
                                 ReconciliationAggregator aggregator,
                                 ReconciliationProperties properties,
                                 MeterRegistry meterRegistry) {
        this.recordParser = recordParser;
        this.engine = engine;
        this.patternDetector = patternDetector;
        this.aggregator = aggregator;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void initMetrics() {
        runCounter = Counter.builder("reconciliation.runs.total")
                .description("Reconciliation passes executed")
                .register(meterRegistry);

        matchedCounter = Counter.builder("reconciliation.transactions.matched")
                .description("Transactions present in both orders and settlements")
                .register(meterRegistry);

        unmatchedCounter = Counter.builder("reconciliation.transactions.unmatched")
                .description("Orders without a settlement or settlements without an order")
                .register(meterRegistry);

        flaggedCounter = Counter.builder("reconciliation.transactions.flagged")
                .description("Matched transactions whose settled USD is outside tolerance")
                .register(meterRegistry);

        alertCounter = Counter.builder("reconciliation.alerts.raised")
                .description("Pattern alerts raised across all runs")
                .register(meterRegistry);

        reconciliationTimer = Timer.builder("reconciliation.duration")
                .description("Time taken to reconcile one pair of files")
                .register(meterRegistry);
    }

    /**
     * Parses both uploads and reconciles them with the configured settings.
     *
     * @throws com.fintech.fxreconciliation.exception.CsvParseException if either file has a malformed row
     * @throws ReconciliationException                                   if either file has no records
     */
    public ReconciliationResult reconcileCsv(InputStream ordersCsv, InputStream settlementsCsv) {
        List<Order> orders = recordParser.parseOrders(ordersCsv);
        List<Settlement> settlements = recordParser.parseSettlements(settlementsCsv);

        if (orders.isEmpty()) {
            throw new ReconciliationException("Orders file is empty");
        }
        if (settlements.isEmpty()) {
            throw new ReconciliationException("Settlements file is empty");
        }

        return reconcile(orders, settlements);
    }

    public ReconciliationResult reconcile(List<Order> orders, List<Settlement> settlements) {
        return reconcile(orders, settlements, currentSettings());
    }

    /**
     * Main entry point: engine, then pattern detection, then aggregation.
     */
    public ReconciliationResult reconcile(List<Order> orders, List<Settlement> settlements,
                                          ReconciliationSettings settings) {
        log.info("Starting reconciliation of {} orders against {} settlements",
                orders.size(), settlements.size());
        runCounter.increment();

        long start = System.nanoTime();
        ReconciliationResult result = reconciliationTimer.record(() -> {
            List<ReconciledTransaction> transactions = engine.reconcile(orders, settlements, settings);
            List<Alert> alerts = patternDetector.detect(transactions, settings);
            return aggregator.summarize(transactions, alerts);
        });

        matchedCounter.increment(result.getMatched());
        unmatchedCounter.increment(result.getUnmatchedOrders() + result.getUnmatchedSettlements());
        flaggedCounter.increment(result.getFlaggedCount());
        alertCounter.increment(result.getPatternAlerts().size());

        log.info("Reconciliation completed in {}ms. Matched: {}, Unmatched orders: {}, " +
                        "Unmatched settlements: {}, Flagged: {} (${}), Alerts: {}",
                (System.nanoTime() - start) / 1_000_000,
                result.getMatched(),
                result.getUnmatchedOrders(),
                result.getUnmatchedSettlements(),
                result.getFlaggedCount(),
                result.getTotalDiscrepancyUsd(),
                result.getPatternAlerts().size());

        return result;
    }

    /**
     * Snapshot of the bound configuration.
     */
    public ReconciliationSettings currentSettings() {
        return properties.toSettings();
    }
}

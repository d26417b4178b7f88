package com.fintech.fxreconciliation;

import com.fintech.fxreconciliation.config.ReconciliationProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * FX Settlement Reconciliation Service
 * <p>
 * Reconciles merchant orders placed in local currency against the USD
 * settlements a payment processor pays out after FX conversion and fees.
 * <p>
 * Key Features:
 * - Join of orders and settlements by transaction id, with unmatched records on either side
 * - Expected vs actual USD check per transaction against a fixed tolerance
 * - FX deviation against a static market reference table
 * - Aggregate alerts by processor, currency, discrepancy size and FX rate
 */
@SpringBootApplication
@EnableConfigurationProperties(ReconciliationProperties.class)
public class FxReconciliationApplication {

    public static void main(String[] args) {
        SpringApplication.run(FxReconciliationApplication.class, args);
    }
}

package com.fintech.fxreconciliation.controller;

import com.fintech.fxreconciliation.config.ReconciliationSettings;
import com.fintech.fxreconciliation.dto.ErrorResponse;
import com.fintech.fxreconciliation.dto.ReconciliationResult;
import com.fintech.fxreconciliation.exception.ReconciliationException;
import com.fintech.fxreconciliation.service.ReconciliationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST API for reconciliation operations.
 * <p>
 * Provides endpoints for:
 * - Reconciling an uploaded orders file against a settlements file
 * - Inspecting the market reference rates and thresholds in use
 * - Health checks
 */
@RestController
@RequestMapping("/api/v1/reconciliation")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Reconciliation", description = "FX settlement reconciliation API")
public class ReconciliationController {

    private final ReconciliationService reconciliationService;

    @Operation(
            summary = "Reconcile orders against settlements",
            description = "Accepts two CSV files. Orders: transaction_id, order_date, customer_currency, original_amount, payment_processor. Settlements: transaction_id, settlement_date, usd_amount_received, fx_rate_applied, fees_deducted."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Reconciliation completed",
                    content = @Content(schema = @Schema(implementation = ReconciliationResult.class))),
            @ApiResponse(responseCode = "400", description = "A file is unreadable, malformed or empty",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    @PostMapping(value = "/reconcile", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ReconciliationResult> reconcile(
            @Parameter(description = "Orders CSV export") @RequestPart("orders_file") MultipartFile ordersFile,
            @Parameter(description = "Settlements CSV export") @RequestPart("settlements_file") MultipartFile settlementsFile) {

        log.info("Reconciliation requested: orders={} ({} bytes), settlements={} ({} bytes)",
                ordersFile.getOriginalFilename(), ordersFile.getSize(),
                settlementsFile.getOriginalFilename(), settlementsFile.getSize());

        try (InputStream orders = ordersFile.getInputStream();
             InputStream settlements = settlementsFile.getInputStream()) {
            return ResponseEntity.ok(reconciliationService.reconcileCsv(orders, settlements));
        } catch (IOException e) {
            throw new ReconciliationException("Could not read uploaded files: " + e.getMessage(), e);
        }
    }

    @Operation(
            summary = "Get market reference rates",
            description = "Returns the local-currency-per-USD reference rates used for FX deviation, along with the discrepancy and FX alert thresholds."
    )
    @ApiResponse(responseCode = "200", description = "Reference data retrieved successfully")
    @GetMapping("/market-rates")
    public ResponseEntity<Map<String, Object>> getMarketRates() {
        ReconciliationSettings settings = reconciliationService.currentSettings();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("market_rates", settings.getMarketRates());
        body.put("discrepancy_threshold_usd", settings.getDiscrepancyThresholdUsd());
        body.put("fx_deviation_alert_pct", settings.getFxDeviationAlertPct());
        return ResponseEntity.ok(body);
    }

    @Operation(
            summary = "Health check",
            description = "Returns the health status of the reconciliation service. Used by load balancers and the dashboard."
    )
    @ApiResponse(responseCode = "200", description = "Service is healthy")
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> healthCheck() {
        return ResponseEntity.ok(Map.of("status", "ok"));
    }
}

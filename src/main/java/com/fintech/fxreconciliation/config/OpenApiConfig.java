package com.fintech.fxreconciliation.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.tags.Tag;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * API documentation for the reconciliation endpoints, served by springdoc.
 * The description carries the two CSV layouts and the active thresholds.
 */
@Configuration
public class OpenApiConfig {

    private static final String API_PATHS = "/api/v1/reconciliation/**";

    @Bean
    public OpenAPI fxReconciliationOpenAPI(ReconciliationProperties properties) {
        return new OpenAPI()
                .info(new Info()
                        .title("FX Settlement Reconciliation API")
                        .version("1.0.0")
                        .description(describeUploadContract(properties)))
                .tags(List.of(new Tag()
                        .name("Reconciliation")
                        .description("Order to settlement matching, FX deviation and pattern alerts")));
    }

    @Bean
    public GroupedOpenApi reconciliationApiGroup() {
        return GroupedOpenApi.builder()
                .group("reconciliation")
                .pathsToMatch(API_PATHS)
                .build();
    }

    private static String describeUploadContract(ReconciliationProperties properties) {
        return "POST a multipart request with two CSV parts.\n\n"
                + "* `orders_file`: transaction_id, order_date, customer_currency, original_amount, payment_processor\n"
                + "* `settlements_file`: transaction_id, settlement_date, usd_amount_received, fx_rate_applied, fees_deducted\n\n"
                + "Headers match case-insensitively and extra columns are ignored. A matched pair is flagged when its "
                + "USD difference exceeds $" + properties.getDiscrepancyThresholdUsd().toPlainString()
                + "; applied FX rates more than " + properties.getFxDeviationAlertPct().toPlainString()
                + "% away from the market reference raise an alert.";
    }
}

package com.fintech.fxreconciliation.parser;

import com.fintech.fxreconciliation.exception.CsvParseException;
import com.fintech.fxreconciliation.model.Order;
import com.fintech.fxreconciliation.model.Settlement;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.RFC4180ParserBuilder;
import com.opencsv.exceptions.CsvValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * Reads the orders and settlements CSV exports into typed records.
 * <p>
 * Headers are matched case-insensitively and extra columns are ignored.
 * Any malformed row aborts the whole file with a {@link CsvParseException}
 * naming the row, so the reconciliation engine only ever sees valid records.
 */
@Component
@Slf4j
public class CsvRecordParser {

    static final String ORDERS = "Orders";
    static final String SETTLEMENTS = "Settlements";

    private static final String TRANSACTION_ID = "transaction_id";
    private static final String ORDER_DATE = "order_date";
    private static final String CUSTOMER_CURRENCY = "customer_currency";
    private static final String ORIGINAL_AMOUNT = "original_amount";
    private static final String PAYMENT_PROCESSOR = "payment_processor";
    private static final String SETTLEMENT_DATE = "settlement_date";
    private static final String USD_AMOUNT_RECEIVED = "usd_amount_received";
    private static final String FX_RATE_APPLIED = "fx_rate_applied";
    private static final String FEES_DEDUCTED = "fees_deducted";

    private static final List<String> ORDER_COLUMNS = List.of(
            TRANSACTION_ID, ORDER_DATE, CUSTOMER_CURRENCY, ORIGINAL_AMOUNT, PAYMENT_PROCESSOR);

    private static final List<String> SETTLEMENT_COLUMNS = List.of(
            TRANSACTION_ID, SETTLEMENT_DATE, USD_AMOUNT_RECEIVED, FX_RATE_APPLIED, FEES_DEDUCTED);

    private static final char BOM = '\uFEFF';

    public List<Order> parseOrders(InputStream in) {
        return parse(in, ORDERS, ORDER_COLUMNS, row -> Order.builder()
                .transactionId(row.requiredText(TRANSACTION_ID))
                .orderDate(row.text(ORDER_DATE))
                .customerCurrency(row.text(CUSTOMER_CURRENCY).toUpperCase(Locale.ROOT))
                .originalAmount(row.decimal(ORIGINAL_AMOUNT))
                .paymentProcessor(row.text(PAYMENT_PROCESSOR))
                .build());
    }

    public List<Settlement> parseSettlements(InputStream in) {
        return parse(in, SETTLEMENTS, SETTLEMENT_COLUMNS, row -> Settlement.builder()
                .transactionId(row.requiredText(TRANSACTION_ID))
                .settlementDate(row.text(SETTLEMENT_DATE))
                .usdAmountReceived(row.decimal(USD_AMOUNT_RECEIVED))
                .fxRateApplied(row.decimal(FX_RATE_APPLIED))
                .feesDeducted(row.decimal(FEES_DEDUCTED))
                .build());
    }

    private <T> List<T> parse(InputStream in, String kind, List<String> requiredColumns,
                              Function<CsvRow, T> mapper) {
        List<T> records = new ArrayList<>();
        int rowNumber = 1;

        // RFC 4180 quoting only; backslashes are ordinary field text
        try (CSVReader reader = new CSVReaderBuilder(new InputStreamReader(in, StandardCharsets.UTF_8))
                .withCSVParser(new RFC4180ParserBuilder().build())
                .build()) {
            String[] header = reader.readNext();
            if (header == null) {
                log.debug("{} CSV has no header row, nothing to parse", kind);
                return records;
            }
            Map<String, Integer> columns = buildColumnIndexMap(header);
            validateColumns(kind, columns, requiredColumns);

            String[] line;
            while ((line = reader.readNext()) != null) {
                rowNumber++;
                if (isBlank(line)) {
                    continue;
                }
                records.add(mapper.apply(new CsvRow(kind, rowNumber, line, columns)));
            }
        } catch (CsvValidationException e) {
            throw new CsvParseException(kind, rowNumber + 1, "malformed CSV: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new CsvParseException(kind, rowNumber, "could not read file: " + e.getMessage(), e);
        }

        log.debug("Parsed {} {} records", records.size(), kind.toLowerCase(Locale.ROOT));
        return records;
    }

    private Map<String, Integer> buildColumnIndexMap(String[] header) {
        Map<String, Integer> columns = new HashMap<>();
        for (int i = 0; i < header.length; i++) {
            String name = header[i];
            if (name == null) {
                continue;
            }
            if (i == 0 && !name.isEmpty() && name.charAt(0) == BOM) {
                name = name.substring(1);
            }
            columns.putIfAbsent(name.trim().toLowerCase(Locale.ROOT), i);
        }
        return columns;
    }

    private void validateColumns(String kind, Map<String, Integer> columns, List<String> required) {
        for (String column : required) {
            if (!columns.containsKey(column)) {
                throw new CsvParseException(kind, 1, "missing required column '" + column + "'");
            }
        }
    }

    private boolean isBlank(String[] line) {
        for (String cell : line) {
            if (cell != null && !cell.trim().isEmpty()) {
                return false;
            }
        }
        return true;
    }

    /**
     * One data row with typed accessors that report failures against its row number.
     */
    private static final class CsvRow {

        private final String kind;
        private final int rowNumber;
        private final String[] cells;
        private final Map<String, Integer> columns;

        CsvRow(String kind, int rowNumber, String[] cells, Map<String, Integer> columns) {
            this.kind = kind;
            this.rowNumber = rowNumber;
            this.cells = cells;
            this.columns = columns;
        }

        String text(String column) {
            int index = columns.get(column);
            if (index >= cells.length || cells[index] == null) {
                throw new CsvParseException(kind, rowNumber, "missing value for '" + column + "'");
            }
            return cells[index].trim();
        }

        String requiredText(String column) {
            String value = text(column);
            if (value.isEmpty()) {
                throw new CsvParseException(kind, rowNumber, "'" + column + "' must not be empty");
            }
            return value;
        }

        BigDecimal decimal(String column) {
            String value = requiredText(column);
            try {
                return new BigDecimal(value);
            } catch (NumberFormatException e) {
                throw new CsvParseException(kind, rowNumber,
                        "'" + column + "' is not a number: '" + value + "'", e);
            }
        }
    }
}

package com.fintech.fxreconciliation.exception;

/**
 * Thrown when an uploaded CSV cannot be turned into typed records.
 * <p>
 * Row numbers are 1-based and count the header, so the first data row is row 2.
 */
public class CsvParseException extends ReconciliationException {

    private final String recordKind;
    private final int rowNumber;

    public CsvParseException(String recordKind, int rowNumber, String detail) {
        super(String.format("%s CSV row %d: %s", recordKind, rowNumber, detail));
        this.recordKind = recordKind;
        this.rowNumber = rowNumber;
    }

    public CsvParseException(String recordKind, int rowNumber, String detail, Throwable cause) {
        super(String.format("%s CSV row %d: %s", recordKind, rowNumber, detail), cause);
        this.recordKind = recordKind;
        this.rowNumber = rowNumber;
    }

    /**
     * "Orders" or "Settlements".
     */
    public String getRecordKind() {
        return recordKind;
    }

    public int getRowNumber() {
        return rowNumber;
    }
}

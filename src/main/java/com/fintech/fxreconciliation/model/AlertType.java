package com.fintech.fxreconciliation.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of aggregate anomaly raised by the pattern detector.
 */
public enum AlertType {
    PROCESSOR("processor"),
    CURRENCY("currency"),
    LARGE_DISCREPANCY("large_discrepancy"),
    FX_RATE("fx_rate");

    private final String wireValue;

    AlertType(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }
}

package com.fintech.fxreconciliation.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AlertSeverity {
    CRITICAL("critical"),
    HIGH("high"),
    MEDIUM("medium");

    private final String wireValue;

    AlertSeverity(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }
}

package com.fintech.fxreconciliation.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome of joining an order and a settlement on transaction identifier.
 */
public enum MatchStatus {
    /**
     * Both an order and a settlement exist for the identifier.
     * Amount and FX checks are applied.
     */
    MATCHED("matched"),

    /**
     * An order exists but the processor never settled it.
     */
    UNMATCHED_ORDER("unmatched_order"),

    /**
     * A settlement arrived for an identifier we have no order for.
     */
    UNMATCHED_SETTLEMENT("unmatched_settlement");

    private final String wireValue;

    MatchStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }
}

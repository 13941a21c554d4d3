package com.crisisrelay.ledger;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RequestKind {
    RISK_EVALUATION("risk-evaluation"),
    CONTENT_REVEAL("content-reveal");

    private final String wireName;

    RequestKind(String wireName) {
        this.wireName = wireName;
    }

    /** Name used on the oracle wire and in callback paths. */
    @JsonValue
    public String wireName() {
        return wireName;
    }
}

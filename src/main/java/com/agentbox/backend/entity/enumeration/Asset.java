package com.agentbox.backend.entity.enumeration;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Asset {
    SOL("SOL"),
    USDC("USDC");

    private final String symbol;

    Asset(String symbol) {
        this.symbol = symbol;
    }

    @JsonValue
    public String symbol() {
        return symbol;
    }
}

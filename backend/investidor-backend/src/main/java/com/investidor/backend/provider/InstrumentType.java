package com.investidor.backend.provider;

import com.fasterxml.jackson.annotation.JsonValue;

public enum InstrumentType {
    STOCK("acao"),
    REAL_ESTATE_FUND("fii");

    private final String code;

    InstrumentType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}

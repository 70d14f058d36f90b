package com.investidor.backend.provider;

import com.fasterxml.jackson.annotation.JsonValue;

public record ProviderId(String value) {

    public ProviderId {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Provider id must not be blank");
        }
        value = value.trim();
    }

    public static ProviderId of(String value) {
        return new ProviderId(value);
    }

    @JsonValue
    @Override
    public String value() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}

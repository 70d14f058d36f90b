package com.investidor.backend.provider;

import java.util.Objects;

public record ProviderOutcome(ProviderId providerId, RawFieldSet fields, FailureReason failure) {

    public ProviderOutcome {
        Objects.requireNonNull(providerId, "providerId");
        if ((fields == null) == (failure == null)) {
            throw new IllegalArgumentException("Exactly one of fields or failure must be present");
        }
    }

    public static ProviderOutcome success(ProviderId providerId, RawFieldSet fields) {
        return new ProviderOutcome(providerId, fields, null);
    }

    public static ProviderOutcome failure(ProviderId providerId, FailureReason failure) {
        return new ProviderOutcome(providerId, null, failure);
    }

    public boolean isSuccess() {
        return fields != null;
    }
}

package com.investidor.backend.provider;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

public record ProviderFetchResult(ProviderId primaryId, Map<ProviderId, ProviderOutcome> outcomes) {

    public ProviderFetchResult {
        outcomes = Collections.unmodifiableMap(new LinkedHashMap<>(outcomes));
        if (!outcomes.containsKey(primaryId)) {
            throw new IllegalArgumentException("Missing outcome for primary provider " + primaryId);
        }
    }

    public boolean isSuccessful() {
        return primaryOutcome().isSuccess();
    }

    public ProviderOutcome primaryOutcome() {
        return outcomes.get(primaryId);
    }

    public Map<ProviderId, ProviderOutcome> secondaryOutcomes() {
        Map<ProviderId, ProviderOutcome> secondary = new LinkedHashMap<>(outcomes);
        secondary.remove(primaryId);
        return secondary;
    }

    public List<ProviderId> failedProviders() {
        return outcomes.values().stream()
                .filter(outcome -> !outcome.isSuccess())
                .map(ProviderOutcome::providerId)
                .collect(Collectors.toList());
    }
}

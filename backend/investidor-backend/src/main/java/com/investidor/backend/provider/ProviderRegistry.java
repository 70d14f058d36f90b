package com.investidor.backend.provider;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

public class ProviderRegistry {

    private final List<ProviderDefinition> definitions;
    private final ProviderDefinition primary;

    public ProviderRegistry(List<ProviderDefinition> definitions) {
        if (definitions == null || definitions.isEmpty()) {
            throw new IllegalStateException("At least one provider must be configured under investidor.providers");
        }
        Set<ProviderId> seen = new HashSet<>();
        for (ProviderDefinition definition : definitions) {
            if (!seen.add(definition.id())) {
                throw new IllegalStateException("Provider " + definition.id() + " is configured more than once");
            }
            if (definition.timeout() == null || definition.timeout().isNegative() || definition.timeout().isZero()) {
                throw new IllegalStateException("Provider " + definition.id() + " needs a positive timeout");
            }
        }
        List<ProviderDefinition> primaries =
                definitions.stream().filter(ProviderDefinition::primary).collect(Collectors.toList());
        if (primaries.size() != 1) {
            throw new IllegalStateException(
                    "Exactly one primary provider must be configured but found " + primaries.size());
        }
        this.definitions = List.copyOf(definitions);
        this.primary = primaries.get(0);
    }

    public static ProviderRegistry fromProperties(ProviderProperties properties) {
        List<ProviderDefinition> definitions = new ArrayList<>();
        for (ProviderProperties.Definition definition : properties.getDefinitions()) {
            Duration timeout = definition.getTimeout() != null ? definition.getTimeout() : properties.getTimeout();
            definitions.add(new ProviderDefinition(ProviderId.of(definition.getId()), definition.isPrimary(), timeout));
        }
        return new ProviderRegistry(definitions);
    }

    public List<ProviderDefinition> all() {
        return definitions;
    }

    public ProviderDefinition primary() {
        return primary;
    }

    public List<ProviderDefinition> secondaries() {
        return definitions.stream().filter(definition -> !definition.primary()).collect(Collectors.toList());
    }
}

package com.investidor.backend.provider;

import java.time.Duration;

public record ProviderDefinition(ProviderId id, boolean primary, Duration timeout) {}

package com.investidor.backend.provider;

import java.time.Duration;

public interface ProviderSession extends AutoCloseable {

    RawFieldSet fetchRawFields(ProviderId providerId, String ticker, InstrumentType type, Duration timeout);

    boolean isHealthy();

    @Override
    void close();
}

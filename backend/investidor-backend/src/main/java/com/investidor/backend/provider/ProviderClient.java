package com.investidor.backend.provider;

import java.time.Duration;

public interface ProviderClient {

    /**
     * @throws ProviderException when the provider cannot be reached or its output is unusable
     */
    RawFieldSet fetchRawFields(ProviderId providerId, String ticker, InstrumentType type, Duration timeout);
}

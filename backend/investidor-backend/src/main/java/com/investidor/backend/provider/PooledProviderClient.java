package com.investidor.backend.provider;

import java.time.Duration;

public class PooledProviderClient implements ProviderClient {

    private final ProviderSessionPool pool;

    public PooledProviderClient(ProviderSessionPool pool) {
        this.pool = pool;
    }

    @Override
    public RawFieldSet fetchRawFields(
            ProviderId providerId, String ticker, InstrumentType type, Duration timeout) {
        try (ProviderSessionLease lease = pool.lease()) {
            return lease.session().fetchRawFields(providerId, ticker, type, timeout);
        }
    }
}

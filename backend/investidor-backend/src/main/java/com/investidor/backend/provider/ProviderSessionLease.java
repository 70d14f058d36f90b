package com.investidor.backend.provider;

import java.util.concurrent.atomic.AtomicBoolean;

public final class ProviderSessionLease implements AutoCloseable {

    private final ProviderSessionPool pool;
    private final ProviderSession session;
    private final AtomicBoolean released = new AtomicBoolean();

    ProviderSessionLease(ProviderSessionPool pool, ProviderSession session) {
        this.pool = pool;
        this.session = session;
    }

    public ProviderSession session() {
        if (released.get()) {
            throw new IllegalStateException("Provider session lease was already released");
        }
        return session;
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            pool.release(session);
        }
    }
}

package com.investidor.backend.provider;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ProviderSessionPool {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProviderSessionPool.class);

    private final ProviderSessionFactory factory;
    private final Semaphore slots;
    private final Duration leaseTimeout;
    private final Deque<ProviderSession> idleSessions = new ArrayDeque<>();
    private boolean closed;

    public ProviderSessionPool(ProviderSessionFactory factory, int maxSessions, Duration leaseTimeout) {
        if (maxSessions <= 0) {
            throw new IllegalArgumentException("maxSessions must be greater than zero");
        }
        this.factory = factory;
        this.slots = new Semaphore(maxSessions, true);
        this.leaseTimeout = leaseTimeout;
    }

    public ProviderSessionLease lease() {
        if (isClosed()) {
            throw new ProviderException("Provider session pool is closed");
        }
        acquireSlot();
        try {
            ProviderSession session = takeHealthyIdleSession();
            if (session == null) {
                session = factory.create();
                LOGGER.debug("Created provider session {}", session);
            }
            return new ProviderSessionLease(this, session);
        } catch (RuntimeException ex) {
            slots.release();
            throw ex;
        }
    }

    void release(ProviderSession session) {
        try {
            boolean reusable = session.isHealthy();
            synchronized (idleSessions) {
                if (!closed && reusable) {
                    idleSessions.addFirst(session);
                    return;
                }
            }
            closeSession(session);
        } finally {
            slots.release();
        }
    }

    public int idleCount() {
        synchronized (idleSessions) {
            return idleSessions.size();
        }
    }

    public boolean isClosed() {
        synchronized (idleSessions) {
            return closed;
        }
    }

    public void shutdown() {
        List<ProviderSession> toClose;
        synchronized (idleSessions) {
            if (closed) {
                return;
            }
            closed = true;
            toClose = new ArrayList<>(idleSessions);
            idleSessions.clear();
        }
        LOGGER.info("Shutting down provider session pool with {} idle sessions", toClose.size());
        toClose.forEach(this::closeSession);
    }

    private void acquireSlot() {
        try {
            if (!slots.tryAcquire(leaseTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new ProviderException("No provider session became available within " + leaseTimeout);
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new ProviderException("Interrupted while waiting for a provider session", ex);
        }
    }

    private ProviderSession takeHealthyIdleSession() {
        while (true) {
            ProviderSession candidate;
            synchronized (idleSessions) {
                candidate = idleSessions.pollFirst();
            }
            if (candidate == null) {
                return null;
            }
            if (candidate.isHealthy()) {
                return candidate;
            }
            LOGGER.info("Discarding unhealthy provider session {}", candidate);
            closeSession(candidate);
        }
    }

    private void closeSession(ProviderSession session) {
        try {
            session.close();
        } catch (RuntimeException ex) {
            LOGGER.warn("Failed to close provider session {}", session, ex);
        }
    }
}

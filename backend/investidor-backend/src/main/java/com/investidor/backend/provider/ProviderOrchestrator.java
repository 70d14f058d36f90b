package com.investidor.backend.provider;

import com.investidor.backend.normalization.TextNumberNormalizer;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

@Component
public class ProviderOrchestrator {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProviderOrchestrator.class);

    private final ProviderClient providerClient;
    private final ProviderRegistry registry;
    private final TextNumberNormalizer normalizer;
    private final ExecutorService executor;

    public ProviderOrchestrator(
            ProviderClient providerClient,
            ProviderRegistry registry,
            TextNumberNormalizer normalizer,
            @Qualifier("providerExecutor") ExecutorService executor) {
        this.providerClient = providerClient;
        this.registry = registry;
        this.normalizer = normalizer;
        this.executor = executor;
    }

    public ProviderFetchResult fetchAll(String ticker, InstrumentType type) {
        long dispatchedAt = System.nanoTime();
        Map<ProviderId, Future<RawFieldSet>> tasks = new LinkedHashMap<>();
        for (ProviderDefinition definition : registry.all()) {
            tasks.put(
                    definition.id(),
                    executor.submit(() -> providerClient.fetchRawFields(
                            definition.id(), ticker, type, definition.timeout())));
        }

        Map<ProviderId, ProviderOutcome> outcomes = new LinkedHashMap<>();
        try {
            for (ProviderDefinition definition : registry.all()) {
                outcomes.put(definition.id(), await(definition, tasks.get(definition.id()), dispatchedAt));
            }
        } catch (InterruptedException ex) {
            tasks.values().forEach(task -> task.cancel(true));
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for providers of " + ticker, ex);
        }

        ProviderId primaryId = registry.primary().id();
        ProviderOutcome primary = outcomes.get(primaryId);
        if (primary.isSuccess() && normalizer.normalize(primary.fields().get(FieldNames.PRICE)) == null) {
            LOGGER.info("Primary provider {} returned no usable price for {}", primaryId, ticker);
            outcomes.put(
                    primaryId,
                    ProviderOutcome.failure(
                            primaryId,
                            FailureReason.essentialDataMissing(
                                    "Field '" + FieldNames.PRICE + "' is missing for " + ticker)));
        }

        ProviderFetchResult result = new ProviderFetchResult(primaryId, outcomes);
        LOGGER.debug(
                "Fetched {} providers for {} in {} ms; failed: {}",
                outcomes.size(),
                ticker,
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - dispatchedAt),
                result.failedProviders());
        return result;
    }

    private ProviderOutcome await(ProviderDefinition definition, Future<RawFieldSet> task, long dispatchedAt)
            throws InterruptedException {
        ProviderId id = definition.id();
        long remaining = definition.timeout().toNanos() - (System.nanoTime() - dispatchedAt);
        try {
            RawFieldSet fields = task.get(Math.max(remaining, 0L), TimeUnit.NANOSECONDS);
            if (fields == null) {
                LOGGER.warn("Provider {} returned no field set", id);
                return ProviderOutcome.failure(id, FailureReason.unavailable("Provider returned no data"));
            }
            return ProviderOutcome.success(id, fields);
        } catch (TimeoutException ex) {
            task.cancel(true);
            LOGGER.warn("Provider {} timed out after {}", id, definition.timeout());
            return ProviderOutcome.failure(
                    id, FailureReason.timeout("Provider timed out after " + definition.timeout()));
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            LOGGER.warn("Provider {} failed: {}", id, cause.getMessage(), cause);
            return ProviderOutcome.failure(id, FailureReason.unavailable(describe(cause)));
        } catch (CancellationException ex) {
            LOGGER.warn("Provider {} task was cancelled", id);
            return ProviderOutcome.failure(id, FailureReason.unavailable("Provider task was cancelled"));
        }
    }

    private String describe(Throwable cause) {
        String message = cause.getMessage();
        if (message == null || message.isBlank()) {
            return cause.getClass().getSimpleName();
        }
        return message;
    }
}

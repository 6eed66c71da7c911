package com.koni.uns.infrastructure.resilience;

import com.koni.uns.domain.exception.FatalStorageException;
import com.koni.uns.domain.exception.TransientStorageException;
import com.koni.uns.infrastructure.observability.UnsMetrics;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Runs storage calls under the storage retry policy and translates their failures.
 * 
 * - transient failures are retried by the {@link Retry}; when the budget is spent they surface
 *   as {@link TransientStorageException}
 * - any other failure surfaces immediately as {@link FatalStorageException}
 * 
 * The wrapped call must be safe to repeat: a single upsert, or a chunk written in its own transaction.
 */
@Slf4j
@Component
public class ResilientStorageExecutor {
    
    private final Retry retry;
    private final StorageErrorClassifier classifier;
    private final UnsMetrics metrics;
    
    public ResilientStorageExecutor(Retry storageRetry, StorageErrorClassifier classifier, UnsMetrics metrics) {
        this.retry = storageRetry;
        this.classifier = classifier;
        this.metrics = metrics;
        
        registerRetryEventListeners();
    }
    
    /**
     * Executes a storage call with retry.
     * 
     * @param operation name used in logs and exception messages
     * @param call the storage call
     * @return the call result
     * @throws TransientStorageException if the call still fails transiently after the last attempt
     * @throws FatalStorageException if the call fails with a non-retryable error
     */
    public <T> T execute(String operation, Supplier<T> call) {
        try {
            return retry.executeSupplier(call);
        } catch (TransientStorageException | FatalStorageException e) {
            throw e;
        } catch (RuntimeException e) {
            if (classifier.test(e)) {
                log.error("Storage call failed after retries: operation={}, error={}", operation, e.getMessage());
                throw new TransientStorageException(operation + " failed after retries: " + e.getMessage(), e);
            }
            log.error("Storage call failed with non-retryable error: operation={}, error={}", operation, e.getMessage());
            throw new FatalStorageException(operation + " failed: " + e.getMessage(), e);
        }
    }
    
    public void run(String operation, Runnable call) {
        execute(operation, () -> {
            call.run();
            return null;
        });
    }
    
    private void registerRetryEventListeners() {
        retry.getEventPublisher()
                .onRetry(event -> {
                    metrics.recordStorageRetry();
                    log.warn("Retrying storage call: attempt={}, wait={}ms, error={}",
                            event.getNumberOfRetryAttempts(),
                            event.getWaitInterval().toMillis(),
                            event.getLastThrowable() == null ? "n/a" : event.getLastThrowable().getMessage());
                })
                .onError(event -> log.warn("Storage call gave up: attempts={}",
                        event.getNumberOfRetryAttempts()));
    }
}

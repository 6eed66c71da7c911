package com.koni.uns.infrastructure.resilience;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Resilience policies of the storage layer.
 * 
 * Retry (every durable storage call):
 * - 3 attempts in total
 * - linear backoff: attempt x 100ms
 * - only failures accepted by {@link StorageErrorClassifier} are retried
 * 
 * Circuit Breaker (historical writes):
 * - CLOSED: writes pass through
 * - OPEN: storage considered down, historical batches are dropped while realtime ingestion continues
 * - HALF_OPEN: a few writes probe for recovery
 */
@Configuration
public class StorageResilienceConfiguration {
    
    public static final String STORAGE_RETRY = "storage";
    public static final String HISTORICAL_CIRCUIT_BREAKER = "historicalStorage";
    
    @Bean
    public StorageErrorClassifier storageErrorClassifier() {
        return new StorageErrorClassifier();
    }
    
    /**
     * Creates the storage retry policy.
     * 
     * @param classifier retryable-error predicate
     * @param maxAttempts total number of attempts
     * @param backoffMillis backoff unit multiplied by the attempt number
     * @return RetryConfig for storage calls
     */
    @Bean
    public RetryConfig storageRetryConfig(
            StorageErrorClassifier classifier,
            @Value("${uns.storage.retry.max-attempts:3}") int maxAttempts,
            @Value("${uns.storage.retry.backoff-ms:100}") long backoffMillis) {
        IntervalFunction linearBackoff = attempt -> attempt * backoffMillis;
        return RetryConfig.custom()
            .maxAttempts(maxAttempts)
            .intervalFunction(linearBackoff)
            .retryOnException(classifier)
            .build();
    }
    
    @Bean
    public RetryRegistry retryRegistry(RetryConfig storageRetryConfig) {
        return RetryRegistry.of(storageRetryConfig);
    }
    
    @Bean
    public Retry storageRetry(RetryRegistry retryRegistry) {
        return retryRegistry.retry(STORAGE_RETRY);
    }
    
    /**
     * Creates CircuitBreakerConfig for historical storage writes.
     * 
     * Configuration:
     * - Sliding window: 20 calls (COUNT_BASED)
     * - Failure threshold: 50%
     * - Wait duration in OPEN state: 30 seconds
     * - Permitted calls in HALF_OPEN: 3
     * 
     * @return CircuitBreakerConfig for historical storage
     */
    @Bean
    public CircuitBreakerConfig historicalStorageCircuitBreakerConfig() {
        return CircuitBreakerConfig.custom()
            .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
            .slidingWindowSize(20)
            .minimumNumberOfCalls(10)
            .failureRateThreshold(50.0f)
            .waitDurationInOpenState(Duration.ofSeconds(30))
            .permittedNumberOfCallsInHalfOpenState(3)
            .automaticTransitionFromOpenToHalfOpenEnabled(true)
            .build();
    }
    
    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(CircuitBreakerConfig historicalStorageCircuitBreakerConfig) {
        return CircuitBreakerRegistry.of(historicalStorageCircuitBreakerConfig);
    }
    
    @Bean
    public CircuitBreaker historicalStorageCircuitBreaker(CircuitBreakerRegistry registry) {
        return registry.circuitBreaker(HISTORICAL_CIRCUIT_BREAKER);
    }
}

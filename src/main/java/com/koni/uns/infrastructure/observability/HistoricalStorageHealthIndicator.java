package com.koni.uns.infrastructure.observability;

import com.koni.uns.application.ingestion.HistoricalStorageProperties;
import com.koni.uns.application.ingestion.HistoricalStorageWriter;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for historical storage.
 *
 * DOWN while the historical circuit breaker is open (writes are being dropped),
 * UP otherwise. Details carry the provider, the breaker state and the writer queue depth.
 */
@Component("historicalStorage")
@RequiredArgsConstructor
public class HistoricalStorageHealthIndicator implements HealthIndicator {

    private final CircuitBreaker historicalStorageCircuitBreaker;
    private final HistoricalStorageProperties properties;
    private final HistoricalStorageWriter writer;

    @Override
    public Health health() {
        CircuitBreaker.State state = historicalStorageCircuitBreaker.getState();
        Health.Builder builder = state == CircuitBreaker.State.OPEN || state == CircuitBreaker.State.FORCED_OPEN
                ? Health.down()
                : Health.up();
        CircuitBreaker.Metrics metrics = historicalStorageCircuitBreaker.getMetrics();
        return builder
                .withDetail("provider", properties.getProvider().name())
                .withDetail("circuitBreaker", state.name())
                .withDetail("failureRate", metrics.getFailureRate())
                .withDetail("queued", writer.getQueueSize())
                .withDetail("retentionDays", properties.getRetentionDays())
                .withDetail("walEnabled", properties.isEnableWal())
                .build();
    }
}

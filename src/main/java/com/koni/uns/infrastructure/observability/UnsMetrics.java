package com.koni.uns.infrastructure.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Component for tracking pipeline metrics.
 * Provides counters for ingestion, discovery, mapping and storage outcomes, and a timer
 * around the per-data-point ingestion path.
 */
@Slf4j
@Component
public class UnsMetrics {

    private final MeterRegistry registry;
    private final Counter dataPointsReceived;
    private final Counter topicsDiscovered;
    private final Counter topicsMapped;
    private final Counter topicsUnmapped;
    private final Counter storageRetries;
    private final Counter historicalValuesWritten;
    private final Timer processingTime;

    public UnsMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.dataPointsReceived = Counter.builder("uns.datapoints.received.total")
                .description("Total data points received from all connections")
                .register(registry);

        this.topicsDiscovered = Counter.builder("uns.topics.discovered.total")
                .description("Total topics seen for the first time")
                .register(registry);

        this.topicsMapped = Counter.builder("uns.topics.mapped.total")
                .description("Total successful topic auto-mappings")
                .register(registry);

        this.topicsUnmapped = Counter.builder("uns.topics.unmapped.total")
                .description("Total topics left unmapped by the auto-mapping engine")
                .register(registry);

        this.storageRetries = Counter.builder("uns.storage.retries.total")
                .description("Total storage calls retried after a transient failure")
                .register(registry);

        this.historicalValuesWritten = Counter.builder("uns.storage.historical.written.total")
                .description("Total values appended to historical storage")
                .register(registry);

        this.processingTime = Timer.builder("uns.ingestion.processing.time")
                .description("Time to process one received data point")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void recordDataPointReceived() {
        dataPointsReceived.increment();
    }

    public void recordTopicDiscovered() {
        topicsDiscovered.increment();
        log.debug("Topic discovered counter incremented");
    }

    public void recordTopicMapped() {
        topicsMapped.increment();
        log.debug("Topic mapped counter incremented");
    }

    public void recordTopicUnmapped() {
        topicsUnmapped.increment();
        log.debug("Topic unmapped counter incremented");
    }

    public void recordStorageRetry() {
        storageRetries.increment();
    }

    public void recordHistoricalValuesWritten(int count) {
        historicalValuesWritten.increment(count);
    }

    /**
     * Increment the counter of writes dropped by a storage writer.
     *
     * @param store "realtime" or "historical"
     * @param count number of dropped values
     */
    public void recordStorageWriteDropped(String store, int count) {
        Counter.builder("uns.storage.writes.dropped.total")
                .description("Total values dropped after a failed storage write")
                .tag("store", store)
                .register(registry)
                .increment(count);
        log.debug("Dropped write counter incremented: store={}, count={}", store, count);
    }

    /**
     * Increment the counter of event handlers that threw.
     *
     * @param eventType simple name of the event class
     */
    public void recordEventHandlerFailure(String eventType) {
        Counter.builder("uns.eventbus.handler.failures.total")
                .description("Total event handler invocations that failed")
                .tag("event", eventType)
                .register(registry)
                .increment();
    }

    /**
     * Record the processing time for an ingestion operation.
     *
     * @param operation The operation to time
     * @param <T> The return type of the operation
     * @return The result of the operation
     */
    public <T> T recordProcessingTime(Supplier<T> operation) {
        return processingTime.record(operation);
    }

    /**
     * Record the processing time for a void operation.
     *
     * @param operation The operation to time
     */
    public void recordProcessingTime(Runnable operation) {
        processingTime.record(operation);
    }
}

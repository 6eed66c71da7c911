package com.koni.uns.application.ingestion;

import com.koni.uns.application.port.EventBus;
import com.koni.uns.domain.event.TopicDataReceived;
import com.koni.uns.domain.model.DataPoint;
import com.koni.uns.domain.repository.BatchStorage;
import com.koni.uns.domain.repository.HistoricalStorage;
import com.koni.uns.infrastructure.observability.UnsMetrics;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Buffers received values and appends them to historical storage in batches.
 *
 * A batch is flushed when {@code batch-size} values are queued or every {@code flush-interval-ms}.
 * Writes go through the historical circuit breaker: while it is open, batches are dropped and
 * realtime ingestion is unaffected. Batches are cut to the backend's atomic batch size; a failed
 * chunk is retried item by item so that only the offending values are lost and committed chunks
 * are never written twice.
 */
@Slf4j
@Component
public class HistoricalStorageWriter {

    private static final String STORE = "historical";

    private final HistoricalStorage historicalStorage;
    private final CircuitBreaker circuitBreaker;
    private final HistoricalStorageProperties properties;
    private final EventBus eventBus;
    private final UnsMetrics metrics;
    private final BlockingQueue<DataPoint> queue;
    private final ScheduledExecutorService flusher;
    private final ReentrantLock flushLock = new ReentrantLock();
    private final AtomicBoolean flushRequested = new AtomicBoolean();

    private EventBus.Subscription subscription;

    public HistoricalStorageWriter(HistoricalStorage historicalStorage,
                                   CircuitBreaker historicalStorageCircuitBreaker,
                                   HistoricalStorageProperties properties,
                                   EventBus eventBus,
                                   UnsMetrics metrics) {
        this.historicalStorage = historicalStorage;
        this.circuitBreaker = historicalStorageCircuitBreaker;
        this.properties = properties;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.queue = new LinkedBlockingQueue<>(Math.max(1, properties.getMaxQueueSize()));
        this.flusher = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "historical-writer");
            thread.setDaemon(true);
            return thread;
        });
    }

    @PostConstruct
    public void start() {
        subscription = eventBus.subscribe(TopicDataReceived.class, this::onTopicDataReceived);
        long interval = Math.max(1, properties.getFlushIntervalMs());
        flusher.scheduleWithFixedDelay(this::flushSafely, interval, interval, TimeUnit.MILLISECONDS);
        log.info("Historical writer started: batchSize={}, flushIntervalMs={}, maxQueueSize={}, storage={}",
                properties.getBatchSize(), interval, properties.getMaxQueueSize(),
                historicalStorage.getClass().getSimpleName());
    }

    @PreDestroy
    public void shutdown() {
        if (subscription != null) {
            subscription.close();
        }
        flusher.shutdown();
        try {
            if (!flusher.awaitTermination(5, TimeUnit.SECONDS)) {
                flusher.shutdownNow();
            }
        } catch (InterruptedException e) {
            flusher.shutdownNow();
            Thread.currentThread().interrupt();
        }
        int remaining = flush();
        log.info("Historical writer stopped: flushedOnShutdown={}", remaining);
    }

    void onTopicDataReceived(TopicDataReceived event) {
        if (!queue.offer(event.getDataPoint())) {
            metrics.recordStorageWriteDropped(STORE, 1);
            log.warn("Historical queue full, dropping value: topic={}, queued={}",
                    event.getDataPoint().getTopic(), queue.size());
            return;
        }
        if (queue.size() >= properties.getBatchSize() && flushRequested.compareAndSet(false, true)) {
            try {
                flusher.execute(() -> {
                    flushRequested.set(false);
                    flushSafely();
                });
            } catch (RejectedExecutionException e) {
                flushRequested.set(false);
                log.debug("Historical writer is shutting down, leaving flush to shutdown");
            }
        }
    }

    /**
     * Writes everything queued so far, batch by batch.
     *
     * @return number of values written
     */
    public int flush() {
        flushLock.lock();
        try {
            int written = 0;
            int batchSize = Math.max(1, properties.getBatchSize());
            List<DataPoint> batch = new ArrayList<>(Math.min(batchSize, 1024));
            while (queue.drainTo(batch, batchSize) > 0) {
                written += writeBatch(batch);
                batch.clear();
            }
            return written;
        } finally {
            flushLock.unlock();
        }
    }

    public int getQueueSize() {
        return queue.size();
    }

    private void flushSafely() {
        try {
            flush();
        } catch (RuntimeException e) {
            log.error("Historical flush failed: error={}", e.getMessage(), e);
        }
    }

    private int writeBatch(List<DataPoint> batch) {
        if (!(historicalStorage instanceof BatchStorage)) {
            return writeItems(batch);
        }
        BatchStorage batchStorage = (BatchStorage) historicalStorage;
        int chunkSize = Math.max(1, batchStorage.getMaxBatchSize());
        int written = 0;
        for (int start = 0; start < batch.size(); start += chunkSize) {
            List<DataPoint> chunk = batch.subList(start, Math.min(start + chunkSize, batch.size()));
            try {
                circuitBreaker.executeRunnable(() -> batchStorage.storeBatch(chunk));
                metrics.recordHistoricalValuesWritten(chunk.size());
                log.debug("Historical batch written: size={}", chunk.size());
                written += chunk.size();
            } catch (CallNotPermittedException e) {
                int remaining = batch.size() - start;
                metrics.recordStorageWriteDropped(STORE, remaining);
                log.warn("Historical storage circuit open, dropping batch: size={}", remaining);
                return written;
            } catch (RuntimeException e) {
                // only this chunk is uncommitted, earlier chunks stay as written
                log.warn("Historical batch failed, retrying item by item: size={}, error={}",
                        chunk.size(), e.getMessage());
                written += writeItems(chunk);
            }
        }
        return written;
    }

    private int writeItems(List<DataPoint> batch) {
        int written = 0;
        int dropped = 0;
        for (int i = 0; i < batch.size(); i++) {
            DataPoint dataPoint = batch.get(i);
            try {
                circuitBreaker.executeRunnable(() -> historicalStorage.store(dataPoint));
                written++;
            } catch (CallNotPermittedException e) {
                dropped += batch.size() - i;
                log.warn("Historical storage circuit opened during item writes, dropping rest: dropped={}",
                        batch.size() - i);
                break;
            } catch (RuntimeException e) {
                dropped++;
                log.warn("Historical write dropped: topic={}, error={}", dataPoint.getTopic(), e.getMessage());
            }
        }
        if (written > 0) {
            metrics.recordHistoricalValuesWritten(written);
        }
        if (dropped > 0) {
            metrics.recordStorageWriteDropped(STORE, dropped);
        }
        return written;
    }
}

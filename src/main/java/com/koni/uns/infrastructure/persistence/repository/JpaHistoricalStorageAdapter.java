package com.koni.uns.infrastructure.persistence.repository;

import com.koni.uns.domain.model.DataPoint;
import com.koni.uns.domain.model.HierarchicalPath;
import com.koni.uns.domain.repository.BatchStorage;
import com.koni.uns.domain.repository.CleanableStorage;
import com.koni.uns.domain.repository.HistoricalStorage;
import com.koni.uns.infrastructure.persistence.DataPointJsonCodec;
import com.koni.uns.infrastructure.persistence.entity.HistoricalDataPointEntity;
import com.koni.uns.infrastructure.resilience.ResilientStorageExecutor;
import io.micrometer.observation.annotation.Observed;
import lombok.extern.slf4j.Slf4j;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * JPA adapter for HistoricalStorage.
 *
 * Bulk writes are split into chunks of {@code bulkChunkSize} rows. Each chunk commits in its own
 * transaction and is retried as a unit by the {@link ResilientStorageExecutor}, so concurrent
 * bulk writers never hold one long transaction and a retried chunk is written exactly once.
 */
@Slf4j
public class JpaHistoricalStorageAdapter implements HistoricalStorage, BatchStorage, CleanableStorage {

    private final HistoricalDataPointJpaRepository jpaRepository;
    private final DataPointJsonCodec codec;
    private final ResilientStorageExecutor executor;
    private final TransactionTemplate transactionTemplate;
    private final int bulkChunkSize;

    public JpaHistoricalStorageAdapter(HistoricalDataPointJpaRepository jpaRepository,
                                       DataPointJsonCodec codec,
                                       ResilientStorageExecutor executor,
                                       PlatformTransactionManager transactionManager,
                                       int bulkChunkSize) {
        this.jpaRepository = jpaRepository;
        this.codec = codec;
        this.executor = executor;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.bulkChunkSize = Math.max(1, bulkChunkSize);
    }

    @Override
    @Observed(name = "repository.save", contextualName = "historical-store")
    public void store(DataPoint dataPoint) {
        if (dataPoint == null) {
            throw new IllegalArgumentException("DataPoint cannot be null");
        }
        executor.run("historical store", () -> transactionTemplate.executeWithoutResult(
                status -> jpaRepository.save(codec.toHistoricalEntity(dataPoint))));
    }

    @Override
    @Observed(name = "repository.saveAll", contextualName = "historical-store-bulk")
    public void storeBulk(List<DataPoint> dataPoints) {
        if (dataPoints == null) {
            throw new IllegalArgumentException("DataPoints cannot be null");
        }
        if (dataPoints.isEmpty()) {
            return;
        }
        int chunks = 0;
        for (int start = 0; start < dataPoints.size(); start += bulkChunkSize) {
            List<DataPoint> chunk = dataPoints.subList(start, Math.min(start + bulkChunkSize, dataPoints.size()));
            // fresh entities per attempt, a rolled-back attempt leaves generated ids behind
            executor.run("historical bulk chunk", () -> transactionTemplate.executeWithoutResult(status ->
                    jpaRepository.saveAll(chunk.stream()
                            .map(codec::toHistoricalEntity)
                            .collect(Collectors.toList()))));
            chunks++;
        }
        log.debug("Historical bulk write committed: values={}, chunks={}", dataPoints.size(), chunks);
    }

    @Override
    public void storeBatch(List<DataPoint> dataPoints) {
        storeBulk(dataPoints);
    }

    @Override
    public int getMaxBatchSize() {
        return bulkChunkSize;
    }

    @Override
    @Observed(name = "repository.find", contextualName = "historical-history")
    public List<DataPoint> getHistory(String topic, Instant from, Instant to) {
        if (topic == null) {
            throw new IllegalArgumentException("Topic cannot be null");
        }
        requireRange(from, to);
        List<HistoricalDataPointEntity> rows = executor.execute("historical history query",
                () -> jpaRepository.findByTopicAndRecordedAtBetweenOrderByRecordedAtAsc(topic, from, to));
        return rows.stream().map(codec::toDataPoint).collect(Collectors.toList());
    }

    @Override
    @Observed(name = "repository.find", contextualName = "historical-history-by-path")
    public List<DataPoint> getHistoryByPath(HierarchicalPath path, Instant from, Instant to) {
        if (path == null) {
            throw new IllegalArgumentException("Path cannot be null");
        }
        requireRange(from, to);
        if (path.isEmpty()) {
            return List.of();
        }
        String prefix = DataPointJsonCodec.pathString(path);
        List<HistoricalDataPointEntity> rows = executor.execute("historical path query",
                () -> jpaRepository.findByPathPrefix(prefix, DataPointJsonCodec.descendantPattern(prefix), from, to));
        return rows.stream().map(codec::toDataPoint).collect(Collectors.toList());
    }

    @Override
    public long archive(Instant before) {
        return cleanupOldData(before);
    }

    @Override
    public long getCleanupCount(Instant cutoff) {
        if (cutoff == null) {
            throw new IllegalArgumentException("Cutoff cannot be null");
        }
        return executor.execute("historical cleanup count", () -> jpaRepository.countByRecordedAtBefore(cutoff));
    }

    @Override
    @Observed(name = "repository.delete", contextualName = "historical-cleanup")
    public long cleanupOldData(Instant cutoff) {
        if (cutoff == null) {
            throw new IllegalArgumentException("Cutoff cannot be null");
        }
        Integer removed = executor.execute("historical cleanup", () -> transactionTemplate.execute(
                status -> jpaRepository.deleteByRecordedAtBefore(cutoff)));
        log.info("Historical values removed: cutoff={}, removed={}", cutoff, removed);
        return removed == null ? 0 : removed;
    }

    private static void requireRange(Instant from, Instant to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("Time range cannot be null");
        }
    }
}

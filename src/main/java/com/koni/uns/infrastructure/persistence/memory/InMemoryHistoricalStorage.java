package com.koni.uns.infrastructure.persistence.memory;

import com.koni.uns.domain.model.DataPoint;
import com.koni.uns.domain.model.HierarchicalPath;
import com.koni.uns.domain.repository.BatchStorage;
import com.koni.uns.domain.repository.CleanableStorage;
import com.koni.uns.domain.repository.HistoricalStorage;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Historical storage kept in memory, bounded per topic and in total.
 * 
 * When a bound is reached and auto-cleanup is on, the oldest value is evicted (per topic, or
 * across all topics for the total bound). With auto-cleanup off the new value is rejected.
 */
@Slf4j
public class InMemoryHistoricalStorage implements HistoricalStorage, BatchStorage, CleanableStorage {
    
    private final Map<String, Deque<DataPoint>> valuesByTopic = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final int maxValuesPerDataPoint;
    private final int maxTotalValues;
    private final boolean autoCleanup;
    private int totalValues;
    
    /**
     * @param maxValuesPerDataPoint values kept per topic
     * @param maxTotalValues values kept across all topics, -1 for unlimited
     * @param autoCleanup evict the oldest value instead of rejecting the new one
     */
    public InMemoryHistoricalStorage(int maxValuesPerDataPoint, int maxTotalValues, boolean autoCleanup) {
        if (maxValuesPerDataPoint <= 0) {
            throw new IllegalArgumentException("maxValuesPerDataPoint must be positive");
        }
        this.maxValuesPerDataPoint = maxValuesPerDataPoint;
        this.maxTotalValues = maxTotalValues;
        this.autoCleanup = autoCleanup;
    }
    
    @Override
    public void store(DataPoint dataPoint) {
        if (dataPoint == null) {
            throw new IllegalArgumentException("DataPoint cannot be null");
        }
        lock.writeLock().lock();
        try {
            append(dataPoint);
        } finally {
            lock.writeLock().unlock();
        }
    }
    
    @Override
    public void storeBulk(List<DataPoint> dataPoints) {
        if (dataPoints == null) {
            throw new IllegalArgumentException("DataPoints cannot be null");
        }
        lock.writeLock().lock();
        try {
            dataPoints.forEach(this::append);
        } finally {
            lock.writeLock().unlock();
        }
    }
    
    @Override
    public void storeBatch(List<DataPoint> dataPoints) {
        storeBulk(dataPoints);
    }
    
    @Override
    public List<DataPoint> getHistory(String topic, Instant from, Instant to) {
        lock.readLock().lock();
        try {
            Deque<DataPoint> values = valuesByTopic.get(topic);
            if (values == null) {
                return List.of();
            }
            return values.stream()
                    .filter(inRange(from, to))
                    .sorted(Comparator.comparing(DataPoint::getTimestamp))
                    .collect(Collectors.toList());
        } finally {
            lock.readLock().unlock();
        }
    }
    
    @Override
    public List<DataPoint> getHistoryByPath(HierarchicalPath path, Instant from, Instant to) {
        if (path == null) {
            throw new IllegalArgumentException("Path cannot be null");
        }
        if (path.isEmpty()) {
            return List.of();
        }
        lock.readLock().lock();
        try {
            return valuesByTopic.values().stream()
                    .flatMap(Deque::stream)
                    .filter(dataPoint -> dataPoint.getPath().startsWith(path))
                    .filter(inRange(from, to))
                    .sorted(Comparator.comparing(DataPoint::getTimestamp))
                    .collect(Collectors.toList());
        } finally {
            lock.readLock().unlock();
        }
    }
    
    @Override
    public long archive(Instant before) {
        return cleanupOldData(before);
    }
    
    @Override
    public long getCleanupCount(Instant cutoff) {
        lock.readLock().lock();
        try {
            return valuesByTopic.values().stream()
                    .flatMap(Deque::stream)
                    .filter(dataPoint -> dataPoint.getTimestamp().isBefore(cutoff))
                    .count();
        } finally {
            lock.readLock().unlock();
        }
    }
    
    @Override
    public long cleanupOldData(Instant cutoff) {
        lock.writeLock().lock();
        try {
            long removed = 0;
            Iterator<Deque<DataPoint>> topics = valuesByTopic.values().iterator();
            while (topics.hasNext()) {
                Deque<DataPoint> values = topics.next();
                int before = values.size();
                values.removeIf(dataPoint -> dataPoint.getTimestamp().isBefore(cutoff));
                removed += before - values.size();
                if (values.isEmpty()) {
                    topics.remove();
                }
            }
            totalValues -= (int) removed;
            log.info("Removed {} historical values older than {}", removed, cutoff);
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }
    
    public int getTotalValues() {
        lock.readLock().lock();
        try {
            return totalValues;
        } finally {
            lock.readLock().unlock();
        }
    }
    
    private void append(DataPoint dataPoint) {
        Deque<DataPoint> values = valuesByTopic.computeIfAbsent(dataPoint.getTopic(), topic -> new ArrayDeque<>());
        if (values.size() >= maxValuesPerDataPoint) {
            if (!autoCleanup) {
                log.warn("Per-topic limit reached, rejecting value: topic={}, limit={}",
                        dataPoint.getTopic(), maxValuesPerDataPoint);
                return;
            }
            values.pollFirst();
            totalValues--;
        }
        if (maxTotalValues >= 0 && totalValues >= maxTotalValues) {
            if (!autoCleanup) {
                log.warn("Total limit reached, rejecting value: topic={}, limit={}", dataPoint.getTopic(), maxTotalValues);
                return;
            }
            evictOldest();
        }
        values.addLast(dataPoint);
        totalValues++;
    }
    
    private void evictOldest() {
        Deque<DataPoint> oldest = null;
        for (Deque<DataPoint> values : valuesByTopic.values()) {
            if (values.isEmpty()) {
                continue;
            }
            if (oldest == null || values.peekFirst().getTimestamp().isBefore(oldest.peekFirst().getTimestamp())) {
                oldest = values;
            }
        }
        if (oldest != null) {
            oldest.pollFirst();
            totalValues--;
        }
    }
    
    private static Predicate<DataPoint> inRange(Instant from, Instant to) {
        return dataPoint -> (from == null || !dataPoint.getTimestamp().isBefore(from))
                && (to == null || !dataPoint.getTimestamp().isAfter(to));
    }
}

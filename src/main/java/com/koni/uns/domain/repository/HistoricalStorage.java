package com.koni.uns.domain.repository;

import com.koni.uns.domain.model.DataPoint;
import com.koni.uns.domain.model.HierarchicalPath;

import java.time.Instant;
import java.util.List;

/**
 * Append-only time-series store.
 * 
 * Durable implementations retry transient failures and chunk bulk writes so that a single
 * call never holds a lock or a batch in memory beyond the configured chunk size.
 */
public interface HistoricalStorage {
    
    /**
     * Appends a single value.
     * 
     * @param dataPoint the value to append
     * @throws IllegalArgumentException if dataPoint is null
     * @throws com.koni.uns.domain.exception.TransientStorageException if retries were exhausted
     * @throws com.koni.uns.domain.exception.FatalStorageException on a non-retryable failure
     */
    void store(DataPoint dataPoint);
    
    /**
     * Appends many values, chunked by the implementation.
     * 
     * @param dataPoints the values to append
     */
    void storeBulk(List<DataPoint> dataPoints);
    
    /**
     * Returns the values of a topic with {@code from <= timestamp <= to}, oldest first.
     */
    List<DataPoint> getHistory(String topic, Instant from, Instant to);
    
    /**
     * Returns the values of all topics at or below the path within the time range, oldest first.
     * An empty path matches nothing; unmapped values are only reachable by topic.
     */
    List<DataPoint> getHistoryByPath(HierarchicalPath path, Instant from, Instant to);
    
    /**
     * Removes values older than {@code before}.
     * 
     * @param before exclusive upper bound
     * @return number of values removed
     */
    long archive(Instant before);
}

package com.koni.uns.domain.repository;

import com.koni.uns.domain.model.DataPoint;

import java.util.List;

/**
 * Optional capability of a storage backend that can write a batch in one call.
 * Callers fall back to per-item writes when a backend does not implement it.
 */
public interface BatchStorage {
    
    /**
     * Writes all values or none of them. Batches must not exceed {@link #getMaxBatchSize()}.
     */
    void storeBatch(List<DataPoint> dataPoints);
    
    /**
     * Largest batch {@link #storeBatch(List)} commits atomically.
     */
    default int getMaxBatchSize() {
        return Integer.MAX_VALUE;
    }
}

package com.koni.uns.domain.repository;

import com.koni.uns.domain.model.DataPoint;
import com.koni.uns.domain.model.HierarchicalPath;

import java.util.List;
import java.util.Optional;

/**
 * Last-value-per-topic store.
 * 
 * Holds exactly one value per topic (last write wins). Storing the same data point again
 * leaves the store unchanged, so callers may retry {@link #store} freely.
 */
public interface RealtimeStorage {
    
    /**
     * Upserts the latest value of the data point's topic.
     * 
     * @param dataPoint the value to store
     * @throws IllegalArgumentException if dataPoint is null
     */
    void store(DataPoint dataPoint);
    
    Optional<DataPoint> getLatest(String topic);
    
    /**
     * Returns the latest values of all topics at or below the given path.
     * 
     * @param path the hierarchy path prefix
     * @return latest values, or an empty list
     */
    List<DataPoint> getLatestByPath(HierarchicalPath path);
    
    List<String> listTopics();
    
    /**
     * Deletes the latest value with the given data point id.
     * 
     * @param id the data point id
     * @return true if a value was removed
     */
    boolean delete(String id);
}

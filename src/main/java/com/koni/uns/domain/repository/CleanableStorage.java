package com.koni.uns.domain.repository;

import java.time.Instant;

/**
 * Optional capability of a storage backend that supports retention cleanup.
 */
public interface CleanableStorage {
    
    /**
     * Counts the values a cleanup with the same cutoff would remove, without removing anything.
     * 
     * @param cutoff values strictly older than this instant are counted
     * @return number of values older than the cutoff
     */
    long getCleanupCount(Instant cutoff);
    
    /**
     * Removes all values strictly older than the cutoff.
     * 
     * @param cutoff retention cutoff
     * @return number of values removed
     */
    long cleanupOldData(Instant cutoff);
}

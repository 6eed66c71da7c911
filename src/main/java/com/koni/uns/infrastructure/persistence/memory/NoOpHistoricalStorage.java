package com.koni.uns.infrastructure.persistence.memory;

import com.koni.uns.domain.model.DataPoint;
import com.koni.uns.domain.model.HierarchicalPath;
import com.koni.uns.domain.repository.HistoricalStorage;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.List;

/**
 * Historical storage used when history is switched off. Writes are discarded and reads are empty.
 */
@Slf4j
public class NoOpHistoricalStorage implements HistoricalStorage {
    
    @Override
    public void store(DataPoint dataPoint) {
        log.trace("Historical storage disabled, discarding value: topic={}", dataPoint.getTopic());
    }
    
    @Override
    public void storeBulk(List<DataPoint> dataPoints) {
        log.trace("Historical storage disabled, discarding {} values", dataPoints.size());
    }
    
    @Override
    public List<DataPoint> getHistory(String topic, Instant from, Instant to) {
        return List.of();
    }
    
    @Override
    public List<DataPoint> getHistoryByPath(HierarchicalPath path, Instant from, Instant to) {
        return List.of();
    }
    
    @Override
    public long archive(Instant before) {
        return 0;
    }
}

package com.koni.uns.infrastructure.persistence.memory;

import com.koni.uns.domain.model.DataPoint;
import com.koni.uns.domain.model.HierarchicalPath;
import com.koni.uns.domain.repository.RealtimeStorage;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Realtime storage backed by a concurrent map holding the latest data point per topic.
 */
@Slf4j
public class InMemoryRealtimeStorage implements RealtimeStorage {
    
    private final Map<String, DataPoint> latestByTopic = new ConcurrentHashMap<>();
    
    @Override
    public void store(DataPoint dataPoint) {
        if (dataPoint == null) {
            throw new IllegalArgumentException("DataPoint cannot be null");
        }
        latestByTopic.put(dataPoint.getTopic(), dataPoint);
        log.debug("Stored latest value: topic={}, id={}", dataPoint.getTopic(), dataPoint.getId());
    }
    
    @Override
    public Optional<DataPoint> getLatest(String topic) {
        if (topic == null) {
            throw new IllegalArgumentException("Topic cannot be null");
        }
        return Optional.ofNullable(latestByTopic.get(topic));
    }
    
    @Override
    public List<DataPoint> getLatestByPath(HierarchicalPath path) {
        if (path == null) {
            throw new IllegalArgumentException("Path cannot be null");
        }
        if (path.isEmpty()) {
            return List.of();
        }
        return latestByTopic.values().stream()
                .filter(dataPoint -> dataPoint.getPath().startsWith(path))
                .sorted(Comparator.comparing(DataPoint::getTopic))
                .collect(Collectors.toList());
    }
    
    @Override
    public List<String> listTopics() {
        List<String> topics = new ArrayList<>(latestByTopic.keySet());
        topics.sort(Comparator.naturalOrder());
        return topics;
    }
    
    @Override
    public boolean delete(String id) {
        if (id == null) {
            throw new IllegalArgumentException("Id cannot be null");
        }
        return latestByTopic.values().removeIf(dataPoint -> dataPoint.getId().equals(id));
    }
}

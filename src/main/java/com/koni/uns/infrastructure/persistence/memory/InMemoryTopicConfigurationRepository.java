package com.koni.uns.infrastructure.persistence.memory;

import com.koni.uns.domain.model.TopicConfiguration;
import com.koni.uns.domain.repository.TopicConfigurationRepository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Topic configuration store keyed by topic. Records are copied on the way in and out
 * so callers never share mutable state with the store.
 */
public class InMemoryTopicConfigurationRepository implements TopicConfigurationRepository {
    
    private final Map<String, TopicConfiguration> byTopic = new ConcurrentHashMap<>();
    
    @Override
    public Optional<TopicConfiguration> findByTopic(String topic) {
        if (topic == null) {
            throw new IllegalArgumentException("Topic cannot be null");
        }
        return Optional.ofNullable(byTopic.get(topic)).map(TopicConfiguration::copy);
    }
    
    @Override
    public boolean saveIfAbsent(TopicConfiguration configuration) {
        if (configuration == null) {
            throw new IllegalArgumentException("TopicConfiguration cannot be null");
        }
        return byTopic.putIfAbsent(configuration.getTopic(), configuration.copy()) == null;
    }
    
    @Override
    public void save(TopicConfiguration configuration) {
        if (configuration == null) {
            throw new IllegalArgumentException("TopicConfiguration cannot be null");
        }
        byTopic.put(configuration.getTopic(), configuration.copy());
    }
    
    @Override
    public boolean delete(String topic) {
        return byTopic.remove(topic) != null;
    }
    
    @Override
    public List<TopicConfiguration> findAll() {
        return byTopic.values().stream()
                .map(TopicConfiguration::copy)
                .sorted(Comparator.comparing(TopicConfiguration::getTopic))
                .collect(Collectors.toList());
    }
}

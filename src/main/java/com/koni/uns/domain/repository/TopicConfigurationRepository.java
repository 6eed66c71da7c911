package com.koni.uns.domain.repository;

import com.koni.uns.domain.model.TopicConfiguration;

import java.util.List;
import java.util.Optional;

/**
 * Repository for per-topic configuration records.
 * This is the durable configuration store the cache manager reconciles against.
 * 
 * Implementations return copies, so callers mutate a record and then {@link #save} it.
 */
public interface TopicConfigurationRepository {
    
    /**
     * Finds the record of a topic by its exact topic string.
     * 
     * @param topic the raw topic
     * @return the record, or empty if the topic was never seen
     * @throws IllegalArgumentException if topic is null
     */
    Optional<TopicConfiguration> findByTopic(String topic);
    
    /**
     * Inserts the record only if no record exists for its topic.
     * 
     * @param configuration the record to insert
     * @return true if the record was inserted, false if the topic was already known
     */
    boolean saveIfAbsent(TopicConfiguration configuration);
    
    /**
     * Inserts or replaces the record of a topic.
     * 
     * @param configuration the record to save
     * @throws IllegalArgumentException if configuration is null
     */
    void save(TopicConfiguration configuration);
    
    boolean delete(String topic);
    
    List<TopicConfiguration> findAll();
}

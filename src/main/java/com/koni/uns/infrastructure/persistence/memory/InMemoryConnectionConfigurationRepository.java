package com.koni.uns.infrastructure.persistence.memory;

import com.koni.uns.domain.model.ConnectionConfiguration;
import com.koni.uns.domain.repository.ConnectionConfigurationRepository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Connection configuration store keyed by connection id.
 */
public class InMemoryConnectionConfigurationRepository implements ConnectionConfigurationRepository {
    
    private final Map<String, ConnectionConfiguration> byId = new ConcurrentHashMap<>();
    
    @Override
    public Optional<ConnectionConfiguration> findById(String id) {
        if (id == null) {
            throw new IllegalArgumentException("Id cannot be null");
        }
        return Optional.ofNullable(byId.get(id));
    }
    
    @Override
    public void save(ConnectionConfiguration configuration) {
        if (configuration == null) {
            throw new IllegalArgumentException("ConnectionConfiguration cannot be null");
        }
        byId.put(configuration.getId(), configuration);
    }
    
    @Override
    public boolean delete(String id) {
        return byId.remove(id) != null;
    }
    
    @Override
    public List<ConnectionConfiguration> findAll() {
        return byId.values().stream()
                .sorted(Comparator.comparing(ConnectionConfiguration::getId))
                .collect(Collectors.toList());
    }
}

package com.koni.uns.infrastructure.persistence.memory;

import com.koni.uns.domain.model.HierarchicalPath;
import com.koni.uns.domain.model.NamespaceConfiguration;
import com.koni.uns.domain.repository.NamespaceConfigurationRepository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Namespace store keyed by id. Namespaces are immutable, so they are shared as-is.
 */
public class InMemoryNamespaceConfigurationRepository implements NamespaceConfigurationRepository {
    
    private final Map<String, NamespaceConfiguration> byId = new ConcurrentHashMap<>();
    
    @Override
    public Optional<NamespaceConfiguration> findById(String id) {
        if (id == null) {
            throw new IllegalArgumentException("Id cannot be null");
        }
        return Optional.ofNullable(byId.get(id));
    }
    
    @Override
    public List<NamespaceConfiguration> findByPath(HierarchicalPath path) {
        if (path == null) {
            throw new IllegalArgumentException("Path cannot be null");
        }
        return byId.values().stream()
                .filter(namespace -> path.equals(namespace.getPath()))
                .sorted(Comparator.comparing(NamespaceConfiguration::getName))
                .collect(Collectors.toList());
    }
    
    @Override
    public void save(NamespaceConfiguration configuration) {
        if (configuration == null) {
            throw new IllegalArgumentException("NamespaceConfiguration cannot be null");
        }
        byId.put(configuration.getId(), configuration);
    }
    
    @Override
    public boolean delete(String id) {
        return byId.remove(id) != null;
    }
    
    @Override
    public List<NamespaceConfiguration> findAll() {
        List<NamespaceConfiguration> all = new ArrayList<>(byId.values());
        all.sort(Comparator.comparing(NamespaceConfiguration::getName));
        return all;
    }
}

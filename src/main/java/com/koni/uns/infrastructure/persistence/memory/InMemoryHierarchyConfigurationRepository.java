package com.koni.uns.infrastructure.persistence.memory;

import com.koni.uns.domain.model.HierarchyConfiguration;
import com.koni.uns.domain.repository.HierarchyConfigurationRepository;

/**
 * Holds the active hierarchy, seeded from application configuration.
 */
public class InMemoryHierarchyConfigurationRepository implements HierarchyConfigurationRepository {
    
    private volatile HierarchyConfiguration active;
    
    public InMemoryHierarchyConfigurationRepository(HierarchyConfiguration initial) {
        if (initial == null) {
            throw new IllegalArgumentException("HierarchyConfiguration cannot be null");
        }
        this.active = initial;
    }
    
    @Override
    public HierarchyConfiguration getActive() {
        return active;
    }
    
    @Override
    public void setActive(HierarchyConfiguration configuration) {
        if (configuration == null) {
            throw new IllegalArgumentException("HierarchyConfiguration cannot be null");
        }
        this.active = configuration;
    }
}

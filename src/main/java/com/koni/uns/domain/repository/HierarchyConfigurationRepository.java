package com.koni.uns.domain.repository;

import com.koni.uns.domain.model.HierarchyConfiguration;

/**
 * Holds the active hierarchy configuration.
 */
public interface HierarchyConfigurationRepository {
    
    /**
     * @return the active hierarchy configuration, never null
     */
    HierarchyConfiguration getActive();
    
    void setActive(HierarchyConfiguration configuration);
}

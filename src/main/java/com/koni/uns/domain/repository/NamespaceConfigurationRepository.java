package com.koni.uns.domain.repository;

import com.koni.uns.domain.model.HierarchicalPath;
import com.koni.uns.domain.model.NamespaceConfiguration;

import java.util.List;
import java.util.Optional;

/**
 * Repository for namespace configurations, indexed by id and by anchoring path.
 */
public interface NamespaceConfigurationRepository {
    
    Optional<NamespaceConfiguration> findById(String id);
    
    /**
     * Finds the namespaces anchored exactly at the given path.
     * 
     * @param path the anchoring hierarchy path
     * @return matching namespaces, or an empty list
     */
    List<NamespaceConfiguration> findByPath(HierarchicalPath path);
    
    void save(NamespaceConfiguration configuration);
    
    boolean delete(String id);
    
    List<NamespaceConfiguration> findAll();
}

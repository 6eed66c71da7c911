package com.koni.uns.domain.repository;

import com.koni.uns.domain.model.ConnectionConfiguration;

import java.util.List;
import java.util.Optional;

/**
 * Persistence of connection configurations. Connection state itself is never persisted;
 * it is rebuilt from these configurations on process start.
 */
public interface ConnectionConfigurationRepository {
    
    Optional<ConnectionConfiguration> findById(String id);
    
    void save(ConnectionConfiguration configuration);
    
    boolean delete(String id);
    
    List<ConnectionConfiguration> findAll();
}

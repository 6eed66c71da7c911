package com.koni.uns.application.port;

import com.koni.uns.domain.model.ConnectionSettings;
import com.koni.uns.domain.model.ValidationResult;

/**
 * Registration entry of one connection type: its identifier, settings variant,
 * default and validation logic, and the factory creating connection instances.
 */
public interface ConnectionDescriptor {
    
    /**
     * @return the connection type identifier, e.g. "mqtt" or "simulated"
     */
    String getConnectionType();
    
    String getDisplayName();
    
    Class<? extends ConnectionSettings> getSettingsType();
    
    ConnectionSettings createDefaultSettings();
    
    /**
     * Validates settings before any state change. The settings are guaranteed to be
     * an instance of {@link #getSettingsType()}.
     */
    ValidationResult validate(ConnectionSettings settings);
    
    DataConnection create(String connectionId);
}

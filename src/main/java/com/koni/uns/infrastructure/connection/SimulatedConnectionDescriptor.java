package com.koni.uns.infrastructure.connection;

import com.koni.uns.application.port.ConnectionDescriptor;
import com.koni.uns.application.port.DataConnection;
import com.koni.uns.domain.model.ConnectionSettings;
import com.koni.uns.domain.model.ValidationResult;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Registers the built-in {@code simulated} connection type.
 */
@Component
public class SimulatedConnectionDescriptor implements ConnectionDescriptor {

    public static final String TYPE = "simulated";

    @Override
    public String getConnectionType() {
        return TYPE;
    }

    @Override
    public String getDisplayName() {
        return "Simulated data source";
    }

    @Override
    public Class<? extends ConnectionSettings> getSettingsType() {
        return SimulatedConnectionSettings.class;
    }

    @Override
    public ConnectionSettings createDefaultSettings() {
        return new SimulatedConnectionSettings(List.of("simulated/value"),
                SimulatedConnectionSettings.DEFAULT_PUBLISH_INTERVAL_MS, 0.0, 100.0);
    }

    @Override
    public ValidationResult validate(ConnectionSettings settings) {
        return ((SimulatedConnectionSettings) settings).validate();
    }

    @Override
    public DataConnection create(String connectionId) {
        return new SimulatedConnection(connectionId);
    }
}

package com.koni.uns.application.port;

import com.koni.uns.domain.model.ConnectionSettings;
import com.koni.uns.domain.model.ConnectionStatus;
import com.koni.uns.domain.model.DataPoint;
import com.koni.uns.domain.model.InputConfiguration;
import com.koni.uns.domain.model.OutputConfiguration;
import com.koni.uns.domain.model.ValidationResult;

/**
 * Contract implemented by protocol connectors (MQTT, SocketIO, OPC UA, ...).
 * 
 * Lifecycle methods may block. The connection manager calls them from its own executor
 * with a timeout and interrupts the calling thread on cancellation, so implementations
 * should react to {@link Thread#interrupt()} while waiting on I/O.
 */
public interface DataConnection extends AutoCloseable {
    
    String getConnectionId();
    
    ConnectionStatus getStatus();
    
    /**
     * Applies the typed settings. Called before every start.
     */
    void initialize(ConnectionSettings settings);
    
    /**
     * Opens the connection.
     * 
     * @return true when the connection is established
     */
    boolean start();
    
    /**
     * Closes the connection and releases protocol resources. Safe to call repeatedly.
     */
    void stop();
    
    boolean configureInput(InputConfiguration input);
    
    boolean configureOutput(OutputConfiguration output);
    
    boolean removeInput(String inputId);
    
    boolean removeOutput(String outputId);
    
    /**
     * Sends a value through the connection.
     * 
     * @param dataPoint the value
     * @param outputId target output, or null for the default output
     * @return true if the value was handed to the protocol layer
     */
    boolean sendData(DataPoint dataPoint, String outputId);
    
    ValidationResult validateConfiguration(ConnectionSettings settings);
    
    void addListener(ConnectionListener listener);
    
    void removeListener(ConnectionListener listener);
    
    /**
     * Disposes the instance; it is not started again afterwards.
     */
    @Override
    void close();
}

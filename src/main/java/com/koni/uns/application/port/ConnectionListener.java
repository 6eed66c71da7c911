package com.koni.uns.application.port;

import com.koni.uns.domain.model.ConnectionStatus;
import com.koni.uns.domain.model.DataQuality;

import java.time.Instant;
import java.util.Map;

/**
 * Event streams emitted by a single {@link DataConnection}.
 * A connection must deliver the data of one topic in the order it received it.
 */
public interface ConnectionListener {
    
    void onDataReceived(String topic, Object value, Instant timestamp, DataQuality quality, Map<String, Object> metadata);
    
    void onStatusChanged(ConnectionStatus oldStatus, ConnectionStatus newStatus, String message);
}

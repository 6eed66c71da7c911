package com.koni.uns.application.connection;

import com.koni.uns.domain.model.ConnectionStatus;
import com.koni.uns.domain.model.DataPoint;

/**
 * Manager-level listener receiving the merged streams of all managed connections,
 * each event tagged with the id of the connection it came from.
 */
public interface ConnectionEventListener {

    void onDataReceived(String connectionId, DataPoint dataPoint);

    default void onStatusChanged(String connectionId, ConnectionStatus oldStatus, ConnectionStatus newStatus,
                                 String message) {
    }
}

package com.koni.uns.application.connection;

import com.koni.uns.application.port.ConnectionListener;
import com.koni.uns.application.port.DataConnection;
import com.koni.uns.domain.model.ConnectionConfiguration;
import com.koni.uns.domain.model.ConnectionStatus;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Per-connection state held by {@link ConnectionManager}.
 *
 * Locking:
 * - {@code lifecycleLock} serializes start/stop/update/remove of this connection only
 * - {@code ioLock} is read-held by sends and write-held while the connection is stopped
 *   or reconfigured, so in-flight sends drain first
 * - status fields are guarded by the handle monitor
 */
@Getter
class ConnectionHandle {

    private final String id;
    private final ReentrantLock lifecycleLock = new ReentrantLock();
    private final ReentrantReadWriteLock ioLock = new ReentrantReadWriteLock();

    @Setter
    private volatile ConnectionConfiguration configuration;
    @Setter
    private volatile DataConnection connection;
    @Setter
    private volatile ConnectionListener connectionListener;

    private volatile ConnectionStatus status = ConnectionStatus.DISABLED;
    private volatile String statusMessage;
    private volatile Instant statusChangedAt = Instant.now();
    private volatile boolean removed;

    ConnectionHandle(ConnectionConfiguration configuration) {
        this.id = configuration.getId();
        this.configuration = configuration;
    }

    /**
     * Applies a status change if the transition is allowed.
     *
     * @return the previous status, or null if the change was rejected or is a no-op
     */
    synchronized ConnectionStatus changeStatus(ConnectionStatus newStatus, String message) {
        ConnectionStatus previous = status;
        if (previous == newStatus) {
            statusMessage = message;
            return null;
        }
        if (!previous.canTransitionTo(newStatus)) {
            return null;
        }
        status = newStatus;
        statusMessage = message;
        statusChangedAt = Instant.now();
        return previous;
    }

    void markRemoved() {
        removed = true;
    }
}

package com.koni.uns.domain.event;

import com.koni.uns.domain.model.ConnectionStatus;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Published whenever the status of a managed connection changes.
 */
@Getter
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public final class ConnectionStatusChanged extends DomainEvent {

    private final String connectionId;
    private final ConnectionStatus oldStatus;
    private final ConnectionStatus newStatus;
    private final String message;

    public ConnectionStatusChanged(String connectionId, ConnectionStatus oldStatus, ConnectionStatus newStatus, String message) {
        super();
        this.connectionId = connectionId;
        this.oldStatus = oldStatus;
        this.newStatus = newStatus;
        this.message = message;
    }
}

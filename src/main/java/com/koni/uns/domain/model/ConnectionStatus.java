package com.koni.uns.domain.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle status of a connection.
 *
 * Allowed transitions:
 * - DISABLED -> CONNECTING (on start)
 * - CONNECTING -> CONNECTED | ERROR | DISCONNECTED
 * - CONNECTED -> DISCONNECTED (on failure) | STOPPING (on stop) | ERROR
 * - DISCONNECTED -> CONNECTING (retry) | STOPPING | ERROR
 * - ERROR -> CONNECTING | STOPPING | DISABLED
 * - STOPPING -> DISABLED | ERROR
 * - UNKNOWN -> any
 */
public enum ConnectionStatus {
    DISABLED,
    CONNECTING,
    CONNECTED,
    DISCONNECTED,
    ERROR,
    STOPPING,
    UNKNOWN;

    public boolean canTransitionTo(ConnectionStatus next) {
        if (next == null) {
            return false;
        }
        if (this == next) {
            return true;
        }
        return allowedTargets().contains(next);
    }

    /**
     * Whether the connection holds live connector resources in this status.
     */
    public boolean isActive() {
        return this == CONNECTING || this == CONNECTED || this == DISCONNECTED;
    }

    private Set<ConnectionStatus> allowedTargets() {
        switch (this) {
            case DISABLED:
                return EnumSet.of(CONNECTING);
            case CONNECTING:
                return EnumSet.of(CONNECTED, ERROR, DISCONNECTED, STOPPING);
            case CONNECTED:
                return EnumSet.of(DISCONNECTED, STOPPING, ERROR);
            case DISCONNECTED:
                return EnumSet.of(CONNECTING, STOPPING, ERROR);
            case ERROR:
                return EnumSet.of(CONNECTING, STOPPING, DISABLED);
            case STOPPING:
                return EnumSet.of(DISABLED, ERROR);
            default:
                return EnumSet.allOf(ConnectionStatus.class);
        }
    }
}

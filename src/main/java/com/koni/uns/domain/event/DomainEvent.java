package com.koni.uns.domain.event;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.UUID;

/**
 * Base type of all events carried by the in-process event bus.
 * Events are immutable and dispatched by their concrete class.
 */
@Getter
@EqualsAndHashCode
@ToString
public abstract class DomainEvent {

    private final UUID eventId;
    private final Instant occurredAt;

    protected DomainEvent() {
        this.eventId = UUID.randomUUID();
        this.occurredAt = Instant.now();
    }
}

package com.koni.uns.domain.event;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Published when a topic could not be mapped, or its previous mapping is no longer valid.
 * The topic stays visible with no namespace path so operators can assign it manually.
 */
@Getter
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public final class TopicUnmapped extends DomainEvent {

    private final String topic;
    private final String sourceType;
    private final String reason;

    public TopicUnmapped(String topic, String sourceType, String reason) {
        super();
        this.topic = topic;
        this.sourceType = sourceType;
        this.reason = reason;
    }
}

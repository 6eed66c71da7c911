package com.koni.uns.domain.event;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Published when a topic is seen for the first time. The topic is visible with no namespace path.
 */
@Getter
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public final class TopicDiscovered extends DomainEvent {

    private final String topic;
    private final String sourceType;
    private final String connectionId;

    public TopicDiscovered(String topic, String sourceType, String connectionId) {
        super();
        this.topic = topic;
        this.sourceType = sourceType;
        this.connectionId = connectionId;
    }
}

package com.koni.uns.domain.event;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Published after a stored topic configuration was created, updated, deleted,
 * re-assigned to a namespace or renamed.
 */
@Getter
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public final class TopicConfigurationChanged extends DomainEvent {

    public enum ChangeType {
        CREATED,
        UPDATED,
        DELETED,
        NAMESPACE_ASSIGNMENT_CHANGED,
        UNS_NAME_CHANGED
    }

    private final String topic;
    private final ChangeType changeType;

    public TopicConfigurationChanged(String topic, ChangeType changeType) {
        super();
        this.topic = topic;
        this.changeType = changeType;
    }
}

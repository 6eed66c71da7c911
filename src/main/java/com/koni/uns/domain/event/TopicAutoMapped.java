package com.koni.uns.domain.event;

import com.koni.uns.domain.model.HierarchicalPath;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Published when the auto-mapping engine resolved a hierarchy path for a topic.
 * Assigning the path to the stored topic record is a separate step driven by this event.
 */
@Getter
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public final class TopicAutoMapped extends DomainEvent {

    private final String topic;
    private final HierarchicalPath path;
    private final String patternName;

    public TopicAutoMapped(String topic, HierarchicalPath path, String patternName) {
        super();
        this.topic = topic;
        this.path = path;
        this.patternName = patternName;
    }
}

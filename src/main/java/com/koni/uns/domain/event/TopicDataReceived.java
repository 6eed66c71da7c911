package com.koni.uns.domain.event;

import com.koni.uns.domain.model.DataPoint;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Carries one received data point, enriched with its namespace path when the topic is mapped,
 * to the storage writers.
 */
@Getter
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public final class TopicDataReceived extends DomainEvent {

    private final DataPoint dataPoint;

    public TopicDataReceived(DataPoint dataPoint) {
        super();
        this.dataPoint = dataPoint;
    }
}

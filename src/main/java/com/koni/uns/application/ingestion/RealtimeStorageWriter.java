package com.koni.uns.application.ingestion;

import com.koni.uns.application.port.EventBus;
import com.koni.uns.domain.event.TopicDataReceived;
import com.koni.uns.domain.model.DataPoint;
import com.koni.uns.domain.repository.RealtimeStorage;
import com.koni.uns.infrastructure.observability.UnsMetrics;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Keeps the realtime store current. A failed upsert is logged and dropped; the next value
 * of the same topic overwrites it anyway.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RealtimeStorageWriter {

    private final RealtimeStorage realtimeStorage;
    private final EventBus eventBus;
    private final UnsMetrics metrics;

    private EventBus.Subscription subscription;

    @PostConstruct
    public void subscribe() {
        subscription = eventBus.subscribe(TopicDataReceived.class, this::onTopicDataReceived,
                EventBus.DispatchMode.ASYNC);
    }

    @PreDestroy
    public void unsubscribe() {
        if (subscription != null) {
            subscription.close();
        }
    }

    void onTopicDataReceived(TopicDataReceived event) {
        DataPoint dataPoint = event.getDataPoint();
        try {
            realtimeStorage.store(dataPoint);
        } catch (RuntimeException e) {
            metrics.recordStorageWriteDropped("realtime", 1);
            log.warn("Realtime write dropped: topic={}, error={}", dataPoint.getTopic(), e.getMessage());
        }
    }
}

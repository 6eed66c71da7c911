package com.koni.uns.application.ingestion;

import com.koni.uns.application.cache.CacheEntry;
import com.koni.uns.application.cache.MultiLevelCacheManager;
import com.koni.uns.application.connection.ConnectionEventListener;
import com.koni.uns.application.port.EventBus;
import com.koni.uns.application.topic.TopicConfigurationService;
import com.koni.uns.domain.event.TopicConfigurationChanged;
import com.koni.uns.domain.event.TopicDataReceived;
import com.koni.uns.domain.event.TopicDiscovered;
import com.koni.uns.domain.model.DataPoint;
import com.koni.uns.infrastructure.observability.UnsMetrics;
import io.micrometer.observation.annotation.Observed;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fan-in consumer of every value received by any connection.
 *
 * For each value:
 * 1. On first sighting of the topic, record it unmapped and publish TopicDiscovered
 * 2. Attach the topic's assigned namespace path, if any
 * 3. Publish TopicDataReceived for the storage writers
 *
 * Values of deactivated topics are dropped. Runs on the connector's delivery thread, so
 * nothing here waits on storage or on the mapping engine.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DataIngestionService implements ConnectionEventListener {

    private final TopicConfigurationService topicService;
    private final MultiLevelCacheManager cacheManager;
    private final EventBus eventBus;
    private final UnsMetrics metrics;

    private final Set<String> knownTopics = ConcurrentHashMap.newKeySet();
    private EventBus.Subscription deletions;

    @PostConstruct
    public void subscribe() {
        deletions = eventBus.subscribe(TopicConfigurationChanged.class, event -> {
            if (event.getChangeType() == TopicConfigurationChanged.ChangeType.DELETED) {
                knownTopics.remove(event.getTopic());
            }
        });
    }

    @PreDestroy
    public void unsubscribe() {
        if (deletions != null) {
            deletions.close();
        }
    }

    @Override
    @Observed(name = "uns.ingestion", contextualName = "ingest-data-point")
    public void onDataReceived(String connectionId, DataPoint dataPoint) {
        metrics.recordDataPointReceived();
        metrics.recordProcessingTime(() -> ingest(connectionId, dataPoint));
    }

    private void ingest(String connectionId, DataPoint dataPoint) {
        String topic = dataPoint.getTopic();
        if (knownTopics.add(topic) && topicService.registerIfAbsent(topic, dataPoint.getSourceSystem(), connectionId)) {
            metrics.recordTopicDiscovered();
            log.info("Topic discovered: topic={}, connectionId={}", topic, connectionId);
            eventBus.publish(new TopicDiscovered(topic, dataPoint.getSourceSystem(), connectionId));
        }

        Optional<CacheEntry> entry = cacheManager.getEntry(topic);
        if (entry.isPresent() && !entry.get().isActive()) {
            log.debug("Dropping value of inactive topic: topic={}", topic);
            return;
        }
        DataPoint enriched = entry
                .filter(CacheEntry::isMapped)
                .map(mapped -> dataPoint.toBuilder().path(mapped.getPath()).build())
                .orElse(dataPoint);

        log.debug("Data point ingested: topic={}, path={}, connectionId={}", topic, enriched.getPath(), connectionId);
        eventBus.publish(new TopicDataReceived(enriched));
    }
}

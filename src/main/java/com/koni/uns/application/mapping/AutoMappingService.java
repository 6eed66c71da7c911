package com.koni.uns.application.mapping;

import com.koni.uns.application.namespace.HierarchyService;
import com.koni.uns.application.port.EventBus;
import com.koni.uns.domain.event.NamespaceStructureChanged;
import com.koni.uns.domain.event.TopicAutoMapped;
import com.koni.uns.domain.event.TopicDiscovered;
import com.koni.uns.domain.event.TopicUnmapped;
import com.koni.uns.domain.model.TopicConfiguration;
import com.koni.uns.domain.repository.TopicConfigurationRepository;
import com.koni.uns.infrastructure.observability.UnsMetrics;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Drives the auto-mapping engine from the event bus.
 *
 * Responsibilities:
 * - Map every discovered topic off the ingestion thread (asynchronous subscription)
 * - Publish TopicAutoMapped on success and TopicUnmapped on failure
 * - Re-evaluate all topics when the hierarchy or the namespace set changes
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AutoMappingService {

    private final AutoTopicMapper mapper;
    private final HierarchyService hierarchyService;
    private final TopicConfigurationRepository topicRepository;
    private final AutoMappingProperties properties;
    private final EventBus eventBus;
    private final UnsMetrics metrics;

    private final List<EventBus.Subscription> subscriptions = new ArrayList<>();

    @PostConstruct
    public void subscribe() {
        subscriptions.add(eventBus.subscribe(TopicDiscovered.class, this::onTopicDiscovered, EventBus.DispatchMode.ASYNC));
        subscriptions.add(eventBus.subscribe(NamespaceStructureChanged.class, this::onNamespaceStructureChanged,
                EventBus.DispatchMode.ASYNC));
    }

    @PreDestroy
    public void unsubscribe() {
        subscriptions.forEach(EventBus.Subscription::close);
        subscriptions.clear();
    }

    void onTopicDiscovered(TopicDiscovered event) {
        evaluate(event.getTopic(), event.getSourceType());
    }

    void onNamespaceStructureChanged(NamespaceStructureChanged event) {
        log.info("Namespace structure changed, re-evaluating topic mappings: reason={}", event.getReason());
        reevaluateAll();
    }

    /**
     * Maps a single topic and publishes the outcome.
     *
     * @return the mapping outcome
     */
    public MappingResult evaluate(String topic, String sourceType) {
        if (!properties.isEnabled()) {
            metrics.recordTopicUnmapped();
            eventBus.publish(new TopicUnmapped(topic, sourceType, "Auto-mapping is disabled"));
            return MappingResult.unmatched(topic, "Auto-mapping is disabled");
        }

        MappingResult result = mapper.tryMapTopic(topic, null);
        if (result.isMatched()) {
            publishMapped(result);
        } else {
            metrics.recordTopicUnmapped();
            eventBus.publish(new TopicUnmapped(topic, sourceType, result.getReason()));
        }
        return result;
    }

    /**
     * Re-evaluates every known topic. Mapped topics whose assignment is still allowed are left alone;
     * all others are mapped again, which may map a previously unmapped topic or unmap a stale one.
     *
     * @return number of topics evaluated
     */
    public int reevaluateAll() {
        mapper.invalidate();
        int evaluated = 0;
        for (TopicConfiguration configuration : topicRepository.findAll()) {
            if (configuration.isMapped()) {
                if (hierarchyService.isTopicAssignmentAllowed(configuration.getPath())) {
                    continue;
                }
                evaluate(configuration.getTopic(), configuration.getSourceType());
            } else if (properties.isEnabled()) {
                // still-unmapped topics are only announced when they become mappable
                MappingResult result = mapper.tryMapTopic(configuration.getTopic(), null);
                if (result.isMatched()) {
                    publishMapped(result);
                }
            }
            evaluated++;
        }
        log.info("Re-evaluation finished: evaluated={}", evaluated);
        return evaluated;
    }

    private void publishMapped(MappingResult result) {
        metrics.recordTopicMapped();
        eventBus.publish(new TopicAutoMapped(result.getTopic(), result.getPath(), result.getPatternName()));
    }
}

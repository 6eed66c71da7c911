package com.koni.uns.application.topic;

import com.koni.uns.application.mapping.AutoTopicMapper;
import com.koni.uns.application.namespace.HierarchyService;
import com.koni.uns.application.port.EventBus;
import com.koni.uns.domain.event.TopicAutoMapped;
import com.koni.uns.domain.event.TopicConfigurationChanged;
import com.koni.uns.domain.event.TopicConfigurationChanged.ChangeType;
import com.koni.uns.domain.event.TopicUnmapped;
import com.koni.uns.domain.exception.NotFoundException;
import com.koni.uns.domain.exception.ValidationException;
import com.koni.uns.domain.model.HierarchicalPath;
import com.koni.uns.domain.model.TopicConfiguration;
import com.koni.uns.domain.repository.TopicConfigurationRepository;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Owns the lifecycle of stored topic records and performs the assignment step of auto-mapping.
 *
 * The namespace path of a record is only changed here: when a TopicAutoMapped event is consumed,
 * when a TopicUnmapped event reports that a mapped topic lost its mapping, or by an explicit
 * operator action. Every change is announced with TopicConfigurationChanged.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TopicConfigurationService {

    private final TopicConfigurationRepository repository;
    private final HierarchyService hierarchyService;
    private final AutoTopicMapper mapper;
    private final EventBus eventBus;

    private final List<EventBus.Subscription> subscriptions = new ArrayList<>();

    @PostConstruct
    public void subscribe() {
        subscriptions.add(eventBus.subscribe(TopicAutoMapped.class, this::onTopicAutoMapped, EventBus.DispatchMode.ASYNC));
        subscriptions.add(eventBus.subscribe(TopicUnmapped.class, this::onTopicUnmapped, EventBus.DispatchMode.ASYNC));
    }

    @PreDestroy
    public void unsubscribe() {
        subscriptions.forEach(EventBus.Subscription::close);
        subscriptions.clear();
    }

    /**
     * Records a topic on first sighting, unmapped.
     *
     * @return true if the topic was not known before
     */
    public boolean registerIfAbsent(String topic, String sourceType, String connectionId) {
        TopicConfiguration configuration = TopicConfiguration.discovered(topic, sourceType, connectionId, Instant.now());
        boolean created = repository.saveIfAbsent(configuration);
        if (created) {
            log.info("New topic recorded: topic={}, sourceType={}, connectionId={}", topic, sourceType, connectionId);
            eventBus.publish(new TopicConfigurationChanged(topic, ChangeType.CREATED));
        }
        return created;
    }

    void onTopicAutoMapped(TopicAutoMapped event) {
        TopicConfiguration configuration = repository.findByTopic(event.getTopic()).orElse(null);
        if (configuration == null) {
            log.warn("Mapped topic has no stored record, ignoring: topic={}", event.getTopic());
            return;
        }
        if (event.getPath().equals(configuration.getPath())) {
            log.debug("Topic already assigned to path: topic={}, path={}", event.getTopic(), event.getPath());
            return;
        }
        configuration.assignNamespace(event.getPath(), Instant.now());
        repository.save(configuration);
        log.info("Namespace assigned: topic={}, nsPath={}", event.getTopic(), configuration.getNsPath());
        eventBus.publish(new TopicConfigurationChanged(event.getTopic(), ChangeType.NAMESPACE_ASSIGNMENT_CHANGED));
    }

    void onTopicUnmapped(TopicUnmapped event) {
        repository.findByTopic(event.getTopic())
                .filter(TopicConfiguration::isMapped)
                .ifPresent(configuration -> {
                    configuration.clearNamespace(Instant.now());
                    repository.save(configuration);
                    log.info("Namespace assignment cleared: topic={}, reason={}", event.getTopic(), event.getReason());
                    eventBus.publish(new TopicConfigurationChanged(event.getTopic(), ChangeType.NAMESPACE_ASSIGNMENT_CHANGED));
                });
    }

    public TopicConfiguration getTopic(String topic) {
        return repository.findByTopic(topic)
                .orElseThrow(() -> new NotFoundException("Topic not found: " + topic));
    }

    public List<TopicConfiguration> getTopics() {
        return repository.findAll();
    }

    /**
     * Assigns a topic to a namespace path chosen by an operator.
     *
     * @param topic the topic
     * @param nsPath serialized path such as "Enterprise/Dallas/Press"
     * @throws NotFoundException if the topic is unknown
     * @throws ValidationException if the path does not fit the hierarchy or does not accept topics
     */
    public TopicConfiguration assignNamespace(String topic, String nsPath) {
        TopicConfiguration configuration = getTopic(topic);
        HierarchicalPath path = hierarchyService.getActiveHierarchy().parsePath(nsPath);
        if (path.isEmpty()) {
            throw new ValidationException("Namespace path cannot be empty");
        }
        if (!hierarchyService.isTopicAssignmentAllowed(path)) {
            throw new ValidationException("Topics are not allowed at " + path);
        }
        configuration.assignNamespace(path, Instant.now());
        repository.save(configuration);
        mapper.invalidate(topic);
        log.info("Namespace assigned manually: topic={}, nsPath={}", topic, configuration.getNsPath());
        eventBus.publish(new TopicConfigurationChanged(topic, ChangeType.NAMESPACE_ASSIGNMENT_CHANGED));
        return configuration;
    }

    public TopicConfiguration clearNamespace(String topic) {
        TopicConfiguration configuration = getTopic(topic);
        if (!configuration.isMapped()) {
            return configuration;
        }
        configuration.clearNamespace(Instant.now());
        repository.save(configuration);
        mapper.invalidate(topic);
        log.info("Namespace cleared manually: topic={}", topic);
        eventBus.publish(new TopicConfigurationChanged(topic, ChangeType.NAMESPACE_ASSIGNMENT_CHANGED));
        return configuration;
    }

    public TopicConfiguration rename(String topic, String unsName) {
        if (unsName == null || unsName.isBlank()) {
            throw new ValidationException("UNS name cannot be blank");
        }
        TopicConfiguration configuration = getTopic(topic);
        configuration.rename(unsName.trim(), Instant.now());
        repository.save(configuration);
        eventBus.publish(new TopicConfigurationChanged(topic, ChangeType.UNS_NAME_CHANGED));
        return configuration;
    }

    public TopicConfiguration setActive(String topic, boolean active) {
        TopicConfiguration configuration = getTopic(topic);
        configuration.changeActive(active, Instant.now());
        repository.save(configuration);
        eventBus.publish(new TopicConfigurationChanged(topic, ChangeType.UPDATED));
        return configuration;
    }

    public void delete(String topic) {
        if (!repository.delete(topic)) {
            throw new NotFoundException("Topic not found: " + topic);
        }
        mapper.invalidate(topic);
        log.info("Topic deleted: topic={}", topic);
        eventBus.publish(new TopicConfigurationChanged(topic, ChangeType.DELETED));
    }
}

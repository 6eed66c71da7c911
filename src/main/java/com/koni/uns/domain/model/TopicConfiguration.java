package com.koni.uns.domain.model;

import lombok.Getter;

import java.time.Instant;
import java.util.UUID;

/**
 * Per-topic record created on first sighting of a topic.
 *
 * The namespace path stays empty until a successful auto-mapping is assigned
 * (or an operator assigns one manually). It is never inferred from the topic name here.
 */
@Getter
public class TopicConfiguration {

    private final String id;
    private final String topic;
    private final String sourceType;
    private final String connectionId;
    private final Instant createdAt;
    private String unsName;
    private HierarchicalPath path;
    private boolean active;
    private Instant modifiedAt;

    public TopicConfiguration(String id, String topic, String unsName, HierarchicalPath path, String sourceType,
                              String connectionId, boolean active, Instant createdAt, Instant modifiedAt) {
        this.id = id;
        this.topic = topic;
        this.unsName = unsName;
        this.path = path == null ? HierarchicalPath.empty() : path;
        this.sourceType = sourceType;
        this.connectionId = connectionId;
        this.active = active;
        this.createdAt = createdAt;
        this.modifiedAt = modifiedAt;
    }

    /**
     * Creates the record for a newly observed topic, unmapped and active.
     * The UNS display name defaults to the last topic segment.
     */
    public static TopicConfiguration discovered(String topic, String sourceType, String connectionId, Instant now) {
        return new TopicConfiguration(UUID.randomUUID().toString(), topic, lastSegment(topic),
                HierarchicalPath.empty(), sourceType, connectionId, true, now, now);
    }

    /**
     * @return the serialized namespace path, or null while the topic is unmapped
     */
    public String getNsPath() {
        return path.isEmpty() ? null : path.getFullPath();
    }

    public boolean isMapped() {
        return !path.isEmpty();
    }

    public void assignNamespace(HierarchicalPath newPath, Instant now) {
        this.path = newPath == null ? HierarchicalPath.empty() : newPath;
        this.modifiedAt = now;
    }

    public void clearNamespace(Instant now) {
        assignNamespace(HierarchicalPath.empty(), now);
    }

    public void rename(String newUnsName, Instant now) {
        this.unsName = newUnsName;
        this.modifiedAt = now;
    }

    public void changeActive(boolean newActive, Instant now) {
        this.active = newActive;
        this.modifiedAt = now;
    }

    public TopicConfiguration copy() {
        return new TopicConfiguration(id, topic, unsName, path, sourceType, connectionId, active, createdAt, modifiedAt);
    }

    private static String lastSegment(String topic) {
        int index = topic.lastIndexOf('/');
        return index >= 0 && index < topic.length() - 1 ? topic.substring(index + 1) : topic;
    }

    @Override
    public String toString() {
        return "TopicConfiguration{" +
                "topic='" + topic + '\'' +
                ", unsName='" + unsName + '\'' +
                ", nsPath=" + getNsPath() +
                ", sourceType='" + sourceType + '\'' +
                ", active=" + active +
                '}';
    }
}

package com.koni.uns.domain.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Immutable value received from a connection, flowing through the ingestion pipeline.
 * Use {@code toBuilder()} to derive an enriched copy (for example with a resolved path).
 */
@Getter
@EqualsAndHashCode
@ToString
public class DataPoint {

    private final String id;
    private final String topic;
    private final HierarchicalPath path;
    private final Object value;
    private final Instant timestamp;
    private final String sourceSystem;
    private final DataQuality quality;
    private final Map<String, Object> metadata;

    @Builder(toBuilder = true)
    private DataPoint(String id, String topic, HierarchicalPath path, Object value, Instant timestamp,
                      String sourceSystem, DataQuality quality, Map<String, Object> metadata) {
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("Topic cannot be null or blank");
        }
        this.id = id != null ? id : UUID.randomUUID().toString();
        this.topic = topic;
        this.path = path != null ? path : HierarchicalPath.empty();
        this.value = value;
        this.timestamp = timestamp != null ? timestamp : Instant.now();
        this.sourceSystem = sourceSystem;
        this.quality = quality != null ? quality : DataQuality.GOOD;
        this.metadata = metadata == null || metadata.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}

package com.koni.uns.infrastructure.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.koni.uns.domain.exception.FatalStorageException;
import com.koni.uns.domain.model.DataPoint;
import com.koni.uns.domain.model.HierarchicalPath;
import com.koni.uns.infrastructure.persistence.entity.HistoricalDataPointEntity;
import com.koni.uns.infrastructure.persistence.entity.RealtimeValueEntity;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps data points to and from their JPA rows. Values, metadata and path levels are stored as JSON.
 */
public class DataPointJsonCodec {

    private static final TypeReference<LinkedHashMap<String, String>> PATH_TYPE = new TypeReference<>() { };
    private static final TypeReference<LinkedHashMap<String, Object>> METADATA_TYPE = new TypeReference<>() { };

    private final ObjectMapper objectMapper;

    public DataPointJsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public HistoricalDataPointEntity toHistoricalEntity(DataPoint dataPoint) {
        HistoricalDataPointEntity entity = new HistoricalDataPointEntity();
        entity.setDataPointId(dataPoint.getId());
        entity.setTopic(dataPoint.getTopic());
        entity.setPath(pathString(dataPoint.getPath()));
        entity.setPathJson(pathJson(dataPoint.getPath()));
        entity.setValueJson(write(dataPoint.getValue()));
        entity.setRecordedAt(dataPoint.getTimestamp());
        entity.setSourceSystem(dataPoint.getSourceSystem());
        entity.setQuality(dataPoint.getQuality());
        entity.setMetadataJson(dataPoint.getMetadata().isEmpty() ? null : write(dataPoint.getMetadata()));
        return entity;
    }

    /**
     * Copies the data point onto the row of its topic, creating the row when {@code entity} is null.
     */
    public RealtimeValueEntity toRealtimeEntity(DataPoint dataPoint, RealtimeValueEntity entity) {
        RealtimeValueEntity target = entity != null ? entity : new RealtimeValueEntity();
        target.setTopic(dataPoint.getTopic());
        target.setDataPointId(dataPoint.getId());
        target.setPath(pathString(dataPoint.getPath()));
        target.setPathJson(pathJson(dataPoint.getPath()));
        target.setValueJson(write(dataPoint.getValue()));
        target.setRecordedAt(dataPoint.getTimestamp());
        target.setSourceSystem(dataPoint.getSourceSystem());
        target.setQuality(dataPoint.getQuality());
        target.setMetadataJson(dataPoint.getMetadata().isEmpty() ? null : write(dataPoint.getMetadata()));
        return target;
    }

    public DataPoint toDataPoint(HistoricalDataPointEntity entity) {
        return DataPoint.builder()
                .id(entity.getDataPointId())
                .topic(entity.getTopic())
                .path(readPath(entity.getPathJson()))
                .value(readValue(entity.getValueJson()))
                .timestamp(entity.getRecordedAt())
                .sourceSystem(entity.getSourceSystem())
                .quality(entity.getQuality())
                .metadata(readMetadata(entity.getMetadataJson()))
                .build();
    }

    public DataPoint toDataPoint(RealtimeValueEntity entity) {
        return DataPoint.builder()
                .id(entity.getDataPointId())
                .topic(entity.getTopic())
                .path(readPath(entity.getPathJson()))
                .value(readValue(entity.getValueJson()))
                .timestamp(entity.getRecordedAt())
                .sourceSystem(entity.getSourceSystem())
                .quality(entity.getQuality())
                .metadata(readMetadata(entity.getMetadataJson()))
                .build();
    }

    /**
     * @return the serialized path used in path-prefix queries, or null for an unmapped value
     */
    public static String pathString(HierarchicalPath path) {
        return path == null || path.isEmpty() ? null : path.getFullPath();
    }

    /**
     * LIKE pattern matching every path below {@code path}, with {@code !} as the escape character.
     * Level values may contain {@code _} or {@code %}, which must match literally.
     */
    public static String descendantPattern(String path) {
        StringBuilder pattern = new StringBuilder(path.length() + 4);
        for (int i = 0; i < path.length(); i++) {
            char c = path.charAt(i);
            if (c == '!' || c == '%' || c == '_') {
                pattern.append('!');
            }
            pattern.append(c);
        }
        return pattern.append("/%").toString();
    }

    private String pathJson(HierarchicalPath path) {
        return path == null || path.isEmpty() ? null : write(path.getLevels());
    }

    private HierarchicalPath readPath(String json) {
        if (json == null) {
            return HierarchicalPath.empty();
        }
        try {
            return HierarchicalPath.of(objectMapper.readValue(json, PATH_TYPE));
        } catch (JsonProcessingException e) {
            throw new FatalStorageException("Stored path is not valid JSON: " + json, e);
        }
    }

    private Object readValue(String json) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, Object.class);
        } catch (JsonProcessingException e) {
            throw new FatalStorageException("Stored value is not valid JSON", e);
        }
    }

    private Map<String, Object> readMetadata(String json) {
        if (json == null) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, METADATA_TYPE);
        } catch (JsonProcessingException e) {
            throw new FatalStorageException("Stored metadata is not valid JSON", e);
        }
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new FatalStorageException("Value cannot be serialized: " + e.getOriginalMessage(), e);
        }
    }
}

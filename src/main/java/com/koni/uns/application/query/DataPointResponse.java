package com.koni.uns.application.query;

import com.koni.uns.domain.model.DataPoint;
import com.koni.uns.domain.model.DataQuality;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * A stored value as returned to clients.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class DataPointResponse {

    private String id;
    private String topic;
    private String nsPath;
    private Object value;
    private Instant timestamp;
    private String sourceSystem;
    private DataQuality quality;
    private Map<String, Object> metadata;

    public static DataPointResponse from(DataPoint dataPoint) {
        return new DataPointResponse(
                dataPoint.getId(),
                dataPoint.getTopic(),
                dataPoint.getPath().isEmpty() ? null : dataPoint.getPath().getFullPath(),
                dataPoint.getValue(),
                dataPoint.getTimestamp(),
                dataPoint.getSourceSystem(),
                dataPoint.getQuality(),
                dataPoint.getMetadata());
    }
}

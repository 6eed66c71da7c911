package com.koni.uns.infrastructure.connection;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.koni.uns.domain.model.ConnectionSettings;
import com.koni.uns.domain.model.ValidationResult;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings of the {@code simulated} connection type.
 */
@Getter
@EqualsAndHashCode
@ToString
public class SimulatedConnectionSettings implements ConnectionSettings {

    static final long DEFAULT_PUBLISH_INTERVAL_MS = 1000;

    private final List<String> topics;
    private final long publishIntervalMs;
    private final double valueMin;
    private final double valueMax;

    @JsonCreator
    public SimulatedConnectionSettings(
            @JsonProperty("topics") List<String> topics,
            @JsonProperty("publishIntervalMs") Long publishIntervalMs,
            @JsonProperty("valueMin") Double valueMin,
            @JsonProperty("valueMax") Double valueMax) {
        this.topics = topics == null ? List.of() : List.copyOf(topics);
        this.publishIntervalMs = publishIntervalMs == null ? DEFAULT_PUBLISH_INTERVAL_MS : publishIntervalMs;
        this.valueMin = valueMin == null ? 0.0 : valueMin;
        this.valueMax = valueMax == null ? 100.0 : valueMax;
    }

    public ValidationResult validate() {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        if (publishIntervalMs < 10) {
            errors.add("publishIntervalMs must be at least 10");
        }
        if (valueMin > valueMax) {
            errors.add("valueMin must not be greater than valueMax");
        }
        if (topics.stream().anyMatch(topic -> topic == null || topic.isBlank())) {
            errors.add("topics must not contain blank entries");
        }
        if (topics.isEmpty()) {
            warnings.add("No topics configured, the connection only echoes sent values");
        }
        return new ValidationResult(errors, warnings);
    }
}

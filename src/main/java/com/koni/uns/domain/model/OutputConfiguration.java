package com.koni.uns.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Outbound target of a connection. Values sent through the connection are published
 * under {@code topicPrefix}.
 */
@Getter
@EqualsAndHashCode
@ToString
public class OutputConfiguration {

    private final String id;
    private final String name;
    private final boolean enabled;
    private final String topicPrefix;

    @JsonCreator
    public OutputConfiguration(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("enabled") boolean enabled,
            @JsonProperty("topicPrefix") String topicPrefix) {
        this.id = id;
        this.name = name;
        this.enabled = enabled;
        this.topicPrefix = topicPrefix;
    }
}

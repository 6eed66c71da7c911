package com.koni.uns.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Inbound subscription of a connection, e.g. an MQTT topic filter or a set of OPC UA nodes.
 */
@Getter
@EqualsAndHashCode
@ToString
public class InputConfiguration {

    private final String id;
    private final String name;
    private final boolean enabled;
    private final String topicFilter;

    @JsonCreator
    public InputConfiguration(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("enabled") boolean enabled,
            @JsonProperty("topicFilter") String topicFilter) {
        this.id = id;
        this.name = name;
        this.enabled = enabled;
        this.topicFilter = topicFilter;
    }
}

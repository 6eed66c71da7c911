package com.koni.uns.domain.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Immutable configuration of a single connection.
 * The connector-specific part is carried by a typed {@link ConnectionSettings} variant
 * matching {@code connectionType}. Deserializable from JSON through its builder.
 */
@Getter
@EqualsAndHashCode
@ToString
public class ConnectionConfiguration {

    private final String id;
    private final String name;
    private final String description;
    private final String connectionType;
    private final boolean enabled;
    private final boolean autoStart;
    private final ConnectionSettings settings;
    private final List<InputConfiguration> inputs;
    private final List<OutputConfiguration> outputs;
    private final List<String> tags;

    @Builder(toBuilder = true)
    @Jacksonized
    private ConnectionConfiguration(String id, String name, String description, String connectionType,
                                    boolean enabled, boolean autoStart, ConnectionSettings settings,
                                    List<InputConfiguration> inputs, List<OutputConfiguration> outputs,
                                    List<String> tags) {
        this.id = id;
        this.name = name;
        this.description = description;
        this.connectionType = connectionType;
        this.enabled = enabled;
        this.autoStart = autoStart;
        this.settings = settings;
        this.inputs = immutableCopy(inputs);
        this.outputs = immutableCopy(outputs);
        this.tags = immutableCopy(tags);
    }

    public Optional<InputConfiguration> findInput(String inputId) {
        return inputs.stream().filter(input -> input.getId().equals(inputId)).findFirst();
    }

    public Optional<OutputConfiguration> findOutput(String outputId) {
        return outputs.stream().filter(output -> output.getId().equals(outputId)).findFirst();
    }

    private static <T> List<T> immutableCopy(List<T> source) {
        return source == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(source));
    }
}

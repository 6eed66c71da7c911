package com.koni.uns.application.connection;

import com.koni.uns.application.port.ConnectionDescriptor;
import com.koni.uns.domain.model.ConnectionConfiguration;
import com.koni.uns.domain.model.InputConfiguration;
import com.koni.uns.domain.model.OutputConfiguration;
import com.koni.uns.domain.model.ValidationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Registration table of connection types, built from every {@link ConnectionDescriptor} bean.
 * Type lookup is case-insensitive.
 */
@Slf4j
@Component
public class ConnectionRegistry {

    private final Map<String, ConnectionDescriptor> descriptors;

    public ConnectionRegistry(List<ConnectionDescriptor> descriptors) {
        Map<String, ConnectionDescriptor> byType = new LinkedHashMap<>();
        for (ConnectionDescriptor descriptor : descriptors) {
            String key = key(descriptor.getConnectionType());
            if (byType.putIfAbsent(key, descriptor) != null) {
                throw new IllegalStateException("Duplicate connection type registered: " + descriptor.getConnectionType());
            }
        }
        this.descriptors = Collections.unmodifiableMap(byType);
        log.info("Connection registry initialized: types={}", this.descriptors.keySet());
    }

    public Optional<ConnectionDescriptor> find(String connectionType) {
        if (connectionType == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(descriptors.get(key(connectionType)));
    }

    public ConnectionDescriptor require(String connectionType) {
        return find(connectionType)
                .orElseThrow(() -> new IllegalArgumentException("Unsupported connection type: " + connectionType));
    }

    public boolean isSupported(String connectionType) {
        return find(connectionType).isPresent();
    }

    public List<ConnectionDescriptor> getDescriptors() {
        return List.copyOf(descriptors.values());
    }

    /**
     * Validates a configuration against the registered type before any state is changed.
     */
    public ValidationResult validate(ConnectionConfiguration configuration) {
        if (configuration == null) {
            return ValidationResult.failure("Connection configuration cannot be null");
        }
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        if (isBlank(configuration.getId())) {
            errors.add("Connection id is required");
        }
        if (isBlank(configuration.getName())) {
            errors.add("Connection name is required");
        }
        if (isBlank(configuration.getConnectionType())) {
            errors.add("Connection type is required");
        } else {
            Optional<ConnectionDescriptor> descriptor = find(configuration.getConnectionType());
            if (descriptor.isEmpty()) {
                errors.add("Unsupported connection type: " + configuration.getConnectionType());
            } else if (configuration.getSettings() == null) {
                errors.add("Connection settings are required");
            } else if (!descriptor.get().getSettingsType().isInstance(configuration.getSettings())) {
                errors.add("Settings of type " + configuration.getSettings().getClass().getSimpleName()
                        + " do not match connection type " + configuration.getConnectionType());
            } else {
                ValidationResult settingsResult = descriptor.get().validate(configuration.getSettings());
                errors.addAll(settingsResult.getErrors());
                warnings.addAll(settingsResult.getWarnings());
            }
        }

        Set<String> inputIds = new HashSet<>();
        for (InputConfiguration input : configuration.getInputs()) {
            if (isBlank(input.getId())) {
                errors.add("Input id is required");
            } else if (!inputIds.add(input.getId())) {
                errors.add("Duplicate input id: " + input.getId());
            }
        }
        Set<String> outputIds = new HashSet<>();
        for (OutputConfiguration output : configuration.getOutputs()) {
            if (isBlank(output.getId())) {
                errors.add("Output id is required");
            } else if (!outputIds.add(output.getId())) {
                errors.add("Duplicate output id: " + output.getId());
            }
        }
        return new ValidationResult(errors, warnings);
    }

    private static String key(String connectionType) {
        return connectionType.trim().toLowerCase(Locale.ROOT);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

package com.koni.uns.infrastructure.config;

import com.fasterxml.jackson.databind.jsontype.NamedType;
import com.koni.uns.application.port.ConnectionDescriptor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Registers the settings variant of every connection type with Jackson, keyed by the
 * connection type string, so that {@code "type": "simulated"} selects the simulated settings class.
 */
@Slf4j
@Configuration
public class ConnectionSettingsJacksonConfiguration {

    @Bean
    public Jackson2ObjectMapperBuilderCustomizer connectionSettingsTypes(List<ConnectionDescriptor> descriptors) {
        return builder -> builder.postConfigurer(objectMapper -> {
            for (ConnectionDescriptor descriptor : descriptors) {
                objectMapper.registerSubtypes(new NamedType(descriptor.getSettingsType(), descriptor.getConnectionType()));
                log.debug("Registered connection settings type: type={}, settings={}",
                        descriptor.getConnectionType(), descriptor.getSettingsType().getSimpleName());
            }
        });
    }
}

package com.koni.uns.infrastructure.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.koni.uns.application.connection.ConnectionManager;
import com.koni.uns.domain.exception.ValidationException;
import com.koni.uns.domain.model.ConnectionConfiguration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Brings connections up once the application is ready.
 *
 * Connections listed in {@code uns.bootstrap.connections-file} are created when their id is not
 * managed yet; then every stored configuration is restored and the enabled, auto-start ones are started.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConnectionBootstrapper {

    private final ConnectionManager connectionManager;
    private final UnsProperties properties;
    private final ObjectMapper objectMapper;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        int seeded = seedConnections();
        int restored = connectionManager.restoreConnections();
        log.info("Connection bootstrap finished: seeded={}, restored={}, active={}",
                seeded, restored, connectionManager.getActiveConnectionIds());
    }

    int seedConnections() {
        Resource file = properties.getBootstrap().getConnectionsFile();
        if (file == null) {
            return 0;
        }
        if (!file.exists()) {
            log.warn("Connections file not found, nothing to seed: file={}", file.getDescription());
            return 0;
        }

        List<ConnectionConfiguration> configurations;
        try (InputStream input = file.getInputStream()) {
            configurations = objectMapper.readValue(input, new TypeReference<List<ConnectionConfiguration>>() { });
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read connections file " + file.getDescription(), e);
        }

        int seeded = 0;
        for (ConnectionConfiguration configuration : configurations) {
            if (connectionManager.getConnectionConfiguration(configuration.getId()).isPresent()) {
                continue;
            }
            try {
                connectionManager.createConnection(configuration);
                seeded++;
            } catch (ValidationException e) {
                log.error("Skipping invalid seeded connection: id={}, error={}", configuration.getId(), e.getMessage());
            }
        }
        return seeded;
    }
}

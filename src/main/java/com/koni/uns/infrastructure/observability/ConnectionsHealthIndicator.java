package com.koni.uns.infrastructure.observability;

import com.koni.uns.application.connection.ConnectionManager;
import com.koni.uns.domain.model.ConnectionConfiguration;
import com.koni.uns.domain.model.ConnectionStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Health indicator for managed connections.
 *
 * Reports the status of every connection. The indicator is DOWN only when at least one
 * connection is enabled and every enabled connection is in Error; a single failing
 * connection among healthy ones does not take the service down.
 */
@Slf4j
@Component("connections")
@RequiredArgsConstructor
public class ConnectionsHealthIndicator implements HealthIndicator {

    private final ConnectionManager connectionManager;

    @Override
    public Health health() {
        Map<String, ConnectionStatus> states = connectionManager.getConnectionStates();
        List<String> enabled = connectionManager.getAllConfigurations().stream()
                .filter(ConnectionConfiguration::isEnabled)
                .map(ConnectionConfiguration::getId)
                .collect(Collectors.toList());
        long failed = enabled.stream()
                .filter(id -> states.get(id) == ConnectionStatus.ERROR)
                .count();

        Map<String, Object> details = new LinkedHashMap<>();
        states.forEach((id, status) -> details.put(id, status.name()));

        Health.Builder builder = !enabled.isEmpty() && failed == enabled.size() ? Health.down() : Health.up();
        if (failed > 0) {
            log.debug("Connections in error: failed={}, enabled={}", failed, enabled.size());
        }
        return builder
                .withDetail("enabled", enabled.size())
                .withDetail("failed", failed)
                .withDetail("connections", details)
                .build();
    }
}

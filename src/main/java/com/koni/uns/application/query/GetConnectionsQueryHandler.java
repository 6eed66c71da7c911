package com.koni.uns.application.query;

import com.koni.uns.application.connection.ConnectionManager;
import com.koni.uns.domain.exception.NotFoundException;
import com.koni.uns.domain.model.ConnectionConfiguration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class GetConnectionsQueryHandler {

    private final ConnectionManager connectionManager;

    public List<ConnectionResponse> handle(GetConnectionsQuery query) {
        log.debug("Handling GetConnectionsQuery");
        List<ConnectionResponse> connections = connectionManager.getAllConfigurations().stream()
                .map(this::toResponse)
                .collect(Collectors.toList());
        log.info("Retrieved {} connections", connections.size());
        return connections;
    }

    /**
     * @throws NotFoundException if the connection does not exist
     */
    public ConnectionResponse handleSingle(String connectionId) {
        return connectionManager.getConnectionConfiguration(connectionId)
                .map(this::toResponse)
                .orElseThrow(() -> new NotFoundException("Connection not found: " + connectionId));
    }

    private ConnectionResponse toResponse(ConnectionConfiguration configuration) {
        String id = configuration.getId();
        return new ConnectionResponse(
                id,
                configuration.getName(),
                configuration.getDescription(),
                configuration.getConnectionType(),
                configuration.isEnabled(),
                configuration.isAutoStart(),
                connectionManager.getConnectionStatus(id),
                connectionManager.getStatusMessage(id).orElse(null),
                configuration.getSettings(),
                configuration.getInputs(),
                configuration.getOutputs(),
                configuration.getTags());
    }
}

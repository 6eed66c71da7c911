package com.koni.uns.infrastructure.web.controller;

import com.koni.uns.application.connection.ConnectionManager;
import com.koni.uns.application.connection.ConnectionRegistry;
import com.koni.uns.application.query.ConnectionResponse;
import com.koni.uns.application.query.GetConnectionsQuery;
import com.koni.uns.application.query.GetConnectionsQueryHandler;
import com.koni.uns.domain.exception.NotFoundException;
import com.koni.uns.domain.exception.ValidationException;
import com.koni.uns.domain.model.ConnectionConfiguration;
import com.koni.uns.domain.model.ConnectionSettings;
import com.koni.uns.domain.model.DataPoint;
import com.koni.uns.infrastructure.web.dto.ConnectionRequest;
import com.koni.uns.infrastructure.web.dto.SendDataRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for connection administration.
 *
 * Endpoints:
 * - GET    /api/v1/connections: list connections with their status
 * - GET    /api/v1/connections/{id}: get one connection
 * - POST   /api/v1/connections: create a connection (201)
 * - PUT    /api/v1/connections/{id}: update a connection
 * - DELETE /api/v1/connections/{id}: stop and remove a connection
 * - POST   /api/v1/connections/{id}/start and /stop
 * - GET    /api/v1/connections/{id}/status
 * - POST   /api/v1/connections/{id}/send: send a value through an output
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class ConnectionController {

    private final ConnectionManager connectionManager;
    private final ConnectionRegistry connectionRegistry;
    private final GetConnectionsQueryHandler queryHandler;

    @GetMapping("/v1/connections")
    public ResponseEntity<List<ConnectionResponse>> getConnections() {
        log.info("Received request to get all connections");
        return ResponseEntity.ok(queryHandler.handle(new GetConnectionsQuery()));
    }

    @GetMapping("/v1/connections/{id}")
    public ResponseEntity<ConnectionResponse> getConnection(@PathVariable String id) {
        log.info("Received request to get connection: id={}", id);
        return ResponseEntity.ok(queryHandler.handleSingle(id));
    }

    /**
     * Creates a connection. Enabled connections with auto-start are started right away;
     * a failed start leaves the connection in Error but still created.
     *
     * @return 201 Created with the connection and its status
     */
    @PostMapping("/v1/connections")
    public ResponseEntity<ConnectionResponse> createConnection(@RequestBody @Valid ConnectionRequest request) {
        log.info("Received request to create connection: id={}, type={}", request.getId(), request.getConnectionType());
        connectionManager.createConnection(toConfiguration(request, request.getId()));
        return ResponseEntity.status(HttpStatus.CREATED).body(queryHandler.handleSingle(request.getId()));
    }

    @PutMapping("/v1/connections/{id}")
    public ResponseEntity<ConnectionResponse> updateConnection(@PathVariable String id,
                                                               @RequestBody @Valid ConnectionRequest request) {
        log.info("Received request to update connection: id={}", id);
        if (!id.equals(request.getId())) {
            throw new ValidationException("Connection id in path and body differ: " + id + " vs " + request.getId());
        }
        connectionManager.updateConnection(toConfiguration(request, id));
        return ResponseEntity.ok(queryHandler.handleSingle(id));
    }

    @DeleteMapping("/v1/connections/{id}")
    public ResponseEntity<Void> deleteConnection(@PathVariable String id) {
        log.info("Received request to delete connection: id={}", id);
        connectionManager.removeConnection(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/v1/connections/{id}/start")
    public ResponseEntity<Map<String, Object>> startConnection(@PathVariable String id) {
        log.info("Received request to start connection: id={}", id);
        boolean started = connectionManager.startConnection(id);
        return ResponseEntity.ok(statusBody(id, started));
    }

    @PostMapping("/v1/connections/{id}/stop")
    public ResponseEntity<Map<String, Object>> stopConnection(@PathVariable String id) {
        log.info("Received request to stop connection: id={}", id);
        boolean stopped = connectionManager.stopConnection(id);
        return ResponseEntity.ok(statusBody(id, stopped));
    }

    @GetMapping("/v1/connections/{id}/status")
    public ResponseEntity<Map<String, Object>> getStatus(@PathVariable String id) {
        if (connectionManager.getConnectionConfiguration(id).isEmpty()) {
            throw new NotFoundException("Connection not found: " + id);
        }
        return ResponseEntity.ok(statusBody(id, null));
    }

    /**
     * Sends a value out through the connection.
     *
     * @return 202 Accepted when the connection took the value, 409 when it is not connected,
     *         502 when the connection refused it
     */
    @PostMapping("/v1/connections/{id}/send")
    public ResponseEntity<Map<String, Object>> sendData(@PathVariable String id,
                                                        @RequestBody @Valid SendDataRequest request) {
        log.info("Received request to send data: id={}, topic={}, outputId={}", id, request.getTopic(), request.getOutputId());
        DataPoint dataPoint = DataPoint.builder()
                .topic(request.getTopic())
                .value(request.getValue())
                .quality(request.getQuality())
                .sourceSystem("api")
                .build();
        boolean sent = connectionManager.sendData(id, dataPoint, request.getOutputId());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("connectionId", id);
        body.put("sent", sent);
        return ResponseEntity.status(sent ? HttpStatus.ACCEPTED : HttpStatus.BAD_GATEWAY).body(body);
    }

    private ConnectionConfiguration toConfiguration(ConnectionRequest request, String id) {
        ConnectionSettings settings = request.getSettings();
        if (settings == null && request.getConnectionType() != null) {
            settings = connectionRegistry.find(request.getConnectionType())
                    .map(descriptor -> descriptor.createDefaultSettings())
                    .orElse(null);
        }
        return ConnectionConfiguration.builder()
                .id(id)
                .name(request.getName())
                .description(request.getDescription())
                .connectionType(request.getConnectionType())
                .enabled(request.isEnabled())
                .autoStart(request.isAutoStart())
                .settings(settings)
                .inputs(request.getInputs())
                .outputs(request.getOutputs())
                .tags(request.getTags())
                .build();
    }

    private Map<String, Object> statusBody(String id, Boolean result) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("connectionId", id);
        if (result != null) {
            body.put("success", result);
        }
        body.put("status", connectionManager.getConnectionStatus(id));
        body.put("message", connectionManager.getStatusMessage(id).orElse(null));
        return body;
    }
}

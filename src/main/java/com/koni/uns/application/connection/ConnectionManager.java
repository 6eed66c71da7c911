package com.koni.uns.application.connection;

import com.koni.uns.application.port.ConnectionListener;
import com.koni.uns.application.port.DataConnection;
import com.koni.uns.application.port.EventBus;
import com.koni.uns.domain.event.ConnectionStatusChanged;
import com.koni.uns.domain.exception.NotConnectedException;
import com.koni.uns.domain.exception.NotFoundException;
import com.koni.uns.domain.exception.ValidationException;
import com.koni.uns.domain.model.ConnectionConfiguration;
import com.koni.uns.domain.model.ConnectionStatus;
import com.koni.uns.domain.model.DataPoint;
import com.koni.uns.domain.model.DataQuality;
import com.koni.uns.domain.model.InputConfiguration;
import com.koni.uns.domain.model.OutputConfiguration;
import com.koni.uns.domain.model.ValidationResult;
import com.koni.uns.domain.repository.ConnectionConfigurationRepository;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Owns the lifecycle of all configured connections and merges their data and status streams.
 *
 * Responsibilities:
 * - Validate configurations against the {@link ConnectionRegistry} before any state change
 * - Start, stop, update and remove connections; lifecycle operations on different connections
 *   run concurrently, operations on the same connection are serialized
 * - Run every connector call on a dedicated executor with a timeout, so a hanging connector
 *   never blocks the caller and is left in Error
 * - Fan the data of all connections in to the registered {@link ConnectionEventListener}s and
 *   publish every status change as {@link ConnectionStatusChanged}
 *
 * Connector failures never propagate out of this class as exceptions other than the
 * documented ValidationException, NotFoundException and NotConnectedException.
 */
@Slf4j
@Service
public class ConnectionManager {

    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    private final ConnectionRegistry registry;
    private final ConnectionConfigurationRepository repository;
    private final EventBus eventBus;
    private final long operationTimeoutMs;
    private final ExecutorService lifecycleExecutor;
    private final Map<String, ConnectionHandle> handles = new ConcurrentHashMap<>();
    private final ReentrantLock structureLock = new ReentrantLock();
    private final List<ConnectionEventListener> listeners = new CopyOnWriteArrayList<>();

    public ConnectionManager(ConnectionRegistry registry,
                             ConnectionConfigurationRepository repository,
                             EventBus eventBus,
                             List<ConnectionEventListener> listeners,
                             @Value("${uns.connection-manager.operation-timeout-ms:30000}") long operationTimeoutMs) {
        this.registry = registry;
        this.repository = repository;
        this.eventBus = eventBus;
        this.operationTimeoutMs = operationTimeoutMs;
        this.listeners.addAll(listeners);
        this.lifecycleExecutor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "connection-lifecycle-" + THREAD_COUNTER.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public void addListener(ConnectionEventListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("Listener cannot be null");
        }
        listeners.add(listener);
    }

    public void removeListener(ConnectionEventListener listener) {
        listeners.remove(listener);
    }

    /**
     * Registers a new connection and starts it when it is enabled and set to auto-start.
     *
     * @throws ValidationException if the configuration is invalid or the id is already used
     */
    public ConnectionConfiguration createConnection(ConnectionConfiguration configuration) {
        requireValid(configuration);

        structureLock.lock();
        try {
            if (handles.containsKey(configuration.getId())) {
                throw new ValidationException("Connection already exists: " + configuration.getId());
            }
            repository.save(configuration);
            handles.put(configuration.getId(), new ConnectionHandle(configuration));
        } finally {
            structureLock.unlock();
        }
        log.info("Connection created: id={}, type={}, enabled={}, autoStart={}", configuration.getId(),
                configuration.getConnectionType(), configuration.isEnabled(), configuration.isAutoStart());

        if (configuration.isEnabled() && configuration.isAutoStart()) {
            startConnection(configuration.getId());
        }
        return configuration;
    }

    /**
     * Starts a connection. Starting a connected connection is a no-op.
     *
     * @return true if the connection is connected afterwards; false if it is disabled or failed to start
     * @throws NotFoundException if the id is unknown
     */
    public boolean startConnection(String connectionId) {
        ConnectionHandle handle = requireHandle(connectionId);
        handle.getLifecycleLock().lock();
        try {
            ensureNotRemoved(handle);
            if (handle.getStatus() == ConnectionStatus.CONNECTED) {
                return true;
            }
            if (!handle.getConfiguration().isEnabled()) {
                log.info("Connection is disabled, not starting: id={}", connectionId);
                return false;
            }
            if (handle.getConnection() != null) {
                stopInternal(handle);
            }
            return startInternal(handle);
        } finally {
            handle.getLifecycleLock().unlock();
        }
    }

    /**
     * Stops a connection and releases its connector instance. Stopping a stopped connection is a no-op.
     *
     * @return true if the connector stopped cleanly; false if it failed or timed out (status Error)
     * @throws NotFoundException if the id is unknown
     */
    public boolean stopConnection(String connectionId) {
        ConnectionHandle handle = requireHandle(connectionId);
        handle.getLifecycleLock().lock();
        try {
            ensureNotRemoved(handle);
            return stopInternal(handle);
        } finally {
            handle.getLifecycleLock().unlock();
        }
    }

    /**
     * Stops and forgets a connection.
     *
     * @throws NotFoundException if the id is unknown
     */
    public void removeConnection(String connectionId) {
        ConnectionHandle handle = requireHandle(connectionId);
        handle.getLifecycleLock().lock();
        try {
            ensureNotRemoved(handle);
            stopInternal(handle);
            handle.markRemoved();
            structureLock.lock();
            try {
                handles.remove(connectionId);
            } finally {
                structureLock.unlock();
            }
            repository.delete(connectionId);
        } finally {
            handle.getLifecycleLock().unlock();
        }
        log.info("Connection removed: id={}", connectionId);
    }

    /**
     * Replaces the configuration of a connection.
     *
     * A settings change restarts a running connection. Otherwise in-flight sends are drained
     * and only the changed inputs and outputs are re-applied.
     *
     * @throws NotFoundException if the id is unknown
     * @throws ValidationException if the configuration is invalid or changes the connection type
     */
    public ConnectionConfiguration updateConnection(ConnectionConfiguration configuration) {
        requireValid(configuration);
        ConnectionHandle handle = requireHandle(configuration.getId());

        handle.getLifecycleLock().lock();
        try {
            ensureNotRemoved(handle);
            ConnectionConfiguration previous = handle.getConfiguration();
            if (!previous.getConnectionType().equalsIgnoreCase(configuration.getConnectionType())) {
                throw new ValidationException("Connection type of " + configuration.getId() + " cannot be changed");
            }
            repository.save(configuration);

            if (handle.getConnection() == null) {
                handle.setConfiguration(configuration);
            } else if (!configuration.isEnabled()) {
                handle.setConfiguration(configuration);
                stopInternal(handle);
            } else if (!Objects.equals(previous.getSettings(), configuration.getSettings())) {
                log.info("Connection settings changed, restarting: id={}", configuration.getId());
                handle.setConfiguration(configuration);
                stopInternal(handle);
                startInternal(handle);
            } else {
                reconfigureInternal(handle, previous, configuration);
            }
        } finally {
            handle.getLifecycleLock().unlock();
        }
        log.info("Connection updated: id={}", configuration.getId());
        return configuration;
    }

    /**
     * Sends a value through a connected connection.
     *
     * @param outputId target output, or null for the connector's default output
     * @return true if the connector accepted the value; false if the connector failed or timed out
     * @throws NotFoundException if the id is unknown
     * @throws NotConnectedException if the connection is not connected
     * @throws ValidationException if the output is not configured
     */
    public boolean sendData(String connectionId, DataPoint dataPoint, String outputId) {
        if (dataPoint == null) {
            throw new ValidationException("Data point cannot be null");
        }
        ConnectionHandle handle = requireHandle(connectionId);
        if (handle.getStatus() != ConnectionStatus.CONNECTED) {
            throw new NotConnectedException("Connection " + connectionId + " is not connected: " + handle.getStatus());
        }
        if (outputId != null && handle.getConfiguration().findOutput(outputId).isEmpty()) {
            throw new ValidationException("Unknown output " + outputId + " on connection " + connectionId);
        }

        handle.getIoLock().readLock().lock();
        try {
            DataConnection connection = handle.getConnection();
            if (connection == null || handle.getStatus() != ConnectionStatus.CONNECTED) {
                throw new NotConnectedException("Connection " + connectionId + " is not connected: " + handle.getStatus());
            }
            return Boolean.TRUE.equals(callWithTimeout("send on " + connectionId,
                    () -> connection.sendData(dataPoint, outputId)));
        } catch (ConnectionOperationException e) {
            log.warn("Send failed: id={}, topic={}, error={}", connectionId, dataPoint.getTopic(), e.getMessage());
            return false;
        } finally {
            handle.getIoLock().readLock().unlock();
        }
    }

    /**
     * Loads all stored configurations not yet managed and starts the enabled, auto-start ones.
     *
     * @return number of connections restored
     */
    public int restoreConnections() {
        List<ConnectionConfiguration> restored = new ArrayList<>();
        structureLock.lock();
        try {
            for (ConnectionConfiguration configuration : repository.findAll()) {
                if (handles.containsKey(configuration.getId())) {
                    continue;
                }
                ValidationResult result = registry.validate(configuration);
                if (!result.isValid()) {
                    log.warn("Skipping invalid stored connection: id={}, errors={}",
                            configuration.getId(), result.getErrorMessage());
                    continue;
                }
                handles.put(configuration.getId(), new ConnectionHandle(configuration));
                restored.add(configuration);
            }
        } finally {
            structureLock.unlock();
        }

        for (ConnectionConfiguration configuration : restored) {
            if (configuration.isEnabled() && configuration.isAutoStart()) {
                startConnection(configuration.getId());
            }
        }
        log.info("Connections restored: count={}", restored.size());
        return restored.size();
    }

    public List<String> getActiveConnectionIds() {
        return handles.values().stream()
                .filter(handle -> handle.getStatus().isActive())
                .map(ConnectionHandle::getId)
                .sorted()
                .collect(Collectors.toList());
    }

    public Optional<ConnectionConfiguration> getConnectionConfiguration(String connectionId) {
        ConnectionHandle handle = connectionId == null ? null : handles.get(connectionId);
        return handle == null ? Optional.empty() : Optional.of(handle.getConfiguration());
    }

    public List<ConnectionConfiguration> getAllConfigurations() {
        return handles.values().stream()
                .map(ConnectionHandle::getConfiguration)
                .sorted(Comparator.comparing(ConnectionConfiguration::getId))
                .collect(Collectors.toList());
    }

    /**
     * @return the current status, or UNKNOWN for an unknown id
     */
    public ConnectionStatus getConnectionStatus(String connectionId) {
        ConnectionHandle handle = connectionId == null ? null : handles.get(connectionId);
        return handle == null ? ConnectionStatus.UNKNOWN : handle.getStatus();
    }

    public Optional<String> getStatusMessage(String connectionId) {
        ConnectionHandle handle = connectionId == null ? null : handles.get(connectionId);
        return handle == null ? Optional.empty() : Optional.ofNullable(handle.getStatusMessage());
    }

    /**
     * @return a snapshot of id to status for every managed connection, ordered by id
     */
    public Map<String, ConnectionStatus> getConnectionStates() {
        return handles.values().stream()
                .sorted(Comparator.comparing(ConnectionHandle::getId))
                .collect(Collectors.toMap(ConnectionHandle::getId, ConnectionHandle::getStatus,
                        (a, b) -> a, LinkedHashMap::new));
    }

    @PreDestroy
    public void shutdown() {
        log.info("Stopping all connections: count={}", handles.size());
        for (ConnectionHandle handle : handles.values()) {
            handle.getLifecycleLock().lock();
            try {
                stopInternal(handle);
            } finally {
                handle.getLifecycleLock().unlock();
            }
        }
        lifecycleExecutor.shutdownNow();
    }

    private boolean startInternal(ConnectionHandle handle) {
        ConnectionConfiguration configuration = handle.getConfiguration();
        transition(handle, ConnectionStatus.CONNECTING, null);
        try {
            DataConnection connection = registry.require(configuration.getConnectionType()).create(handle.getId());
            ConnectionListener listener = new HandleListener(handle, connection, configuration.getConnectionType());
            connection.addListener(listener);
            handle.setConnection(connection);
            handle.setConnectionListener(listener);

            boolean started = Boolean.TRUE.equals(callWithTimeout("start of " + handle.getId(), () -> {
                connection.initialize(configuration.getSettings());
                for (InputConfiguration input : configuration.getInputs()) {
                    if (input.isEnabled()) {
                        connection.configureInput(input);
                    }
                }
                for (OutputConfiguration output : configuration.getOutputs()) {
                    if (output.isEnabled()) {
                        connection.configureOutput(output);
                    }
                }
                return connection.start();
            }));
            if (started) {
                transition(handle, ConnectionStatus.CONNECTED, null);
                if (handle.getStatus() != ConnectionStatus.CONNECTED) {
                    // the connector reported a newer status while starting
                    log.warn("Connection not connected after start: id={}, status={}, message={}",
                            handle.getId(), handle.getStatus(), handle.getStatusMessage());
                    return false;
                }
                log.info("Connection started: id={}, type={}", handle.getId(), configuration.getConnectionType());
                return true;
            }
            failStart(handle, "Connector did not start");
        } catch (RuntimeException e) {
            failStart(handle, e.getMessage());
        }
        return false;
    }

    private void failStart(ConnectionHandle handle, String message) {
        log.warn("Connection failed to start: id={}, error={}", handle.getId(), message);
        transition(handle, ConnectionStatus.ERROR, message);
        DataConnection connection = handle.getConnection();
        if (connection != null) {
            detach(handle, connection);
            // a connector that ignored cancellation must not hold the caller
            runQuietly(() -> lifecycleExecutor.execute(() -> closeQuietly(handle.getId(), connection)));
        }
    }

    private boolean stopInternal(ConnectionHandle handle) {
        DataConnection connection = handle.getConnection();
        if (connection == null) {
            transition(handle, ConnectionStatus.DISABLED, null);
            return true;
        }

        transition(handle, ConnectionStatus.STOPPING, null);
        String failure = null;
        handle.getIoLock().writeLock().lock();
        try {
            callWithTimeout("stop of " + handle.getId(), () -> {
                connection.stop();
                return null;
            });
        } catch (RuntimeException e) {
            failure = e.getMessage();
        } finally {
            detach(handle, connection);
            handle.getIoLock().writeLock().unlock();
        }
        closeQuietly(handle.getId(), connection);

        if (failure != null) {
            log.warn("Connection failed to stop cleanly: id={}, error={}", handle.getId(), failure);
            transition(handle, ConnectionStatus.ERROR, failure);
            return false;
        }
        transition(handle, ConnectionStatus.DISABLED, null);
        log.info("Connection stopped: id={}", handle.getId());
        return true;
    }

    private void reconfigureInternal(ConnectionHandle handle, ConnectionConfiguration previous,
                                     ConnectionConfiguration next) {
        handle.getIoLock().writeLock().lock();
        try {
            handle.setConfiguration(next);
            DataConnection connection = handle.getConnection();
            callWithTimeout("reconfiguration of " + handle.getId(), () -> {
                applyDiff(previous.getInputs(), next.getInputs(), InputConfiguration::getId,
                        InputConfiguration::isEnabled, connection::configureInput, connection::removeInput);
                applyDiff(previous.getOutputs(), next.getOutputs(), OutputConfiguration::getId,
                        OutputConfiguration::isEnabled, connection::configureOutput, connection::removeOutput);
                return null;
            });
        } catch (RuntimeException e) {
            log.warn("Connection reconfiguration failed: id={}, error={}", handle.getId(), e.getMessage());
            transition(handle, ConnectionStatus.ERROR, e.getMessage());
        } finally {
            handle.getIoLock().writeLock().unlock();
        }
    }

    private static <T> void applyDiff(List<T> previous, List<T> next, Function<T, String> id,
                                      Function<T, Boolean> enabled, Function<T, Boolean> configure,
                                      Function<String, Boolean> remove) {
        Map<String, T> before = previous.stream().collect(Collectors.toMap(id, item -> item));
        Map<String, T> after = next.stream().collect(Collectors.toMap(id, item -> item));
        for (String removedId : before.keySet()) {
            if (!after.containsKey(removedId) && enabled.apply(before.get(removedId))) {
                remove.apply(removedId);
            }
        }
        for (T item : next) {
            T old = before.get(id.apply(item));
            if (item.equals(old)) {
                continue;
            }
            if (enabled.apply(item)) {
                configure.apply(item);
            } else if (old != null && enabled.apply(old)) {
                remove.apply(id.apply(item));
            }
        }
    }

    private void detach(ConnectionHandle handle, DataConnection connection) {
        ConnectionListener listener = handle.getConnectionListener();
        if (listener != null) {
            runQuietly(() -> connection.removeListener(listener));
        }
        handle.setConnection(null);
        handle.setConnectionListener(null);
    }

    private void closeQuietly(String connectionId, DataConnection connection) {
        try {
            connection.close();
        } catch (RuntimeException e) {
            log.warn("Failed to close connector: id={}, error={}", connectionId, e.getMessage());
        }
    }

    private void runQuietly(Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            log.warn("Connector cleanup step failed: error={}", e.getMessage());
        }
    }

    private void transition(ConnectionHandle handle, ConnectionStatus newStatus, String message) {
        ConnectionStatus previous = handle.changeStatus(newStatus, message);
        if (previous == null) {
            if (handle.getStatus() != newStatus) {
                log.warn("Rejected status transition: id={}, from={}, to={}", handle.getId(), handle.getStatus(), newStatus);
            }
            return;
        }
        log.debug("Connection status changed: id={}, from={}, to={}, message={}",
                handle.getId(), previous, newStatus, message);
        eventBus.publish(new ConnectionStatusChanged(handle.getId(), previous, newStatus, message));
        for (ConnectionEventListener listener : listeners) {
            try {
                listener.onStatusChanged(handle.getId(), previous, newStatus, message);
            } catch (RuntimeException e) {
                log.error("Connection listener failed on status change: id={}, error={}",
                        handle.getId(), e.getMessage(), e);
            }
        }
    }

    private <T> T callWithTimeout(String operation, Callable<T> call) {
        Future<T> future;
        try {
            future = lifecycleExecutor.submit(call);
        } catch (RejectedExecutionException e) {
            throw new ConnectionOperationException(operation + " rejected, manager is shutting down", e);
        }
        try {
            return future.get(operationTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ConnectionOperationException(operation + " timed out after " + operationTimeoutMs + "ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ConnectionOperationException(operation + " was interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new ConnectionOperationException(operation + " failed: " + cause.getMessage(), cause);
        }
    }

    private void requireValid(ConnectionConfiguration configuration) {
        ValidationResult result = registry.validate(configuration);
        if (!result.isValid()) {
            throw new ValidationException("Invalid connection configuration: " + result.getErrorMessage());
        }
    }

    private ConnectionHandle requireHandle(String connectionId) {
        ConnectionHandle handle = connectionId == null ? null : handles.get(connectionId);
        if (handle == null) {
            throw new NotFoundException("Connection not found: " + connectionId);
        }
        return handle;
    }

    private static void ensureNotRemoved(ConnectionHandle handle) {
        if (handle.isRemoved()) {
            throw new NotFoundException("Connection not found: " + handle.getId());
        }
    }

    /**
     * Adapts the listener of one connector instance to the manager-level listeners.
     * Events of an instance that was already replaced or released are ignored.
     */
    private final class HandleListener implements ConnectionListener {

        private final ConnectionHandle handle;
        private final DataConnection connection;
        private final String connectionType;

        private HandleListener(ConnectionHandle handle, DataConnection connection, String connectionType) {
            this.handle = handle;
            this.connection = connection;
            this.connectionType = connectionType;
        }

        @Override
        public void onDataReceived(String topic, Object value, Instant timestamp, DataQuality quality,
                                   Map<String, Object> metadata) {
            if (handle.getConnection() != connection) {
                return;
            }
            DataPoint dataPoint;
            try {
                dataPoint = DataPoint.builder()
                        .topic(topic)
                        .value(value)
                        .timestamp(timestamp)
                        .quality(quality)
                        .sourceSystem(connectionType)
                        .metadata(metadata)
                        .build();
            } catch (IllegalArgumentException e) {
                log.warn("Dropping malformed value from connector: id={}, error={}", handle.getId(), e.getMessage());
                return;
            }
            for (ConnectionEventListener listener : listeners) {
                try {
                    listener.onDataReceived(handle.getId(), dataPoint);
                } catch (RuntimeException e) {
                    log.error("Connection listener failed on data: id={}, topic={}, error={}",
                            handle.getId(), topic, e.getMessage(), e);
                }
            }
        }

        @Override
        public void onStatusChanged(ConnectionStatus oldStatus, ConnectionStatus newStatus, String message) {
            if (handle.getConnection() != connection) {
                return;
            }
            ConnectionStatus current = handle.getStatus();
            if (current == ConnectionStatus.STOPPING || current == ConnectionStatus.DISABLED) {
                return;
            }
            transition(handle, newStatus, message);
        }
    }

    private static final class ConnectionOperationException extends RuntimeException {

        private ConnectionOperationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}

package com.koni.uns.infrastructure.connection;

import com.koni.uns.application.port.ConnectionListener;
import com.koni.uns.application.port.DataConnection;
import com.koni.uns.domain.model.ConnectionSettings;
import com.koni.uns.domain.model.ConnectionStatus;
import com.koni.uns.domain.model.DataPoint;
import com.koni.uns.domain.model.DataQuality;
import com.koni.uns.domain.model.InputConfiguration;
import com.koni.uns.domain.model.OutputConfiguration;
import com.koni.uns.domain.model.ValidationResult;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Connection that produces values itself instead of talking to a device.
 *
 * Every configured topic receives a random value in [valueMin, valueMax] per publish interval.
 * When enabled inputs exist, only topics matching one of their MQTT-style filters are emitted.
 * Values sent through an output are looped back as received values under the output's topic prefix.
 */
@Slf4j
public class SimulatedConnection implements DataConnection {

    private final String connectionId;
    private final List<ConnectionListener> listeners = new CopyOnWriteArrayList<>();
    private final Map<String, InputConfiguration> inputs = new ConcurrentHashMap<>();
    private final Map<String, OutputConfiguration> outputs = new ConcurrentHashMap<>();

    private volatile SimulatedConnectionSettings settings;
    private volatile ConnectionStatus status = ConnectionStatus.DISABLED;
    private ScheduledExecutorService scheduler;

    public SimulatedConnection(String connectionId) {
        this.connectionId = connectionId;
    }

    @Override
    public String getConnectionId() {
        return connectionId;
    }

    @Override
    public ConnectionStatus getStatus() {
        return status;
    }

    @Override
    public void initialize(ConnectionSettings settings) {
        if (!(settings instanceof SimulatedConnectionSettings)) {
            throw new IllegalArgumentException("Expected simulated settings but got "
                    + (settings == null ? "null" : settings.getClass().getSimpleName()));
        }
        this.settings = (SimulatedConnectionSettings) settings;
    }

    @Override
    public synchronized boolean start() {
        if (settings == null) {
            log.warn("Simulated connection not initialized: id={}", connectionId);
            return false;
        }
        if (status == ConnectionStatus.CONNECTED) {
            return true;
        }
        changeStatus(ConnectionStatus.CONNECTING, null);
        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "simulated-" + connectionId);
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleAtFixedRate(this::emit, 0, settings.getPublishIntervalMs(), TimeUnit.MILLISECONDS);
        changeStatus(ConnectionStatus.CONNECTED, null);
        log.info("Simulated connection started: id={}, topics={}, intervalMs={}",
                connectionId, settings.getTopics().size(), settings.getPublishIntervalMs());
        return true;
    }

    @Override
    public synchronized void stop() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
        if (status != ConnectionStatus.DISABLED) {
            changeStatus(ConnectionStatus.DISCONNECTED, "stopped");
        }
    }

    @Override
    public boolean configureInput(InputConfiguration input) {
        inputs.put(input.getId(), input);
        return true;
    }

    @Override
    public boolean configureOutput(OutputConfiguration output) {
        outputs.put(output.getId(), output);
        return true;
    }

    @Override
    public boolean removeInput(String inputId) {
        return inputs.remove(inputId) != null;
    }

    @Override
    public boolean removeOutput(String outputId) {
        return outputs.remove(outputId) != null;
    }

    @Override
    public boolean sendData(DataPoint dataPoint, String outputId) {
        if (status != ConnectionStatus.CONNECTED) {
            return false;
        }
        Optional<OutputConfiguration> output = outputId == null
                ? outputs.values().stream().filter(OutputConfiguration::isEnabled).findFirst()
                : Optional.ofNullable(outputs.get(outputId));
        String prefix = output.map(OutputConfiguration::getTopicPrefix).orElse(null);
        String topic = prefix == null || prefix.isBlank() ? dataPoint.getTopic() : prefix + "/" + dataPoint.getTopic();
        notifyData(topic, dataPoint.getValue(), dataPoint.getQuality(), Map.of("loopback", true));
        return true;
    }

    @Override
    public ValidationResult validateConfiguration(ConnectionSettings settings) {
        if (!(settings instanceof SimulatedConnectionSettings)) {
            return ValidationResult.failure("Settings are not simulated connection settings");
        }
        return ((SimulatedConnectionSettings) settings).validate();
    }

    @Override
    public void addListener(ConnectionListener listener) {
        listeners.add(listener);
    }

    @Override
    public void removeListener(ConnectionListener listener) {
        listeners.remove(listener);
    }

    @Override
    public void close() {
        stop();
        listeners.clear();
    }

    private void emit() {
        SimulatedConnectionSettings current = settings;
        List<String> filters = inputs.values().stream()
                .filter(InputConfiguration::isEnabled)
                .map(InputConfiguration::getTopicFilter)
                .collect(Collectors.toList());
        for (String topic : current.getTopics()) {
            if (!filters.isEmpty() && filters.stream().noneMatch(filter -> matchesFilter(filter, topic))) {
                continue;
            }
            double value = current.getValueMin()
                    + ThreadLocalRandom.current().nextDouble() * (current.getValueMax() - current.getValueMin());
            notifyData(topic, Math.round(value * 100.0) / 100.0, DataQuality.GOOD, Map.of());
        }
    }

    private void notifyData(String topic, Object value, DataQuality quality, Map<String, Object> metadata) {
        Instant now = Instant.now();
        for (ConnectionListener listener : listeners) {
            try {
                listener.onDataReceived(topic, value, now, quality, metadata);
            } catch (RuntimeException e) {
                log.warn("Listener failed on simulated value: id={}, topic={}, error={}",
                        connectionId, topic, e.getMessage());
            }
        }
    }

    private void changeStatus(ConnectionStatus newStatus, String message) {
        ConnectionStatus previous = status;
        status = newStatus;
        for (ConnectionListener listener : listeners) {
            try {
                listener.onStatusChanged(previous, newStatus, message);
            } catch (RuntimeException e) {
                log.warn("Listener failed on status change: id={}, error={}", connectionId, e.getMessage());
            }
        }
    }

    /**
     * MQTT-style filter match: "+" matches one level, a trailing "#" matches any remainder.
     */
    static boolean matchesFilter(String filter, String topic) {
        if (filter == null || filter.isBlank() || "#".equals(filter)) {
            return true;
        }
        String[] filterLevels = filter.split("/", -1);
        String[] topicLevels = topic.split("/", -1);
        for (int i = 0; i < filterLevels.length; i++) {
            if ("#".equals(filterLevels[i])) {
                return true;
            }
            if (i >= topicLevels.length) {
                return false;
            }
            if (!"+".equals(filterLevels[i]) && !filterLevels[i].equals(topicLevels[i])) {
                return false;
            }
        }
        return filterLevels.length == topicLevels.length;
    }
}

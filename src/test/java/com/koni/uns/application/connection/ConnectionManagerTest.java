package com.koni.uns.application.connection;

import com.koni.uns.application.port.EventBus;
import com.koni.uns.domain.event.ConnectionStatusChanged;
import com.koni.uns.domain.event.DomainEvent;
import com.koni.uns.domain.exception.NotConnectedException;
import com.koni.uns.domain.exception.NotFoundException;
import com.koni.uns.domain.exception.ValidationException;
import com.koni.uns.domain.model.ConnectionConfiguration;
import com.koni.uns.domain.model.ConnectionStatus;
import com.koni.uns.domain.model.DataPoint;
import com.koni.uns.domain.model.InputConfiguration;
import com.koni.uns.domain.model.OutputConfiguration;
import com.koni.uns.infrastructure.persistence.memory.InMemoryConnectionConfigurationRepository;
import com.koni.uns.tags.UnitTest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * Unit tests for ConnectionManager.
 * Tests lifecycle transitions, timeouts, data fan-in, sending and configuration updates.
 */
@UnitTest
@ExtendWith(MockitoExtension.class)
class ConnectionManagerTest {

    private static final long TIMEOUT_MS = 300;

    @Mock
    private EventBus eventBus;

    private FakeConnectionDescriptor descriptor;
    private InMemoryConnectionConfigurationRepository repository;
    private List<DataPoint> received;
    private ConnectionManager manager;

    @BeforeEach
    void setUp() {
        descriptor = new FakeConnectionDescriptor();
        repository = new InMemoryConnectionConfigurationRepository();
        received = new CopyOnWriteArrayList<>();
        ConnectionEventListener collector = (connectionId, dataPoint) -> received.add(dataPoint);
        manager = new ConnectionManager(new ConnectionRegistry(List.of(descriptor)), repository, eventBus,
                List.of(collector), TIMEOUT_MS);
    }

    @AfterEach
    void tearDown() {
        manager.shutdown();
    }

    private static ConnectionConfiguration.ConnectionConfigurationBuilder config(String id) {
        return ConnectionConfiguration.builder()
                .id(id)
                .name("Connection " + id)
                .connectionType(FakeConnectionDescriptor.TYPE)
                .enabled(true)
                .autoStart(true)
                .settings(new FakeConnectionDescriptor.Settings("tcp://broker:1883"))
                .inputs(List.of(new InputConfiguration("in-1", "All", true, "#")))
                .outputs(List.of(new OutputConfiguration("out-1", "Commands", true, "cmd")));
    }

    private List<ConnectionStatus> publishedStatuses() {
        ArgumentCaptor<DomainEvent> captor = ArgumentCaptor.forClass(DomainEvent.class);
        verify(eventBus, atLeastOnce()).publish(captor.capture());
        return captor.getAllValues().stream()
                .filter(event -> event instanceof ConnectionStatusChanged)
                .map(event -> ((ConnectionStatusChanged) event).getNewStatus())
                .collect(Collectors.toList());
    }

    @Test
    void shouldStartAutoStartConnectionOnCreate() {
        // When
        manager.createConnection(config("c1").build());

        // Then
        assertThat(manager.getConnectionStatus("c1")).isEqualTo(ConnectionStatus.CONNECTED);
        assertThat(manager.getActiveConnectionIds()).containsExactly("c1");
        assertThat(repository.findById("c1")).isPresent();
        assertThat(descriptor.last().getConfiguredInputs()).containsExactly("in-1");
        assertThat(publishedStatuses()).containsExactly(ConnectionStatus.CONNECTING, ConnectionStatus.CONNECTED);
    }

    @Test
    void shouldNotStartWhenAutoStartIsOff() {
        manager.createConnection(config("c1").autoStart(false).build());

        assertThat(manager.getConnectionStatus("c1")).isEqualTo(ConnectionStatus.DISABLED);
        assertThat(descriptor.getCreated()).isEmpty();
    }

    @Test
    void shouldRejectInvalidConfigurationBeforeAnyStateChange() {
        // Given
        ConnectionConfiguration unknownType = config("c1").connectionType("modbus").build();
        ConnectionConfiguration badSettings = config("c2").settings(new FakeConnectionDescriptor.Settings(" ")).build();

        // When / Then
        assertThatThrownBy(() -> manager.createConnection(unknownType))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Unsupported connection type");
        assertThatThrownBy(() -> manager.createConnection(badSettings))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("endpoint is required");
        assertThat(repository.findAll()).isEmpty();
        assertThat(manager.getConnectionStatus("c1")).isEqualTo(ConnectionStatus.UNKNOWN);
    }

    @Test
    void shouldRejectDuplicateId() {
        manager.createConnection(config("c1").autoStart(false).build());

        assertThatThrownBy(() -> manager.createConnection(config("c1").build()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("already exists");
    }

    @Test
    void shouldEnterErrorWhenConnectorRefusesOrThrows() {
        // Given
        descriptor.setStartBehavior(FakeConnectionDescriptor.StartBehavior.REFUSE);
        manager.createConnection(config("refused").build());
        descriptor.setStartBehavior(FakeConnectionDescriptor.StartBehavior.THROW);
        manager.createConnection(config("thrown").build());

        // Then
        assertThat(manager.getConnectionStatus("refused")).isEqualTo(ConnectionStatus.ERROR);
        assertThat(manager.getConnectionStatus("thrown")).isEqualTo(ConnectionStatus.ERROR);
        assertThat(manager.getStatusMessage("thrown")).hasValueSatisfying(
                message -> assertThat(message).contains("broker unreachable"));
    }

    @Test
    void shouldTimeOutHangingStartAndLeaveConnectionInError() {
        // Given
        descriptor.setStartBehavior(FakeConnectionDescriptor.StartBehavior.HANG);

        // When
        long started = System.nanoTime();
        boolean result = manager.startConnection(manager.createConnection(config("slow").autoStart(false).build()).getId());
        long elapsedMs = (System.nanoTime() - started) / 1_000_000;

        // Then
        assertThat(result).isFalse();
        assertThat(elapsedMs).isLessThan(5_000);
        assertThat(manager.getConnectionStatus("slow")).isEqualTo(ConnectionStatus.ERROR);
        assertThat(manager.getStatusMessage("slow")).hasValueSatisfying(
                message -> assertThat(message).contains("timed out"));
        await().atMost(Duration.ofSeconds(5)).until(() -> descriptor.last().isClosed());
    }

    @Test
    void shouldTreatStartOfConnectedConnectionAsNoOp() {
        // Given
        manager.createConnection(config("c1").build());
        clearInvocations(eventBus);

        // When
        boolean started = manager.startConnection("c1");

        // Then
        assertThat(started).isTrue();
        assertThat(manager.getConnectionStatus("c1")).isEqualTo(ConnectionStatus.CONNECTED);
        assertThat(descriptor.getCreated()).hasSize(1);
        assertThat(descriptor.last().getConfiguredInputs()).containsExactly("in-1");
        verifyNoInteractions(eventBus);
    }

    @Test
    void shouldReportFailedStartWhenConnectorDisconnectsWhileStarting() {
        // Given
        descriptor.setStartBehavior(FakeConnectionDescriptor.StartBehavior.DISCONNECT_WHILE_STARTING);
        manager.createConnection(config("flaky").autoStart(false).build());

        // When
        boolean started = manager.startConnection("flaky");

        // Then
        assertThat(started).isFalse();
        assertThat(manager.getConnectionStatus("flaky")).isEqualTo(ConnectionStatus.DISCONNECTED);
        assertThat(publishedStatuses()).doesNotContain(ConnectionStatus.CONNECTED);
    }

    @Test
    void shouldSerializeLifecycleCallsPerConnectionButNotAcrossConnections() throws Exception {
        // Given
        descriptor.setStartBehavior("slow", FakeConnectionDescriptor.StartBehavior.HANG);
        manager.createConnection(config("slow").autoStart(false).build());
        manager.createConnection(config("fast").autoStart(false).build());
        List<String> completed = new CopyOnWriteArrayList<>();
        ExecutorService callers = Executors.newFixedThreadPool(2);

        // When
        Future<Boolean> slowStart = callers.submit(() -> {
            boolean result = manager.startConnection("slow");
            completed.add("start slow");
            return result;
        });
        await().atMost(Duration.ofSeconds(5))
                .until(() -> manager.getConnectionStatus("slow") == ConnectionStatus.CONNECTING);
        Future<Boolean> slowStop = callers.submit(() -> {
            boolean result = manager.stopConnection("slow");
            completed.add("stop slow");
            return result;
        });
        boolean fastStarted = manager.startConnection("fast");
        ConnectionStatus slowWhileFastStarted = manager.getConnectionStatus("slow");

        // Then
        assertThat(fastStarted).isTrue();
        assertThat(manager.getConnectionStatus("fast")).isEqualTo(ConnectionStatus.CONNECTED);
        assertThat(slowWhileFastStarted).isEqualTo(ConnectionStatus.CONNECTING);
        assertThat(slowStart.get(5, TimeUnit.SECONDS)).isFalse();
        assertThat(slowStop.get(5, TimeUnit.SECONDS)).isTrue();
        assertThat(completed).containsExactly("start slow", "stop slow");
        assertThat(manager.getConnectionStatus("slow")).isEqualTo(ConnectionStatus.DISABLED);
        callers.shutdown();
    }

    @Test
    void shouldRecoverFromErrorOnNextStart() {
        // Given
        descriptor.setStartBehavior(FakeConnectionDescriptor.StartBehavior.REFUSE);
        manager.createConnection(config("c1").build());

        // When
        descriptor.setStartBehavior(FakeConnectionDescriptor.StartBehavior.SUCCEED);
        boolean started = manager.startConnection("c1");

        // Then
        assertThat(started).isTrue();
        assertThat(manager.getConnectionStatus("c1")).isEqualTo(ConnectionStatus.CONNECTED);
    }

    @Test
    void shouldStopAndReleaseConnector() {
        // Given
        manager.createConnection(config("c1").build());
        FakeConnectionDescriptor.FakeConnection connector = descriptor.last();

        // When
        boolean stopped = manager.stopConnection("c1");

        // Then
        assertThat(stopped).isTrue();
        assertThat(connector.isClosed()).isTrue();
        assertThat(manager.getConnectionStatus("c1")).isEqualTo(ConnectionStatus.DISABLED);
        assertThat(manager.getActiveConnectionIds()).isEmpty();
        assertThat(manager.stopConnection("c1")).isTrue();
    }

    @Test
    void shouldForwardReceivedDataTaggedWithConnectionType() {
        // Given
        manager.createConnection(config("c1").build());

        // When
        descriptor.last().emit("Acme/Dallas/Press/temp", 42.0);

        // Then
        assertThat(received).hasSize(1);
        DataPoint dataPoint = received.get(0);
        assertThat(dataPoint.getTopic()).isEqualTo("Acme/Dallas/Press/temp");
        assertThat(dataPoint.getValue()).isEqualTo(42.0);
        assertThat(dataPoint.getSourceSystem()).isEqualTo(FakeConnectionDescriptor.TYPE);
    }

    @Test
    void shouldIgnoreDataFromReleasedConnector() {
        // Given
        manager.createConnection(config("c1").build());
        FakeConnectionDescriptor.FakeConnection connector = descriptor.last();
        manager.stopConnection("c1");

        // When
        connector.emit("late/value", 1);

        // Then
        assertThat(received).isEmpty();
    }

    @Test
    void shouldTrackConnectorReportedDisconnect() {
        manager.createConnection(config("c1").build());

        descriptor.last().drop("broker went away");

        assertThat(manager.getConnectionStatus("c1")).isEqualTo(ConnectionStatus.DISCONNECTED);
        assertThat(manager.getStatusMessage("c1")).contains("broker went away");
    }

    @Test
    void shouldSendThroughConnectedConnection() {
        // Given
        manager.createConnection(config("c1").build());
        DataPoint command = DataPoint.builder().topic("setpoint").value(10).build();

        // When
        boolean sent = manager.sendData("c1", command, "out-1");

        // Then
        assertThat(sent).isTrue();
        assertThat(descriptor.last().getSent()).containsExactly(command);
    }

    @Test
    void shouldRejectSendWhenNotConnectedOrOutputUnknown() {
        // Given
        manager.createConnection(config("idle").autoStart(false).build());
        manager.createConnection(config("live").build());
        DataPoint command = DataPoint.builder().topic("setpoint").value(10).build();

        // When / Then
        assertThatThrownBy(() -> manager.sendData("idle", command, null))
                .isInstanceOf(NotConnectedException.class);
        assertThatThrownBy(() -> manager.sendData("live", command, "missing"))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> manager.sendData("ghost", command, null))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void shouldRestartWhenSettingsChange() {
        // Given
        manager.createConnection(config("c1").build());

        // When
        manager.updateConnection(config("c1").settings(new FakeConnectionDescriptor.Settings("tcp://other:1883")).build());

        // Then
        assertThat(descriptor.getCreated()).hasSize(2);
        assertThat(descriptor.getCreated().get(0).isClosed()).isTrue();
        assertThat(manager.getConnectionStatus("c1")).isEqualTo(ConnectionStatus.CONNECTED);
    }

    @Test
    void shouldReapplyOnlyChangedInputsWhenSettingsAreUnchanged() {
        // Given
        manager.createConnection(config("c1").build());

        // When
        manager.updateConnection(config("c1")
                .inputs(List.of(new InputConfiguration("in-2", "Line", true, "Acme/+/Press/#")))
                .build());

        // Then
        FakeConnectionDescriptor.FakeConnection connector = descriptor.last();
        assertThat(descriptor.getCreated()).hasSize(1);
        assertThat(connector.getConfiguredInputs()).containsExactly("in-1", "in-2");
        assertThat(connector.getRemovedInputs()).containsExactly("in-1");
        assertThat(manager.getConnectionConfiguration("c1").get().findInput("in-2")).isPresent();
    }

    @Test
    void shouldRefuseConnectionTypeChange() {
        manager.createConnection(config("c1").autoStart(false).build());
        FakeConnectionDescriptor other = new FakeConnectionDescriptor() {
            @Override
            public String getConnectionType() {
                return "other";
            }
        };
        ConnectionManager twoTypes = new ConnectionManager(new ConnectionRegistry(List.of(descriptor, other)),
                repository, eventBus, List.of(), TIMEOUT_MS);
        twoTypes.restoreConnections();

        assertThatThrownBy(() -> twoTypes.updateConnection(config("c1").connectionType("other").build()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("cannot be changed");
        twoTypes.shutdown();
    }

    @Test
    void shouldRemoveConnection() {
        // Given
        manager.createConnection(config("c1").build());

        // When
        manager.removeConnection("c1");

        // Then
        assertThat(manager.getConnectionConfiguration("c1")).isEmpty();
        assertThat(repository.findAll()).isEmpty();
        assertThat(descriptor.last().isClosed()).isTrue();
        assertThatThrownBy(() -> manager.startConnection("c1")).isInstanceOf(NotFoundException.class);
    }

    @Test
    void shouldRestoreStoredConnections() {
        // Given
        repository.save(config("stored-1").build());
        repository.save(config("stored-2").autoStart(false).build());
        repository.save(config("broken").connectionType("modbus").build());

        // When
        int restored = manager.restoreConnections();

        // Then
        assertThat(restored).isEqualTo(2);
        assertThat(manager.getConnectionStates())
                .containsEntry("stored-1", ConnectionStatus.CONNECTED)
                .containsEntry("stored-2", ConnectionStatus.DISABLED)
                .doesNotContainKey("broken");
    }

    @Test
    void shouldNotStartDisabledConnection() {
        manager.createConnection(config("c1").enabled(false).build());

        assertThat(manager.startConnection("c1")).isFalse();
        assertThat(manager.getConnectionStatus("c1")).isEqualTo(ConnectionStatus.DISABLED);
    }
}

package com.koni.uns.application.query;

import com.koni.uns.application.connection.ConnectionManager;
import com.koni.uns.domain.exception.NotFoundException;
import com.koni.uns.domain.model.ConnectionConfiguration;
import com.koni.uns.domain.model.ConnectionStatus;
import com.koni.uns.tags.UnitTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

/**
 * Unit tests for GetConnectionsQueryHandler.
 */
@UnitTest
@ExtendWith(MockitoExtension.class)
class GetConnectionsQueryHandlerTest {

    @Mock
    private ConnectionManager connectionManager;

    private GetConnectionsQueryHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GetConnectionsQueryHandler(connectionManager);
    }

    @Test
    void shouldCombineConfigurationWithLiveStatus() {
        // Given
        ConnectionConfiguration configuration = ConnectionConfiguration.builder()
                .id("plc-1")
                .name("Press PLC")
                .connectionType("simulated")
                .enabled(true)
                .autoStart(true)
                .tags(List.of("press"))
                .build();
        when(connectionManager.getAllConfigurations()).thenReturn(List.of(configuration));
        when(connectionManager.getConnectionStatus("plc-1")).thenReturn(ConnectionStatus.ERROR);
        when(connectionManager.getStatusMessage("plc-1")).thenReturn(Optional.of("start timed out after 30000ms"));

        // When
        List<ConnectionResponse> result = handler.handle(new GetConnectionsQuery());

        // Then
        assertThat(result).hasSize(1);
        ConnectionResponse response = result.get(0);
        assertThat(response.getId()).isEqualTo("plc-1");
        assertThat(response.getName()).isEqualTo("Press PLC");
        assertThat(response.getStatus()).isEqualTo(ConnectionStatus.ERROR);
        assertThat(response.getStatusMessage()).isEqualTo("start timed out after 30000ms");
        assertThat(response.getTags()).containsExactly("press");
    }

    @Test
    void shouldThrowNotFoundForUnknownConnection() {
        // Given
        when(connectionManager.getConnectionConfiguration("unknown")).thenReturn(Optional.empty());

        // When / Then
        assertThatThrownBy(() -> handler.handleSingle("unknown"))
                .isInstanceOf(NotFoundException.class)
                .hasMessageContaining("unknown");
    }
}

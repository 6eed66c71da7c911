package com.koni.uns.application.connection;

import com.koni.uns.domain.model.ConnectionConfiguration;
import com.koni.uns.domain.model.InputConfiguration;
import com.koni.uns.domain.model.ValidationResult;
import com.koni.uns.infrastructure.connection.SimulatedConnectionDescriptor;
import com.koni.uns.infrastructure.connection.SimulatedConnectionSettings;
import com.koni.uns.tags.UnitTest;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for ConnectionRegistry.
 */
@UnitTest
class ConnectionRegistryTest {

    private final ConnectionRegistry registry =
            new ConnectionRegistry(List.of(new SimulatedConnectionDescriptor(), new FakeConnectionDescriptor()));

    @Test
    void shouldLookUpTypesCaseInsensitively() {
        assertThat(registry.isSupported("SIMULATED")).isTrue();
        assertThat(registry.find(" fake ")).isPresent();
        assertThat(registry.find(null)).isEmpty();
        assertThatThrownBy(() -> registry.require("opcua"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("opcua");
    }

    @Test
    void shouldRejectDuplicateRegistration() {
        assertThatThrownBy(() -> new ConnectionRegistry(
                List.of(new FakeConnectionDescriptor(), new FakeConnectionDescriptor())))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldAcceptValidConfiguration() {
        // Given
        ConnectionConfiguration configuration = ConnectionConfiguration.builder()
                .id("sim").name("Simulator").connectionType("simulated")
                .settings(new SimulatedConnectionSettings(List.of("a/b"), 100L, 0.0, 1.0))
                .build();

        // When
        ValidationResult result = registry.validate(configuration);

        // Then
        assertThat(result.isValid()).isTrue();
    }

    @Test
    void shouldCollectEveryProblem() {
        // Given
        ConnectionConfiguration configuration = ConnectionConfiguration.builder()
                .id(" ")
                .connectionType("simulated")
                .settings(new FakeConnectionDescriptor.Settings("x"))
                .inputs(List.of(new InputConfiguration("i", "a", true, "#"), new InputConfiguration("i", "b", true, "#")))
                .build();

        // When
        ValidationResult result = registry.validate(configuration);

        // Then
        assertThat(result.isValid()).isFalse();
        assertThat(result.getErrors()).contains(
                "Connection id is required",
                "Connection name is required",
                "Duplicate input id: i");
        assertThat(result.getErrorMessage()).contains("do not match connection type simulated");
    }

    @Test
    void shouldSurfaceSettingsErrorsAndWarnings() {
        ConnectionConfiguration configuration = ConnectionConfiguration.builder()
                .id("sim").name("Simulator").connectionType("simulated")
                .settings(new SimulatedConnectionSettings(List.of(), 5L, 10.0, 1.0))
                .build();

        ValidationResult result = registry.validate(configuration);

        assertThat(result.getErrors()).containsExactly(
                "publishIntervalMs must be at least 10",
                "valueMin must not be greater than valueMax");
        assertThat(result.getWarnings()).hasSize(1);
    }
}

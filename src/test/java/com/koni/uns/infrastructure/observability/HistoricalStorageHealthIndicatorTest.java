package com.koni.uns.infrastructure.observability;

import com.koni.uns.application.ingestion.HistoricalStorageProperties;
import com.koni.uns.application.ingestion.HistoricalStorageWriter;
import com.koni.uns.tags.UnitTest;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

/**
 * Unit tests for HistoricalStorageHealthIndicator.
 */
@UnitTest
@ExtendWith(MockitoExtension.class)
class HistoricalStorageHealthIndicatorTest {

    @Mock
    private HistoricalStorageWriter writer;

    private CircuitBreaker circuitBreaker;
    private HistoricalStorageHealthIndicator healthIndicator;

    @BeforeEach
    void setUp() {
        circuitBreaker = CircuitBreaker.ofDefaults("historical-test");
        HistoricalStorageProperties properties = new HistoricalStorageProperties();
        properties.setRetentionDays(7);
        healthIndicator = new HistoricalStorageHealthIndicator(circuitBreaker, properties, writer);
    }

    @Test
    void shouldReturnUpWhileCircuitClosed() {
        // Given
        when(writer.getQueueSize()).thenReturn(12);

        // When
        Health health = healthIndicator.health();

        // Then
        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("provider", "JPA")
                .containsEntry("circuitBreaker", "CLOSED")
                .containsEntry("queued", 12)
                .containsEntry("retentionDays", 7)
                .containsEntry("walEnabled", true);
    }

    @Test
    void shouldReturnDownWhileCircuitOpen() {
        // Given
        when(writer.getQueueSize()).thenReturn(0);
        circuitBreaker.transitionToOpenState();

        // When
        Health health = healthIndicator.health();

        // Then
        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("circuitBreaker", "OPEN");
    }
}

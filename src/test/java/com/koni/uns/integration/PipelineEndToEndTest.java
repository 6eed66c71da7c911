package com.koni.uns.integration;

import com.koni.uns.application.cache.CacheEntry;
import com.koni.uns.application.cache.MultiLevelCacheManager;
import com.koni.uns.application.connection.ConnectionManager;
import com.koni.uns.domain.model.ConnectionConfiguration;
import com.koni.uns.domain.model.ConnectionStatus;
import com.koni.uns.domain.model.DataPoint;
import com.koni.uns.domain.repository.HistoricalStorage;
import com.koni.uns.domain.repository.RealtimeStorage;
import com.koni.uns.infrastructure.connection.SimulatedConnectionSettings;
import com.koni.uns.tags.EndToEndTest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * End-to-end test of the ingestion pipeline.
 * Validates the full flow: simulated connection -> discovery -> auto-mapping -> cache
 * -> realtime and historical storage.
 */
@EndToEndTest
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class PipelineEndToEndTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(15);

    @Autowired
    private ConnectionManager connectionManager;

    @Autowired
    private MultiLevelCacheManager cacheManager;

    @Autowired
    private RealtimeStorage realtimeStorage;

    @Autowired
    private HistoricalStorage historicalStorage;

    private String connectionId;
    private String area;

    @BeforeEach
    void setUp() {
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        connectionId = "e2e-" + suffix;
        area = "E2e" + suffix;
    }

    @AfterEach
    void tearDown() {
        if (connectionManager.getConnectionConfiguration(connectionId).isPresent()) {
            connectionManager.removeConnection(connectionId);
        }
    }

    @Test
    void shouldCarrySimulatedValuesIntoTheNamespace() {
        // Given
        String temperature = "Acme/Dallas/" + area + "/Line1/temperature";
        String pressure = "Acme/Dallas/" + area + "/Line2/pressure";
        String stray = "spBv1.0/misc-" + area;
        ConnectionConfiguration configuration = ConnectionConfiguration.builder()
                .id(connectionId)
                .name("End-to-end simulator")
                .connectionType("simulated")
                .enabled(true)
                .autoStart(true)
                .settings(new SimulatedConnectionSettings(List.of(temperature, pressure, stray), 50L, 10.0, 20.0))
                .build();

        // When
        connectionManager.createConnection(configuration);

        // Then
        assertThat(connectionManager.getConnectionStatus(connectionId)).isEqualTo(ConnectionStatus.CONNECTED);

        await().atMost(TIMEOUT).untilAsserted(() -> {
            assertThat(cacheManager.getEntry(temperature)).map(CacheEntry::getNsPath)
                    .hasValue("Acme/Dallas/" + area + "/Line1");
            assertThat(cacheManager.getEntry(pressure)).map(CacheEntry::getNsPath)
                    .hasValue("Acme/Dallas/" + area + "/Line2");
            assertThat(cacheManager.getEntry(stray)).map(CacheEntry::isMapped).hasValue(false);
        });
        assertThat(cacheManager.getTopicsUnder("Acme/Dallas/" + area)).containsExactlyInAnyOrder(temperature, pressure);
        assertThat(cacheManager.getEntry(temperature).get().getConnectionId()).isEqualTo(connectionId);
        assertThat(cacheManager.getEntry(temperature).get().getSourceType()).isEqualTo("simulated");

        await().atMost(TIMEOUT).untilAsserted(() -> {
            Optional<DataPoint> latest = realtimeStorage.getLatest(temperature);
            assertThat(latest).isPresent();
            assertThat(latest.get().getPath().getFullPath()).isEqualTo("Acme/Dallas/" + area + "/Line1");
            assertThat((Double) latest.get().getValue()).isBetween(10.0, 20.0);
        });

        await().atMost(TIMEOUT).untilAsserted(() -> assertThat(historicalStorage.getHistoryByPath(
                cacheManager.getEntry(temperature).get().getPath().truncate(3),
                Instant.now().minus(Duration.ofMinutes(5)),
                Instant.now()))
                .extracting(DataPoint::getTopic)
                .contains(temperature, pressure));
    }
}

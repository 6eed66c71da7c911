package com.koni.uns.infrastructure.persistence.repository;

import com.koni.uns.TestHierarchies;
import com.koni.uns.domain.model.DataPoint;
import com.koni.uns.domain.model.DataQuality;
import com.koni.uns.domain.repository.CleanableStorage;
import com.koni.uns.domain.repository.HistoricalStorage;
import com.koni.uns.infrastructure.persistence.DataPointJsonCodec;
import com.koni.uns.infrastructure.resilience.ResilientStorageExecutor;
import com.koni.uns.tags.IntegrationTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration tests for JpaHistoricalStorageAdapter on the embedded H2 database.
 * Tests chunked and concurrent bulk writes, range and path queries, JSON round-trips, and retention cleanup.
 */
@IntegrationTest
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class JpaHistoricalStorageIntegrationTest {

    private static final Instant BASE = Instant.parse("2020-03-01T08:00:00Z");

    @Autowired
    private HistoricalStorage historicalStorage;

    @Autowired
    private HistoricalDataPointJpaRepository jpaRepository;

    @Autowired
    private RealtimeValueJpaRepository realtimeJpaRepository;

    @Autowired
    private DataPointJsonCodec codec;

    @Autowired
    private ResilientStorageExecutor storageExecutor;

    @Autowired
    private PlatformTransactionManager transactionManager;

    private String prefix;

    @BeforeEach
    void setUp() {
        prefix = "jpa-it/" + UUID.randomUUID() + "/";
    }

    @Test
    void shouldBeTheJpaAdapter() {
        assertThat(historicalStorage).isInstanceOf(JpaHistoricalStorageAdapter.class);
        assertThat(historicalStorage).isInstanceOf(CleanableStorage.class);
    }

    @Test
    void shouldStoreBulkAndQueryRangeOldestFirst() {
        // Given
        List<DataPoint> values = new ArrayList<>();
        for (int i = 9; i >= 0; i--) {
            values.add(DataPoint.builder().topic(prefix + "temp").value(i).timestamp(BASE.plusSeconds(i)).build());
        }

        // When
        historicalStorage.storeBulk(values);
        List<DataPoint> history = historicalStorage.getHistory(prefix + "temp", BASE.plusSeconds(2), BASE.plusSeconds(5));

        // Then
        assertThat(history).extracting(DataPoint::getValue).containsExactly(2, 3, 4, 5);
    }

    @Test
    void shouldRoundTripPathValueAndMetadata() {
        // Given
        DataPoint value = DataPoint.builder()
                .topic(prefix + "state")
                .path(TestHierarchies.path("Acme/Dallas/Press/Line1"))
                .value(Map.of("running", true))
                .timestamp(BASE)
                .sourceSystem("simulated")
                .quality(DataQuality.UNCERTAIN)
                .metadata(Map.of("unit", "bool"))
                .build();

        // When
        historicalStorage.store(value);
        DataPoint stored = historicalStorage.getHistory(prefix + "state", BASE.minusSeconds(1), BASE.plusSeconds(1)).get(0);

        // Then
        assertThat(stored.getId()).isEqualTo(value.getId());
        assertThat(stored.getPath().getFullPath()).isEqualTo("Acme/Dallas/Press/Line1");
        assertThat(stored.getValue()).isEqualTo(Map.of("running", true));
        assertThat(stored.getQuality()).isEqualTo(DataQuality.UNCERTAIN);
        assertThat(stored.getSourceSystem()).isEqualTo("simulated");
        assertThat(stored.getMetadata()).containsEntry("unit", "bool");
    }

    @Test
    void shouldQueryByPathIncludingDescendantsOnly() {
        // Given
        String area = "Jpa" + UUID.randomUUID().toString().substring(0, 8);
        historicalStorage.storeBulk(List.of(
                DataPoint.builder().topic(prefix + "a").path(TestHierarchies.path("Acme/Dallas/" + area))
                        .value(1).timestamp(BASE).build(),
                DataPoint.builder().topic(prefix + "b").path(TestHierarchies.path("Acme/Dallas/" + area + "/Line1"))
                        .value(2).timestamp(BASE.plusSeconds(1)).build(),
                DataPoint.builder().topic(prefix + "c").path(TestHierarchies.path("Acme/Dallas/" + area + "X"))
                        .value(3).timestamp(BASE.plusSeconds(2)).build()));

        // When
        List<DataPoint> history = historicalStorage.getHistoryByPath(
                TestHierarchies.path("Acme/Dallas/" + area), BASE.minusSeconds(1), BASE.plusSeconds(10));

        // Then
        assertThat(history).extracting(DataPoint::getTopic).containsExactly(prefix + "a", prefix + "b");
    }

    @Test
    void shouldTreatUnderscoreInPathLiterally() {
        // Given
        String area = "Jpa" + UUID.randomUUID().toString().substring(0, 8);
        historicalStorage.storeBulk(List.of(
                DataPoint.builder().topic(prefix + "a").path(TestHierarchies.path("Acme/Dallas/" + area + "/Line_1"))
                        .value(1).timestamp(BASE).build(),
                DataPoint.builder().topic(prefix + "b").path(TestHierarchies.path("Acme/Dallas/" + area + "/LineX1/Cell"))
                        .value(2).timestamp(BASE.plusSeconds(1)).build(),
                DataPoint.builder().topic(prefix + "c").path(TestHierarchies.path("Acme/Dallas/" + area + "/Line%1"))
                        .value(3).timestamp(BASE.plusSeconds(2)).build()));

        // When
        List<DataPoint> history = historicalStorage.getHistoryByPath(
                TestHierarchies.path("Acme/Dallas/" + area + "/Line_1"), BASE.minusSeconds(1), BASE.plusSeconds(10));

        // Then
        assertThat(history).extracting(DataPoint::getTopic).containsExactly(prefix + "a");
    }

    @Test
    void shouldTreatUnderscoreInPathLiterallyForLatestValues() {
        // Given
        JpaRealtimeStorageAdapter realtimeStorage =
                new JpaRealtimeStorageAdapter(realtimeJpaRepository, codec, storageExecutor, transactionManager);
        String area = "Jpa" + UUID.randomUUID().toString().substring(0, 8);
        realtimeStorage.store(DataPoint.builder().topic(prefix + "a")
                .path(TestHierarchies.path("Acme/Dallas/" + area + "/Line_1/Cell")).value(1).timestamp(BASE).build());
        realtimeStorage.store(DataPoint.builder().topic(prefix + "b")
                .path(TestHierarchies.path("Acme/Dallas/" + area + "/LineX1/Cell")).value(2).timestamp(BASE).build());

        // When
        List<DataPoint> latest = realtimeStorage.getLatestByPath(TestHierarchies.path("Acme/Dallas/" + area + "/Line_1"));

        // Then
        assertThat(latest).extracting(DataPoint::getTopic).containsExactly(prefix + "a");
    }

    @Test
    void shouldPersistEveryRecordOnceUnderConcurrentBulkWrites() throws Exception {
        // Given
        int writers = 6;
        int valuesPerWriter = 2500;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int w = 0; w < writers; w++) {
            String topic = prefix + "bulk-" + w;
            futures.add(pool.submit(() -> {
                List<DataPoint> values = new ArrayList<>();
                for (int i = 0; i < valuesPerWriter; i++) {
                    values.add(DataPoint.builder().topic(topic).value(i).timestamp(BASE.plusMillis(i)).build());
                }
                start.await();
                historicalStorage.storeBulk(values);
                return null;
            }));
        }

        // When
        start.countDown();
        for (Future<?> future : futures) {
            future.get(60, TimeUnit.SECONDS);
        }
        pool.shutdown();

        // Then
        for (int w = 0; w < writers; w++) {
            List<DataPoint> history = historicalStorage.getHistory(prefix + "bulk-" + w,
                    BASE.minusSeconds(1), BASE.plusSeconds(60));
            assertThat(history).hasSize(valuesPerWriter);
            assertThat(history).extracting(DataPoint::getId).doesNotHaveDuplicates();
        }
    }

    @Test
    void shouldCountAndRemoveValuesBeforeCutoff() {
        // Given
        Instant ancient = Instant.parse("2001-01-01T00:00:00Z");
        historicalStorage.storeBulk(List.of(
                DataPoint.builder().topic(prefix + "old").value(1).timestamp(ancient).build(),
                DataPoint.builder().topic(prefix + "old").value(2).timestamp(ancient.plusSeconds(60)).build(),
                DataPoint.builder().topic(prefix + "new").value(3).timestamp(BASE).build()));
        CleanableStorage cleanable = (CleanableStorage) historicalStorage;
        Instant cutoff = ancient.plusSeconds(3600);

        // When
        long expected = cleanable.getCleanupCount(cutoff);
        long removed = cleanable.cleanupOldData(cutoff);

        // Then
        assertThat(expected).isEqualTo(2);
        assertThat(removed).isEqualTo(2);
        assertThat(jpaRepository.countByRecordedAtBefore(cutoff)).isZero();
        assertThat(historicalStorage.getHistory(prefix + "new", BASE.minusSeconds(1), BASE.plusSeconds(1))).hasSize(1);
    }
}

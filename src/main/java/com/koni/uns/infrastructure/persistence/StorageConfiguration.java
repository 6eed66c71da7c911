package com.koni.uns.infrastructure.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.koni.uns.application.ingestion.HistoricalStorageProperties;
import com.koni.uns.domain.repository.HistoricalStorage;
import com.koni.uns.domain.repository.RealtimeStorage;
import com.koni.uns.infrastructure.persistence.memory.InMemoryHistoricalStorage;
import com.koni.uns.infrastructure.persistence.memory.InMemoryRealtimeStorage;
import com.koni.uns.infrastructure.persistence.memory.NoOpHistoricalStorage;
import com.koni.uns.infrastructure.persistence.repository.HistoricalDataPointJpaRepository;
import com.koni.uns.infrastructure.persistence.repository.JpaHistoricalStorageAdapter;
import com.koni.uns.infrastructure.persistence.repository.JpaRealtimeStorageAdapter;
import com.koni.uns.infrastructure.persistence.repository.RealtimeValueJpaRepository;
import com.koni.uns.infrastructure.resilience.ResilientStorageExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

/**
 * Selects the realtime and historical storage backends.
 *
 * Providers:
 * - uns.storage.realtime.provider: IN_MEMORY (default) | JPA
 * - uns.storage.historical.provider: JPA (default) | IN_MEMORY | NONE
 */
@Slf4j
@Configuration
public class StorageConfiguration {

    @Bean
    public DataPointJsonCodec dataPointJsonCodec(ObjectMapper objectMapper) {
        return new DataPointJsonCodec(objectMapper);
    }

    @Bean
    @ConditionalOnProperty(name = "uns.storage.realtime.provider", havingValue = "IN_MEMORY", matchIfMissing = true)
    public RealtimeStorage inMemoryRealtimeStorage() {
        log.info("Realtime storage: provider=IN_MEMORY");
        return new InMemoryRealtimeStorage();
    }

    @Bean
    @ConditionalOnProperty(name = "uns.storage.realtime.provider", havingValue = "JPA")
    public RealtimeStorage jpaRealtimeStorage(RealtimeValueJpaRepository repository,
                                              DataPointJsonCodec codec,
                                              ResilientStorageExecutor executor,
                                              PlatformTransactionManager transactionManager) {
        log.info("Realtime storage: provider=JPA");
        return new JpaRealtimeStorageAdapter(repository, codec, executor, transactionManager);
    }

    @Bean
    @ConditionalOnProperty(name = "uns.storage.historical.provider", havingValue = "JPA", matchIfMissing = true)
    public HistoricalStorage jpaHistoricalStorage(HistoricalDataPointJpaRepository repository,
                                                  DataPointJsonCodec codec,
                                                  ResilientStorageExecutor executor,
                                                  PlatformTransactionManager transactionManager,
                                                  HistoricalStorageProperties properties) {
        log.info("Historical storage: provider=JPA, bulkChunkSize={}, retentionDays={}",
                properties.getBulkChunkSize(), properties.getRetentionDays());
        return new JpaHistoricalStorageAdapter(repository, codec, executor, transactionManager,
                properties.getBulkChunkSize());
    }

    @Bean
    @ConditionalOnProperty(name = "uns.storage.historical.provider", havingValue = "IN_MEMORY")
    public HistoricalStorage inMemoryHistoricalStorage(HistoricalStorageProperties properties) {
        HistoricalStorageProperties.InMemory limits = properties.getInMemory();
        log.info("Historical storage: provider=IN_MEMORY, maxValuesPerDataPoint={}, maxTotalValues={}",
                limits.getMaxValuesPerDataPoint(), limits.getMaxTotalValues());
        return new InMemoryHistoricalStorage(limits.getMaxValuesPerDataPoint(), limits.getMaxTotalValues(),
                properties.isAutoCleanup());
    }

    @Bean
    @ConditionalOnProperty(name = "uns.storage.historical.provider", havingValue = "NONE")
    public HistoricalStorage noOpHistoricalStorage() {
        log.info("Historical storage: provider=NONE, values are not kept");
        return new NoOpHistoricalStorage();
    }
}

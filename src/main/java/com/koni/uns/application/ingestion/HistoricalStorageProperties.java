package com.koni.uns.application.ingestion;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Historical storage settings, bound from {@code uns.storage.historical}.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "uns.storage.historical")
public class HistoricalStorageProperties {

    private StorageProvider provider = StorageProvider.JPA;

    /**
     * Values older than this many days are removed by the retention cleanup. 0 keeps data forever.
     */
    private int retentionDays = 30;

    private boolean autoCleanup = true;

    /**
     * Write-ahead logging toggle of file-based engines. JPA backends manage their own logs.
     */
    private boolean enableWal = true;

    private int bulkChunkSize = 1000;

    private int batchSize = 500;

    private long flushIntervalMs = 2000;

    private int maxQueueSize = 100_000;

    private long cleanupIntervalMs = 3_600_000;

    private InMemory inMemory = new InMemory();

    @Getter
    @Setter
    public static class InMemory {

        private int maxValuesPerDataPoint = 1000;

        /**
         * -1 means unlimited.
         */
        private int maxTotalValues = 100_000;
    }
}

package com.koni.uns.application.ingestion;

import com.koni.uns.domain.repository.CleanableStorage;
import com.koni.uns.domain.repository.HistoricalStorage;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;

/**
 * Removes historical values older than the retention period.
 *
 * Runs on a schedule when auto-cleanup is on and a retention period is set, against storage
 * backends that support cleanup. Each run logs the dry-run count before removing anything.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RetentionCleanupService {

    private final HistoricalStorage historicalStorage;
    private final HistoricalStorageProperties properties;

    @Scheduled(fixedDelayString = "${uns.storage.historical.cleanup-interval-ms:3600000}",
            initialDelayString = "${uns.storage.historical.cleanup-interval-ms:3600000}")
    public void scheduledCleanup() {
        if (!properties.isAutoCleanup() || properties.getRetentionDays() <= 0) {
            return;
        }
        try {
            cleanup();
        } catch (RuntimeException e) {
            log.error("Scheduled retention cleanup failed: error={}", e.getMessage(), e);
        }
    }

    /**
     * Counts the values the next cleanup would remove.
     */
    public CleanupReport previewCleanup() {
        if (!(historicalStorage instanceof CleanableStorage)) {
            return CleanupReport.unsupported();
        }
        Instant cutoff = cutoff();
        if (cutoff == null) {
            return new CleanupReport(null, 0, true, true);
        }
        long count = ((CleanableStorage) historicalStorage).getCleanupCount(cutoff);
        return new CleanupReport(cutoff, count, true, true);
    }

    /**
     * Removes values older than the retention period.
     */
    public CleanupReport cleanup() {
        if (!(historicalStorage instanceof CleanableStorage)) {
            log.debug("Historical storage does not support cleanup: storage={}",
                    historicalStorage.getClass().getSimpleName());
            return CleanupReport.unsupported();
        }
        Instant cutoff = cutoff();
        if (cutoff == null) {
            log.info("Retention disabled, nothing to clean up");
            return new CleanupReport(null, 0, true, false);
        }
        CleanableStorage storage = (CleanableStorage) historicalStorage;
        long expected = storage.getCleanupCount(cutoff);
        log.info("Retention cleanup starting: cutoff={}, candidates={}", cutoff, expected);
        long removed = expected == 0 ? 0 : storage.cleanupOldData(cutoff);
        log.info("Retention cleanup finished: cutoff={}, removed={}", cutoff, removed);
        return new CleanupReport(cutoff, removed, true, false);
    }

    private Instant cutoff() {
        int retentionDays = properties.getRetentionDays();
        return retentionDays <= 0 ? null : Instant.now().minus(Duration.ofDays(retentionDays));
    }

    /**
     * Outcome of a cleanup or dry run. {@code cutoff} is null when retention is disabled.
     */
    @Getter
    @ToString
    @AllArgsConstructor
    public static class CleanupReport {

        private final Instant cutoff;
        private final long count;
        private final boolean supported;
        private final boolean dryRun;

        static CleanupReport unsupported() {
            return new CleanupReport(null, 0, false, false);
        }
    }
}

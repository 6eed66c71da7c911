package com.koni.uns.infrastructure.web.controller;

import com.koni.uns.application.ingestion.RetentionCleanupService;
import com.koni.uns.application.ingestion.RetentionCleanupService.CleanupReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for historical retention.
 *
 * Endpoints:
 * - GET  /api/v1/storage/cleanup: count of values the next cleanup would remove
 * - POST /api/v1/storage/cleanup: remove values older than the retention period
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class StorageController {

    private final RetentionCleanupService cleanupService;

    @GetMapping("/v1/storage/cleanup")
    public ResponseEntity<CleanupReport> previewCleanup() {
        log.info("Received request to preview retention cleanup");
        return ResponseEntity.ok(cleanupService.previewCleanup());
    }

    @PostMapping("/v1/storage/cleanup")
    public ResponseEntity<CleanupReport> cleanup() {
        log.info("Received request to run retention cleanup");
        CleanupReport report = cleanupService.cleanup();
        log.info("Retention cleanup done: {}", report);
        return ResponseEntity.ok(report);
    }
}

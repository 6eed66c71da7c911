package com.koni.uns.application.ingestion;

/**
 * Storage backend selected for realtime or historical data.
 */
public enum StorageProvider {
    IN_MEMORY,
    JPA,
    NONE
}

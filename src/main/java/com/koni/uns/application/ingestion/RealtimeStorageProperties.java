package com.koni.uns.application.ingestion;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Realtime storage settings, bound from {@code uns.storage.realtime}.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "uns.storage.realtime")
public class RealtimeStorageProperties {

    private StorageProvider provider = StorageProvider.IN_MEMORY;
}

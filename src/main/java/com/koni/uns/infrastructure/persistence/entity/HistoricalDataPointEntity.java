package com.koni.uns.infrastructure.persistence.entity;

import com.koni.uns.domain.model.DataQuality;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for one appended historical value.
 * The serialized namespace path is stored next to its level map so that path-prefix
 * queries can run on a plain string column.
 */
@Entity
@Table(
    name = "historical_data_points",
    indexes = {
        @Index(name = "idx_historical_topic_time", columnList = "topic, recorded_at"),
        @Index(name = "idx_historical_path", columnList = "path"),
        @Index(name = "idx_historical_time", columnList = "recorded_at")
    }
)
@Getter
@Setter
@NoArgsConstructor
public class HistoricalDataPointEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "data_point_id", nullable = false, length = 64)
    private String dataPointId;

    @Column(name = "topic", nullable = false, length = 512)
    private String topic;

    @Column(name = "path", length = 1024)
    private String path;

    @Column(name = "path_json", length = 2048)
    private String pathJson;

    @Column(name = "value_json", length = 4000)
    private String valueJson;

    @Column(name = "recorded_at", nullable = false)
    private Instant recordedAt;

    @Column(name = "source_system", length = 128)
    private String sourceSystem;

    @Enumerated(EnumType.STRING)
    @Column(name = "quality", nullable = false, length = 16)
    private DataQuality quality;

    @Column(name = "metadata_json", length = 4000)
    private String metadataJson;

    @Column(name = "stored_at", nullable = false)
    private Instant storedAt;

    @PrePersist
    protected void onCreate() {
        if (storedAt == null) {
            storedAt = Instant.now();
        }
    }
}

package com.koni.uns.infrastructure.persistence.entity;

import com.koni.uns.domain.model.DataQuality;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * JPA entity holding the latest value of one topic. Writing a topic again overwrites its row.
 */
@Entity
@Table(
    name = "realtime_values",
    indexes = {
        @Index(name = "idx_realtime_path", columnList = "path"),
        @Index(name = "idx_realtime_data_point", columnList = "data_point_id")
    }
)
@Getter
@Setter
@NoArgsConstructor
public class RealtimeValueEntity {

    @Id
    @Column(name = "topic", length = 512)
    private String topic;

    @Column(name = "data_point_id", nullable = false, length = 64)
    private String dataPointId;

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

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (updatedAt == null) {
            updatedAt = Instant.now();
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}

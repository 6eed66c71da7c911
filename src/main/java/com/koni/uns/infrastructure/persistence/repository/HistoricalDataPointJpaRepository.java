package com.koni.uns.infrastructure.persistence.repository;

import com.koni.uns.infrastructure.persistence.entity.HistoricalDataPointEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Spring Data repository for appended historical values.
 */
@Repository
public interface HistoricalDataPointJpaRepository extends JpaRepository<HistoricalDataPointEntity, UUID> {

    List<HistoricalDataPointEntity> findByTopicAndRecordedAtBetweenOrderByRecordedAtAsc(
            String topic, Instant from, Instant to);

    /**
     * Values whose path equals the given serialized path or lies below it.
     * {@code descendants} is the escaped LIKE pattern built by {@code DataPointJsonCodec.descendantPattern}.
     */
    @Query("select e from HistoricalDataPointEntity e "
            + "where (e.path = :path or e.path like :descendants escape '!') "
            + "and e.recordedAt between :from and :to "
            + "order by e.recordedAt asc")
    List<HistoricalDataPointEntity> findByPathPrefix(@Param("path") String path,
                                                     @Param("descendants") String descendants,
                                                     @Param("from") Instant from,
                                                     @Param("to") Instant to);

    long countByRecordedAtBefore(Instant cutoff);

    @Modifying
    @Query("delete from HistoricalDataPointEntity e where e.recordedAt < :cutoff")
    int deleteByRecordedAtBefore(@Param("cutoff") Instant cutoff);
}

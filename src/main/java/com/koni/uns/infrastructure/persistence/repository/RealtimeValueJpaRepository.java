package com.koni.uns.infrastructure.persistence.repository;

import com.koni.uns.infrastructure.persistence.entity.RealtimeValueEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Spring Data repository for the latest value of each topic, keyed by topic.
 */
@Repository
public interface RealtimeValueJpaRepository extends JpaRepository<RealtimeValueEntity, String> {

    @Query("select e from RealtimeValueEntity e "
            + "where e.path = :path or e.path like :descendants escape '!' "
            + "order by e.topic")
    List<RealtimeValueEntity> findByPathPrefix(@Param("path") String path,
                                               @Param("descendants") String descendants);

    @Query("select e.topic from RealtimeValueEntity e order by e.topic")
    List<String> findAllTopics();

    @Modifying
    @Query("delete from RealtimeValueEntity e where e.dataPointId = :dataPointId")
    int deleteByDataPointId(@Param("dataPointId") String dataPointId);
}

package com.koni.uns.infrastructure.persistence.repository;

import com.koni.uns.domain.model.DataPoint;
import com.koni.uns.domain.model.HierarchicalPath;
import com.koni.uns.domain.repository.RealtimeStorage;
import com.koni.uns.infrastructure.persistence.DataPointJsonCodec;
import com.koni.uns.infrastructure.resilience.ResilientStorageExecutor;
import io.micrometer.observation.annotation.Observed;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * JPA adapter for RealtimeStorage. One row per topic; storing a topic again overwrites the row.
 */
public class JpaRealtimeStorageAdapter implements RealtimeStorage {

    private final RealtimeValueJpaRepository jpaRepository;
    private final DataPointJsonCodec codec;
    private final ResilientStorageExecutor executor;
    private final TransactionTemplate transactionTemplate;

    public JpaRealtimeStorageAdapter(RealtimeValueJpaRepository jpaRepository,
                                     DataPointJsonCodec codec,
                                     ResilientStorageExecutor executor,
                                     PlatformTransactionManager transactionManager) {
        this.jpaRepository = jpaRepository;
        this.codec = codec;
        this.executor = executor;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    @Override
    @Observed(name = "repository.save", contextualName = "realtime-store")
    public void store(DataPoint dataPoint) {
        if (dataPoint == null) {
            throw new IllegalArgumentException("DataPoint cannot be null");
        }
        executor.run("realtime store", () -> transactionTemplate.executeWithoutResult(status ->
                jpaRepository.save(codec.toRealtimeEntity(dataPoint,
                        jpaRepository.findById(dataPoint.getTopic()).orElse(null)))));
    }

    @Override
    @Observed(name = "repository.find", contextualName = "realtime-latest")
    public Optional<DataPoint> getLatest(String topic) {
        if (topic == null) {
            throw new IllegalArgumentException("Topic cannot be null");
        }
        return executor.execute("realtime latest query", () -> jpaRepository.findById(topic))
                .map(codec::toDataPoint);
    }

    @Override
    public List<DataPoint> getLatestByPath(HierarchicalPath path) {
        if (path == null) {
            throw new IllegalArgumentException("Path cannot be null");
        }
        if (path.isEmpty()) {
            return List.of();
        }
        String prefix = DataPointJsonCodec.pathString(path);
        String descendants = DataPointJsonCodec.descendantPattern(prefix);
        return executor.execute("realtime path query", () -> jpaRepository.findByPathPrefix(prefix, descendants))
                .stream()
                .map(codec::toDataPoint)
                .collect(Collectors.toList());
    }

    @Override
    public List<String> listTopics() {
        return executor.execute("realtime topic listing", jpaRepository::findAllTopics);
    }

    @Override
    public boolean delete(String id) {
        if (id == null) {
            throw new IllegalArgumentException("Id cannot be null");
        }
        Integer removed = executor.execute("realtime delete", () -> transactionTemplate.execute(
                status -> jpaRepository.deleteByDataPointId(id)));
        return removed != null && removed > 0;
    }
}

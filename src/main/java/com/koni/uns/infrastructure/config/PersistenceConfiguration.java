package com.koni.uns.infrastructure.config;

import com.koni.uns.application.ingestion.HistoricalStorageProperties;
import com.koni.uns.application.ingestion.RealtimeStorageProperties;
import com.koni.uns.application.mapping.AutoMappingProperties;
import com.koni.uns.domain.model.HierarchyConfiguration;
import com.koni.uns.domain.model.HierarchyNode;
import com.koni.uns.domain.model.NamespaceConfiguration;
import com.koni.uns.domain.model.ValidationResult;
import com.koni.uns.domain.repository.ConnectionConfigurationRepository;
import com.koni.uns.domain.repository.HierarchyConfigurationRepository;
import com.koni.uns.domain.repository.NamespaceConfigurationRepository;
import com.koni.uns.domain.repository.TopicConfigurationRepository;
import com.koni.uns.infrastructure.persistence.memory.InMemoryConnectionConfigurationRepository;
import com.koni.uns.infrastructure.persistence.memory.InMemoryHierarchyConfigurationRepository;
import com.koni.uns.infrastructure.persistence.memory.InMemoryNamespaceConfigurationRepository;
import com.koni.uns.infrastructure.persistence.memory.InMemoryTopicConfigurationRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration repositories and their startup seed.
 *
 * The hierarchy and the namespace set come from {@link UnsProperties}. A malformed seed
 * fails application startup.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties({
        UnsProperties.class,
        AutoMappingProperties.class,
        HistoricalStorageProperties.class,
        RealtimeStorageProperties.class
})
public class PersistenceConfiguration {

    @Bean
    public HierarchyConfigurationRepository hierarchyConfigurationRepository(UnsProperties properties) {
        HierarchyConfiguration hierarchy = toHierarchy(properties.getHierarchy());
        ValidationResult result = hierarchy.validate();
        if (!result.isValid()) {
            throw new IllegalStateException("Invalid hierarchy configuration: " + result.getErrorMessage());
        }
        log.info("Hierarchy loaded: id={}, levels={}", hierarchy.getId(), hierarchy.getLevelNames());
        return new InMemoryHierarchyConfigurationRepository(hierarchy);
    }

    @Bean
    public NamespaceConfigurationRepository namespaceConfigurationRepository(
            UnsProperties properties, HierarchyConfigurationRepository hierarchyRepository) {
        InMemoryNamespaceConfigurationRepository repository = new InMemoryNamespaceConfigurationRepository();
        HierarchyConfiguration hierarchy = hierarchyRepository.getActive();
        Instant now = Instant.now();
        for (UnsProperties.Namespace namespace : properties.getNamespaces()) {
            repository.save(NamespaceConfiguration.builder()
                    .id(namespace.getId())
                    .name(namespace.getName())
                    .type(namespace.getType())
                    .description(namespace.getDescription())
                    .path(hierarchy.parsePath(namespace.getPath()))
                    .parentNamespaceId(namespace.getParentId())
                    .allowTopics(namespace.getAllowTopics())
                    .active(namespace.isActive())
                    .createdAt(now)
                    .modifiedAt(now)
                    .build());
        }
        log.info("Namespaces loaded: count={}", properties.getNamespaces().size());
        return repository;
    }

    @Bean
    public TopicConfigurationRepository topicConfigurationRepository() {
        return new InMemoryTopicConfigurationRepository();
    }

    @Bean
    public ConnectionConfigurationRepository connectionConfigurationRepository() {
        return new InMemoryConnectionConfigurationRepository();
    }

    static HierarchyConfiguration toHierarchy(UnsProperties.Hierarchy hierarchy) {
        List<HierarchyNode> nodes = new ArrayList<>();
        String parentId = null;
        List<UnsProperties.Level> levels = hierarchy.getLevels();
        for (int i = 0; i < levels.size(); i++) {
            UnsProperties.Level level = levels.get(i);
            String nodeId = level.getName();
            nodes.add(new HierarchyNode(nodeId, level.getName(), i, parentId, level.isAllowTopics(),
                    level.getDescription()));
            parentId = nodeId;
        }
        return new HierarchyConfiguration(hierarchy.getId(), hierarchy.getName(), nodes);
    }
}

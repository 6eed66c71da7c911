package com.koni.uns.application.cache;

import com.koni.uns.domain.model.HierarchicalPath;
import com.koni.uns.domain.model.NamespaceConfiguration;
import com.koni.uns.domain.model.NamespaceType;
import com.koni.uns.domain.model.TopicConfiguration;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * Read-optimized view of one topic as served by {@link MultiLevelCacheManager}.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class CacheEntry {

    private final String topic;
    private final String unsName;
    private final HierarchicalPath path;
    private final String sourceType;
    private final String connectionId;
    private final boolean active;
    private final String namespaceName;
    private final NamespaceType namespaceType;
    private final Instant modifiedAt;

    static CacheEntry from(TopicConfiguration configuration, NamespaceConfiguration namespace) {
        return new CacheEntry(
                configuration.getTopic(),
                configuration.getUnsName(),
                configuration.getPath(),
                configuration.getSourceType(),
                configuration.getConnectionId(),
                configuration.isActive(),
                namespace == null ? null : namespace.getName(),
                namespace == null ? null : namespace.getType(),
                configuration.getModifiedAt());
    }

    /**
     * @return the serialized namespace path, or null for an unmapped topic
     */
    public String getNsPath() {
        return path.isEmpty() ? null : path.getFullPath();
    }

    public boolean isMapped() {
        return !path.isEmpty();
    }
}

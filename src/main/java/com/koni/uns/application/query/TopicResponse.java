package com.koni.uns.application.query;

import com.koni.uns.domain.model.NamespaceType;
import com.koni.uns.domain.model.TopicConfiguration;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Read model of a topic as held by the cache: its raw topic, UNS display name,
 * namespace path (null while unmapped) and the namespace anchored at that path, if any.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class TopicResponse {

    private String topic;
    private String unsName;
    private String nsPath;
    private String sourceType;
    private String connectionId;
    private boolean active;
    private String namespaceName;
    private NamespaceType namespaceType;
    private Instant modifiedAt;

    /**
     * Builds the response straight from a stored record, before the cache has caught up.
     * Namespace details are left empty.
     */
    public static TopicResponse from(TopicConfiguration configuration) {
        return new TopicResponse(
                configuration.getTopic(),
                configuration.getUnsName(),
                configuration.getNsPath(),
                configuration.getSourceType(),
                configuration.getConnectionId(),
                configuration.isActive(),
                null,
                null,
                configuration.getModifiedAt());
    }
}

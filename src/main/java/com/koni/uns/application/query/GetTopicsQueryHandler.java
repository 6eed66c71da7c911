package com.koni.uns.application.query;

import com.koni.uns.application.cache.CacheEntry;
import com.koni.uns.application.cache.MultiLevelCacheManager;
import com.koni.uns.domain.exception.NotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Answers topic queries from the cache, without touching the configuration store.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GetTopicsQueryHandler {

    private final MultiLevelCacheManager cacheManager;

    public List<TopicResponse> handle(GetTopicsQuery query) {
        log.debug("Handling GetTopicsQuery: pathPrefix={}, unmappedOnly={}",
                query.getPathPrefix(), query.isUnmappedOnly());

        List<CacheEntry> entries;
        if (query.isUnmappedOnly()) {
            entries = cacheManager.getUnmapped();
        } else if (query.getPathPrefix() != null && !query.getPathPrefix().isBlank()) {
            entries = cacheManager.getEntriesUnder(query.getPathPrefix());
        } else {
            entries = cacheManager.getAll();
        }

        List<TopicResponse> topics = entries.stream()
                .map(GetTopicsQueryHandler::toResponse)
                .collect(Collectors.toList());

        log.info("Retrieved {} topics", topics.size());
        return topics;
    }

    /**
     * @throws NotFoundException if the topic is not in the cache
     */
    public TopicResponse handleSingle(String topic) {
        return cacheManager.getEntry(topic)
                .map(GetTopicsQueryHandler::toResponse)
                .orElseThrow(() -> new NotFoundException("Topic not found: " + topic));
    }

    static TopicResponse toResponse(CacheEntry entry) {
        return new TopicResponse(
                entry.getTopic(),
                entry.getUnsName(),
                entry.getNsPath(),
                entry.getSourceType(),
                entry.getConnectionId(),
                entry.isActive(),
                entry.getNamespaceName(),
                entry.getNamespaceType(),
                entry.getModifiedAt());
    }
}

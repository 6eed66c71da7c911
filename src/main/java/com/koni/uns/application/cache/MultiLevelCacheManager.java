package com.koni.uns.application.cache;

import com.koni.uns.application.port.EventBus;
import com.koni.uns.domain.event.NamespaceStructureChanged;
import com.koni.uns.domain.event.TopicAutoMapped;
import com.koni.uns.domain.event.TopicConfigurationChanged;
import com.koni.uns.domain.event.TopicDiscovered;
import com.koni.uns.domain.model.HierarchicalPath;
import com.koni.uns.domain.model.NamespaceConfiguration;
import com.koni.uns.domain.model.TopicConfiguration;
import com.koni.uns.domain.repository.NamespaceConfigurationRepository;
import com.koni.uns.domain.repository.TopicConfigurationRepository;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Event-maintained read index over topics and their namespace placement.
 *
 * All mutations run on one writer thread, in the order the triggering events were published.
 * Reads go straight to concurrent maps and never wait for the writer. A full rebuild creates a
 * fresh index and swaps it in, so readers see either the old or the new index, never a mix.
 *
 * Because events may be lost (the bus does not persist), the index is periodically rebuilt
 * from the configuration repositories.
 */
@Slf4j
@Component
public class MultiLevelCacheManager {

    private final TopicConfigurationRepository topicRepository;
    private final NamespaceConfigurationRepository namespaceRepository;
    private final EventBus eventBus;
    private final ExecutorService writer;
    private final List<EventBus.Subscription> subscriptions = new ArrayList<>();

    private volatile Index index = new Index();

    public MultiLevelCacheManager(TopicConfigurationRepository topicRepository,
                                  NamespaceConfigurationRepository namespaceRepository,
                                  EventBus eventBus) {
        this.topicRepository = topicRepository;
        this.namespaceRepository = namespaceRepository;
        this.eventBus = eventBus;
        this.writer = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "uns-cache-writer");
            thread.setDaemon(true);
            return thread;
        });
    }

    @PostConstruct
    public void start() {
        subscriptions.add(eventBus.subscribe(TopicDiscovered.class,
                event -> submit(() -> refreshTopic(event.getTopic(), event.getSourceType(), event.getConnectionId()))));
        subscriptions.add(eventBus.subscribe(TopicAutoMapped.class,
                event -> submit(() -> refreshTopic(event.getTopic(), null, null))));
        subscriptions.add(eventBus.subscribe(TopicConfigurationChanged.class,
                event -> submit(() -> onConfigurationChanged(event))));
        subscriptions.add(eventBus.subscribe(NamespaceStructureChanged.class,
                event -> submit(this::rebuild)));
        submit(this::rebuild);
    }

    @PreDestroy
    public void shutdown() {
        subscriptions.forEach(EventBus.Subscription::close);
        subscriptions.clear();
        writer.shutdown();
        try {
            if (!writer.awaitTermination(2, TimeUnit.SECONDS)) {
                writer.shutdownNow();
            }
        } catch (InterruptedException e) {
            writer.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Rebuilds the index from the repositories, healing any drift caused by lost events.
     */
    @Scheduled(fixedDelayString = "${uns.cache.reconciliation-interval-ms:60000}",
            initialDelayString = "${uns.cache.reconciliation-interval-ms:60000}")
    public void reconcile() {
        submit(() -> {
            int before = index.byTopic.size();
            rebuild();
            log.debug("Cache reconciled: entriesBefore={}, entriesAfter={}", before, index.byTopic.size());
        });
    }

    public Optional<CacheEntry> getEntry(String topic) {
        if (topic == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(index.byTopic.get(topic));
    }

    public List<CacheEntry> getAll() {
        return sorted(index.byTopic.values());
    }

    /**
     * Topics whose namespace path equals or lies below the given serialized path prefix.
     *
     * @param pathPrefix serialized path such as "Acme/Dallas"
     */
    public Set<String> getTopicsUnder(String pathPrefix) {
        if (pathPrefix == null || pathPrefix.isBlank()) {
            return Set.of();
        }
        Set<String> topics = index.byPathPrefix.get(normalize(pathPrefix));
        return topics == null ? Set.of() : Set.copyOf(topics);
    }

    public List<CacheEntry> getEntriesUnder(String pathPrefix) {
        Index current = index;
        Set<String> topics = current.byPathPrefix.get(normalize(pathPrefix == null ? "" : pathPrefix));
        if (topics == null) {
            return List.of();
        }
        return sorted(topics.stream()
                .map(current.byTopic::get)
                .filter(entry -> entry != null)
                .collect(Collectors.toList()));
    }

    public List<CacheEntry> getUnmapped() {
        return sorted(index.byTopic.values().stream()
                .filter(entry -> !entry.isMapped())
                .collect(Collectors.toList()));
    }

    public int size() {
        return index.byTopic.size();
    }

    /**
     * Waits until every mutation submitted so far has been applied.
     *
     * @return true if the writer caught up within the timeout
     */
    public boolean awaitIdle(Duration timeout) {
        try {
            Future<?> marker = writer.submit(() -> { });
            marker.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException | TimeoutException | RejectedExecutionException e) {
            return false;
        }
    }

    private void submit(Runnable mutation) {
        try {
            writer.execute(() -> {
                try {
                    mutation.run();
                } catch (RuntimeException e) {
                    log.error("Cache update failed: error={}", e.getMessage(), e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("Cache writer is shut down, skipping update");
        }
    }

    private void onConfigurationChanged(TopicConfigurationChanged event) {
        if (event.getChangeType() == TopicConfigurationChanged.ChangeType.DELETED) {
            index.remove(event.getTopic());
            log.debug("Cache entry removed: topic={}", event.getTopic());
            return;
        }
        refreshTopic(event.getTopic(), null, null);
    }

    private void refreshTopic(String topic, String sourceType, String connectionId) {
        Optional<TopicConfiguration> stored = topicRepository.findByTopic(topic);
        CacheEntry entry;
        if (stored.isPresent()) {
            TopicConfiguration configuration = stored.get();
            entry = CacheEntry.from(configuration, namespaceAt(configuration.getPath()));
        } else if (sourceType != null) {
            // discovered before its record is visible; listed as unmapped until the next refresh
            entry = CacheEntry.from(TopicConfiguration.discovered(topic, sourceType, connectionId, Instant.now()), null);
        } else {
            index.remove(topic);
            return;
        }
        index.put(entry);
        log.debug("Cache entry refreshed: topic={}, nsPath={}", topic, entry.getNsPath());
    }

    private void rebuild() {
        Map<HierarchicalPath, NamespaceConfiguration> namespaces = new HashMap<>();
        for (NamespaceConfiguration namespace : namespaceRepository.findAll()) {
            if (namespace.isActive() && namespace.getPath() != null) {
                namespaces.putIfAbsent(namespace.getPath(), namespace);
            }
        }
        Index fresh = new Index();
        for (TopicConfiguration configuration : topicRepository.findAll()) {
            fresh.put(CacheEntry.from(configuration, namespaces.get(configuration.getPath())));
        }
        index = fresh;
        log.info("Cache rebuilt: topics={}, pathPrefixes={}", fresh.byTopic.size(), fresh.byPathPrefix.size());
    }

    private NamespaceConfiguration namespaceAt(HierarchicalPath path) {
        if (path.isEmpty()) {
            return null;
        }
        return namespaceRepository.findByPath(path).stream()
                .filter(NamespaceConfiguration::isActive)
                .findFirst()
                .orElse(null);
    }

    private static String normalize(String pathPrefix) {
        String trimmed = pathPrefix.trim();
        while (trimmed.startsWith(HierarchicalPath.SEPARATOR)) {
            trimmed = trimmed.substring(1);
        }
        while (trimmed.endsWith(HierarchicalPath.SEPARATOR)) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    private static List<CacheEntry> sorted(Collection<CacheEntry> entries) {
        List<CacheEntry> list = new ArrayList<>(entries);
        list.sort(Comparator.comparing(CacheEntry::getTopic));
        return list;
    }

    /**
     * Topic index plus the ancestor-prefix index. Mutated only by the writer thread.
     */
    private static final class Index {

        private final Map<String, CacheEntry> byTopic = new ConcurrentHashMap<>();
        private final Map<String, Set<String>> byPathPrefix = new ConcurrentHashMap<>();

        private void put(CacheEntry entry) {
            remove(entry.getTopic());
            byTopic.put(entry.getTopic(), entry);
            HierarchicalPath path = entry.getPath();
            for (int depth = 1; depth <= path.depth(); depth++) {
                byPathPrefix.computeIfAbsent(path.truncate(depth).getFullPath(), key -> ConcurrentHashMap.newKeySet())
                        .add(entry.getTopic());
            }
        }

        private void remove(String topic) {
            CacheEntry previous = byTopic.remove(topic);
            if (previous == null) {
                return;
            }
            HierarchicalPath path = previous.getPath();
            for (int depth = 1; depth <= path.depth(); depth++) {
                String prefix = path.truncate(depth).getFullPath();
                Set<String> topics = byPathPrefix.get(prefix);
                if (topics != null) {
                    topics.remove(topic);
                    if (topics.isEmpty()) {
                        byPathPrefix.remove(prefix);
                    }
                }
            }
        }
    }
}

package com.koni.uns.application.mapping;

import com.koni.uns.application.namespace.HierarchyService;
import com.koni.uns.domain.model.HierarchicalPath;
import com.koni.uns.domain.model.HierarchyConfiguration;
import com.koni.uns.domain.model.TopicConfiguration;
import com.koni.uns.domain.repository.TopicConfigurationRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Decides where a topic belongs in the hierarchy.
 *
 * Steps, in order:
 * 1. Reuse the existing mapping of the exact topic while it is still valid
 * 2. Strip the configured global prefixes, then evaluate patterns in policy order;
 *    the first pattern that matches and aligns with the active hierarchy wins
 * 3. Check the AllowTopics policy of the resolved node (optionally walking up to an allowed ancestor)
 *
 * The mapper never assigns anything. Publishing the outcome is left to {@link AutoMappingService}.
 */
@Slf4j
@Component
public class AutoTopicMapper {

    private final AutoMappingProperties properties;
    private final HierarchyService hierarchyService;
    private final TopicConfigurationRepository topicRepository;
    private final List<MappingPattern> patterns;
    private final List<String> stripPrefixes;
    private final Map<String, HierarchicalPath> mappingCache = new ConcurrentHashMap<>();

    public AutoTopicMapper(AutoMappingProperties properties, HierarchyService hierarchyService,
                           TopicConfigurationRepository topicRepository) {
        this.properties = properties;
        this.hierarchyService = hierarchyService;
        this.topicRepository = topicRepository;
        this.patterns = compilePatterns(properties);
        this.stripPrefixes = properties.getStripPrefixes().stream()
                .filter(prefix -> prefix != null && !prefix.isBlank())
                .sorted(Comparator.comparingInt(String::length).reversed())
                .collect(Collectors.toList());

        log.info("Auto topic mapper initialized: patterns={}, matchOrder={}, stripPrefixes={}",
                patterns.size(), properties.getMatchOrder(), stripPrefixes);
    }

    /**
     * Tries to resolve the hierarchy path of a topic. Only the topic string takes part in the
     * decision; the sample payload is accepted for connectors that pass it along.
     *
     * @param topic the raw topic
     * @param samplePayload a value received on the topic, may be null
     * @return the mapping outcome, never null
     */
    public MappingResult tryMapTopic(String topic, Object samplePayload) {
        if (topic == null || topic.isBlank()) {
            return MappingResult.unmatched(topic, "Topic is blank");
        }

        Optional<HierarchicalPath> existing = findExistingMapping(topic);
        if (existing.isPresent()) {
            log.debug("Reusing existing mapping: topic={}, path={}", topic, existing.get());
            return MappingResult.cached(topic, existing.get());
        }

        HierarchyConfiguration hierarchy = hierarchyService.getActiveHierarchy();
        String stripped = stripPrefix(topic);

        List<MappingPattern> matching = new ArrayList<>();
        List<HierarchicalPath> paths = new ArrayList<>();
        for (MappingPattern pattern : patterns) {
            if (!isAligned(pattern, hierarchy)) {
                log.debug("Skipping pattern not aligned with hierarchy: pattern={}, levels={}",
                        pattern.getName(), pattern.getLevelNames());
                continue;
            }
            pattern.match(stripped, properties.isCaseSensitive()).ifPresent(values -> {
                matching.add(pattern);
                paths.add(hierarchy.createPath(values));
            });
        }

        if (matching.isEmpty()) {
            log.debug("No mapping pattern matched: topic={}", topic);
            return MappingResult.unmatched(topic, "No mapping pattern matched");
        }
        if (matching.size() > 1) {
            log.warn("Ambiguous mapping, first pattern wins: topic={}, patterns={}", topic,
                    matching.stream().map(MappingPattern::getName).collect(Collectors.toList()));
        }

        MappingPattern winner = matching.get(0);
        HierarchicalPath path = paths.get(0);

        if (!hierarchyService.isTopicAssignmentAllowed(path)) {
            if (!properties.isFallbackToAllowedAncestor()) {
                log.info("Topics not allowed at resolved node, leaving topic unmapped: topic={}, path={}", topic, path);
                return MappingResult.unmatched(topic, "Topics are not allowed at " + path);
            }
            Optional<HierarchicalPath> ancestor = hierarchyService.findNearestAllowedAncestor(path.parent());
            if (ancestor.isEmpty()) {
                log.info("No ancestor accepts topics, leaving topic unmapped: topic={}, path={}", topic, path);
                return MappingResult.unmatched(topic, "Topics are not allowed at " + path + " or any ancestor");
            }
            log.info("Falling back to allowed ancestor: topic={}, resolved={}, ancestor={}", topic, path, ancestor.get());
            path = ancestor.get();
        }

        mappingCache.put(topic, path);
        log.info("Topic mapped: topic={}, path={}, pattern={}", topic, path, winner.getName());
        return MappingResult.matched(topic, path, winner.getName());
    }

    /**
     * Forgets all remembered mappings, e.g. after a hierarchy change.
     */
    public void invalidate() {
        mappingCache.clear();
    }

    public void invalidate(String topic) {
        mappingCache.remove(topic);
    }

    public List<MappingPattern> getPatterns() {
        return patterns;
    }

    private Optional<HierarchicalPath> findExistingMapping(String topic) {
        HierarchicalPath cached = mappingCache.get(topic);
        HierarchicalPath candidate = cached != null
                ? cached
                : topicRepository.findByTopic(topic)
                        .filter(TopicConfiguration::isMapped)
                        .map(TopicConfiguration::getPath)
                        .orElse(null);
        if (candidate == null) {
            return Optional.empty();
        }
        if (hierarchyService.isTopicAssignmentAllowed(candidate)) {
            return Optional.of(candidate);
        }
        log.debug("Existing mapping no longer valid: topic={}, path={}", topic, candidate);
        mappingCache.remove(topic);
        return Optional.empty();
    }

    private String stripPrefix(String topic) {
        for (String prefix : stripPrefixes) {
            boolean matches = properties.isCaseSensitive()
                    ? topic.startsWith(prefix)
                    : topic.toLowerCase(Locale.ROOT).startsWith(prefix.toLowerCase(Locale.ROOT));
            if (!matches) {
                continue;
            }
            String stripped = topic.substring(prefix.length());
            if (prefix.endsWith("/") || stripped.isEmpty()) {
                return stripped;
            }
            // prefix must end on a segment boundary
            if (stripped.startsWith("/")) {
                return stripped.substring(1);
            }
        }
        return topic;
    }

    private static boolean isAligned(MappingPattern pattern, HierarchyConfiguration hierarchy) {
        List<String> levels = hierarchy.getLevelNames();
        List<String> placeholders = pattern.getLevelNames();
        if (placeholders.size() > levels.size()) {
            return false;
        }
        for (int i = 0; i < placeholders.size(); i++) {
            if (!placeholders.get(i).equalsIgnoreCase(levels.get(i))) {
                return false;
            }
        }
        return true;
    }

    private static List<MappingPattern> compilePatterns(AutoMappingProperties properties) {
        List<MappingPattern> compiled = new ArrayList<>();
        List<AutoMappingProperties.Pattern> configured = properties.getPatterns();
        for (int i = 0; i < configured.size(); i++) {
            AutoMappingProperties.Pattern pattern = configured.get(i);
            compiled.add(MappingPattern.compile(pattern.getName(), pattern.getTemplate(), pattern.getPrefix(),
                    pattern.getPriority(), i));
        }

        Comparator<MappingPattern> order;
        if (properties.getMatchOrder() == AutoMappingProperties.MatchOrder.SPECIFICITY) {
            order = Comparator.comparingInt(MappingPattern::getPrefixLength).reversed()
                    .thenComparing(Comparator.comparingInt(MappingPattern::getLiteralCount).reversed())
                    .thenComparingInt(MappingPattern::getDeclarationIndex);
        } else {
            order = Comparator.comparingInt(MappingPattern::getPriority)
                    .thenComparingInt(MappingPattern::getDeclarationIndex);
        }
        compiled.sort(order);
        return List.copyOf(compiled);
    }
}

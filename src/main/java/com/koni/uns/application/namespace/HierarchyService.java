package com.koni.uns.application.namespace;

import com.koni.uns.application.port.EventBus;
import com.koni.uns.domain.event.NamespaceStructureChanged;
import com.koni.uns.domain.exception.NotFoundException;
import com.koni.uns.domain.exception.ValidationException;
import com.koni.uns.domain.model.HierarchicalPath;
import com.koni.uns.domain.model.HierarchyConfiguration;
import com.koni.uns.domain.model.HierarchyNode;
import com.koni.uns.domain.model.NamespaceConfiguration;
import com.koni.uns.domain.model.ValidationResult;
import com.koni.uns.domain.repository.HierarchyConfigurationRepository;
import com.koni.uns.domain.repository.NamespaceConfigurationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Application service owning the hierarchy and the namespace set.
 *
 * Responsibilities:
 * - Validate and replace the active hierarchy
 * - Create, update and delete namespaces (parents are id references, cycles are rejected)
 * - Decide whether topics may be assigned at a path (AllowTopics policy)
 * - Publish NamespaceStructureChanged after every structural change
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HierarchyService {

    static final int MAX_NAMESPACE_DEPTH = 64;

    private final HierarchyConfigurationRepository hierarchyRepository;
    private final NamespaceConfigurationRepository namespaceRepository;
    private final EventBus eventBus;

    public HierarchyConfiguration getActiveHierarchy() {
        return hierarchyRepository.getActive();
    }

    /**
     * Replaces the active hierarchy.
     *
     * @param configuration the new hierarchy
     * @throws ValidationException if the hierarchy is malformed
     */
    public void updateHierarchy(HierarchyConfiguration configuration) {
        if (configuration == null) {
            throw new ValidationException("Hierarchy configuration cannot be null");
        }
        ValidationResult result = configuration.validate();
        if (!result.isValid()) {
            throw new ValidationException("Invalid hierarchy: " + result.getErrorMessage());
        }
        hierarchyRepository.setActive(configuration);
        log.info("Hierarchy updated: id={}, levels={}", configuration.getId(), configuration.getLevelNames());
        eventBus.publish(new NamespaceStructureChanged("hierarchy updated"));
    }

    public List<NamespaceConfiguration> getNamespaces() {
        return namespaceRepository.findAll();
    }

    public NamespaceConfiguration getNamespace(String id) {
        return namespaceRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("Namespace not found: " + id));
    }

    /**
     * Creates or replaces a namespace.
     *
     * @param namespace the namespace to save
     * @return the stored namespace with timestamps set
     * @throws ValidationException if the path references undefined levels, the parent is unknown,
     *         or the parent chain would contain a cycle
     */
    public NamespaceConfiguration saveNamespace(NamespaceConfiguration namespace) {
        validateNamespace(namespace);

        Instant now = Instant.now();
        Instant createdAt = namespaceRepository.findById(namespace.getId())
                .map(NamespaceConfiguration::getCreatedAt)
                .orElse(now);
        NamespaceConfiguration stored = namespace.toBuilder()
                .createdAt(createdAt)
                .modifiedAt(now)
                .build();
        namespaceRepository.save(stored);

        log.info("Namespace saved: id={}, name={}, type={}, path={}",
                stored.getId(), stored.getName(), stored.getType(), stored.getPath());
        eventBus.publish(new NamespaceStructureChanged("namespace " + stored.getId() + " saved"));
        return stored;
    }

    /**
     * Deletes a namespace that has no child namespaces.
     *
     * @throws NotFoundException if the namespace does not exist
     * @throws ValidationException if other namespaces reference it as parent
     */
    public void deleteNamespace(String id) {
        getNamespace(id);
        boolean hasChildren = namespaceRepository.findAll().stream()
                .anyMatch(namespace -> id.equals(namespace.getParentNamespaceId()));
        if (hasChildren) {
            throw new ValidationException("Namespace " + id + " still has child namespaces");
        }
        namespaceRepository.delete(id);
        log.info("Namespace deleted: id={}", id);
        eventBus.publish(new NamespaceStructureChanged("namespace " + id + " deleted"));
    }

    /**
     * Resolves the parent chain of a namespace by id lookup, root first.
     *
     * @throws NotFoundException if the namespace does not exist
     * @throws ValidationException if the chain contains a cycle or is deeper than the guard allows
     */
    public List<NamespaceConfiguration> resolveAncestry(String namespaceId) {
        List<NamespaceConfiguration> chain = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        NamespaceConfiguration current = getNamespace(namespaceId);
        while (current != null) {
            if (!visited.add(current.getId()) || visited.size() > MAX_NAMESPACE_DEPTH) {
                throw new ValidationException("Cycle detected in namespace ancestry of " + namespaceId);
            }
            chain.add(current);
            current = current.hasParent()
                    ? namespaceRepository.findById(current.getParentNamespaceId()).orElse(null)
                    : null;
        }
        Collections.reverse(chain);
        return chain;
    }

    /**
     * @return the first active namespace anchored exactly at the path
     */
    public Optional<NamespaceConfiguration> findNamespaceAt(HierarchicalPath path) {
        if (path == null || path.isEmpty()) {
            return Optional.empty();
        }
        return namespaceRepository.findByPath(path).stream()
                .filter(NamespaceConfiguration::isActive)
                .findFirst();
    }

    /**
     * Whether topics may be assigned at the path.
     *
     * The path must fit the active hierarchy. An active namespace anchored at the path decides
     * when it sets AllowTopics; otherwise the flag of the deepest populated level applies.
     */
    public boolean isTopicAssignmentAllowed(HierarchicalPath path) {
        HierarchyConfiguration hierarchy = hierarchyRepository.getActive();
        if (path == null || path.isEmpty() || !hierarchy.isValidPath(path)) {
            return false;
        }
        Optional<Boolean> namespaceOverride = findNamespaceAt(path)
                .map(NamespaceConfiguration::getAllowTopics);
        if (namespaceOverride.isPresent()) {
            return namespaceOverride.get();
        }
        return hierarchy.findLevel(path.getDeepestLevel())
                .map(HierarchyNode::isAllowTopics)
                .orElse(false);
    }

    /**
     * Walks up from the path and returns the nearest ancestor (or the path itself) that accepts topics.
     */
    public Optional<HierarchicalPath> findNearestAllowedAncestor(HierarchicalPath path) {
        HierarchicalPath current = path;
        while (current != null && !current.isEmpty()) {
            if (isTopicAssignmentAllowed(current)) {
                return Optional.of(current);
            }
            current = current.parent();
        }
        return Optional.empty();
    }

    private void validateNamespace(NamespaceConfiguration namespace) {
        if (namespace == null) {
            throw new ValidationException("Namespace cannot be null");
        }
        if (isBlank(namespace.getId()) || isBlank(namespace.getName())) {
            throw new ValidationException("Namespace id and name are required");
        }
        if (namespace.getType() == null) {
            throw new ValidationException("Namespace type is required");
        }
        HierarchyConfiguration hierarchy = hierarchyRepository.getActive();
        if (namespace.getPath() == null || namespace.getPath().isEmpty() || !hierarchy.isValidPath(namespace.getPath())) {
            throw new ValidationException("Namespace path " + namespace.getPath()
                    + " does not match hierarchy levels " + hierarchy.getLevelNames());
        }
        if (!namespace.hasParent()) {
            return;
        }
        Set<String> visited = new HashSet<>();
        visited.add(namespace.getId());
        String parentId = namespace.getParentNamespaceId();
        while (parentId != null) {
            if (!visited.add(parentId) || visited.size() > MAX_NAMESPACE_DEPTH) {
                throw new ValidationException("Namespace " + namespace.getId() + " would create a parent cycle");
            }
            NamespaceConfiguration parent = namespaceRepository.findById(parentId)
                    .orElseThrow(() -> new ValidationException(
                            "Unknown parent namespace " + namespace.getParentNamespaceId()));
            parentId = parent.hasParent() ? parent.getParentNamespaceId() : null;
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

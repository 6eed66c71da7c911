package com.koni.uns.domain.model;

import com.koni.uns.domain.exception.ValidationException;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Ordered list of hierarchy level definitions.
 * Every {@link HierarchicalPath} accepted by the pipeline is created or checked against
 * the active configuration, so a path can never reference an undefined level.
 */
@Getter
@EqualsAndHashCode
@ToString
public class HierarchyConfiguration {

    private final String id;
    private final String name;
    private final List<HierarchyNode> nodes;

    public HierarchyConfiguration(String id, String name, List<HierarchyNode> nodes) {
        this.id = id;
        this.name = name;
        this.nodes = nodes == null ? List.of() : nodes.stream()
                .sorted(Comparator.comparingInt(HierarchyNode::getOrder))
                .collect(Collectors.toUnmodifiableList());
    }

    public List<String> getLevelNames() {
        return nodes.stream().map(HierarchyNode::getName).collect(Collectors.toList());
    }

    public int getLevelCount() {
        return nodes.size();
    }

    public Optional<HierarchyNode> findLevel(String levelName) {
        return nodes.stream()
                .filter(node -> node.getName().equalsIgnoreCase(levelName))
                .findFirst();
    }

    /**
     * @return zero-based position of the level, or -1 when it is not defined
     */
    public int indexOf(String levelName) {
        for (int i = 0; i < nodes.size(); i++) {
            if (nodes.get(i).getName().equalsIgnoreCase(levelName)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Checks level names, parent references and parent cycles.
     */
    public ValidationResult validate() {
        List<String> errors = new ArrayList<>();
        if (nodes.isEmpty()) {
            errors.add("Hierarchy must define at least one level");
            return new ValidationResult(errors, List.of());
        }

        Map<String, HierarchyNode> byId = new HashMap<>();
        Set<String> names = new HashSet<>();
        for (HierarchyNode node : nodes) {
            if (node.getId() == null || node.getId().isBlank()) {
                errors.add("Hierarchy level id cannot be blank");
                continue;
            }
            if (node.getName() == null || node.getName().isBlank()) {
                errors.add("Hierarchy level " + node.getId() + " has no name");
                continue;
            }
            if (byId.put(node.getId(), node) != null) {
                errors.add("Duplicate hierarchy level id: " + node.getId());
            }
            if (!names.add(node.getName().toLowerCase(Locale.ROOT))) {
                errors.add("Duplicate hierarchy level name: " + node.getName());
            }
        }

        long roots = nodes.stream().filter(HierarchyNode::isRoot).count();
        if (roots != 1) {
            errors.add("Hierarchy must have exactly one root level, found " + roots);
        }

        for (HierarchyNode node : nodes) {
            if (node.isRoot()) {
                continue;
            }
            if (!byId.containsKey(node.getParentNodeId())) {
                errors.add("Level " + node.getName() + " references unknown parent " + node.getParentNodeId());
                continue;
            }
            Set<String> visited = new HashSet<>();
            HierarchyNode current = node;
            while (current != null && !current.isRoot()) {
                if (!visited.add(current.getId())) {
                    errors.add("Cycle detected in hierarchy at level " + node.getName());
                    break;
                }
                current = byId.get(current.getParentNodeId());
            }
        }
        return new ValidationResult(errors, List.of());
    }

    /**
     * Assigns values to levels in order, starting at the root.
     *
     * @throws ValidationException if more values than levels are supplied
     */
    public HierarchicalPath createPath(List<String> values) {
        if (values.size() > nodes.size()) {
            throw new ValidationException("Path has " + values.size() + " levels but hierarchy "
                    + name + " defines only " + nodes.size());
        }
        LinkedHashMap<String, String> levels = new LinkedHashMap<>();
        for (int i = 0; i < values.size(); i++) {
            levels.put(nodes.get(i).getName(), values.get(i));
        }
        return HierarchicalPath.of(levels);
    }

    /**
     * Parses a serialized NSPath such as "Enterprise/Dallas/Press".
     */
    public HierarchicalPath parsePath(String fullPath) {
        if (fullPath == null || fullPath.isBlank()) {
            return HierarchicalPath.empty();
        }
        List<String> values = new ArrayList<>();
        for (String segment : fullPath.split(HierarchicalPath.SEPARATOR)) {
            if (!segment.isBlank()) {
                values.add(segment);
            }
        }
        return createPath(values);
    }

    /**
     * Whether every populated level of the path is defined here, in hierarchy order, without gaps.
     */
    public boolean isValidPath(HierarchicalPath path) {
        if (path == null) {
            return false;
        }
        List<String> levelNames = path.getLevelNames();
        if (levelNames.size() > nodes.size()) {
            return false;
        }
        for (int i = 0; i < levelNames.size(); i++) {
            if (!nodes.get(i).getName().equalsIgnoreCase(levelNames.get(i))) {
                return false;
            }
        }
        return true;
    }

    public void requireValidPath(HierarchicalPath path) {
        if (!isValidPath(path)) {
            throw new ValidationException("Path " + path + " does not match hierarchy levels " + getLevelNames());
        }
    }
}

package com.koni.uns.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable ordered set of named hierarchy levels, e.g. Enterprise=Acme, Site=Dallas, Area=Press.
 *
 * Only populated levels are kept. Two paths are equal when all populated levels match.
 * Level names are not checked here; {@link HierarchyConfiguration} creates and validates
 * paths against the active level definitions.
 */
public final class HierarchicalPath {

    public static final String SEPARATOR = "/";

    private static final HierarchicalPath EMPTY = new HierarchicalPath(new LinkedHashMap<>());

    private final Map<String, String> levels;

    private HierarchicalPath(LinkedHashMap<String, String> levels) {
        this.levels = Collections.unmodifiableMap(levels);
    }

    public static HierarchicalPath empty() {
        return EMPTY;
    }

    /**
     * Creates a path from an ordered level-name to value map. Blank values are skipped.
     */
    public static HierarchicalPath of(Map<String, String> orderedLevels) {
        if (orderedLevels == null || orderedLevels.isEmpty()) {
            return EMPTY;
        }
        LinkedHashMap<String, String> copy = new LinkedHashMap<>();
        orderedLevels.forEach((level, value) -> {
            if (level != null && value != null && !value.isBlank()) {
                copy.put(level, value.trim());
            }
        });
        return copy.isEmpty() ? EMPTY : new HierarchicalPath(copy);
    }

    public Map<String, String> getLevels() {
        return levels;
    }

    public String getValue(String levelName) {
        return levels.get(levelName);
    }

    public List<String> getLevelNames() {
        return new ArrayList<>(levels.keySet());
    }

    public List<String> getValues() {
        return new ArrayList<>(levels.values());
    }

    /**
     * @return the populated values joined with "/", e.g. "Enterprise/Dallas/Press"
     */
    public String getFullPath() {
        return String.join(SEPARATOR, levels.values());
    }

    public int depth() {
        return levels.size();
    }

    public boolean isEmpty() {
        return levels.isEmpty();
    }

    /**
     * @return name of the deepest populated level, or null for an empty path
     */
    public String getDeepestLevel() {
        String deepest = null;
        for (String level : levels.keySet()) {
            deepest = level;
        }
        return deepest;
    }

    /**
     * Returns the first {@code depth} levels of this path.
     */
    public HierarchicalPath truncate(int depth) {
        if (depth >= levels.size()) {
            return this;
        }
        LinkedHashMap<String, String> copy = new LinkedHashMap<>();
        int index = 0;
        for (Map.Entry<String, String> entry : levels.entrySet()) {
            if (index++ >= depth) {
                break;
            }
            copy.put(entry.getKey(), entry.getValue());
        }
        return copy.isEmpty() ? EMPTY : new HierarchicalPath(copy);
    }

    public HierarchicalPath parent() {
        return levels.isEmpty() ? EMPTY : truncate(levels.size() - 1);
    }

    /**
     * Whether every populated level of {@code prefix} matches this path, in order.
     */
    public boolean startsWith(HierarchicalPath prefix) {
        if (prefix == null || prefix.depth() > depth()) {
            return false;
        }
        return truncate(prefix.depth()).equals(prefix);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof HierarchicalPath)) {
            return false;
        }
        HierarchicalPath other = (HierarchicalPath) o;
        return new ArrayList<>(levels.entrySet()).equals(new ArrayList<>(other.levels.entrySet()));
    }

    @Override
    public int hashCode() {
        return levels.hashCode();
    }

    @Override
    public String toString() {
        return getFullPath();
    }
}

package com.koni.uns.application.mapping;

import com.koni.uns.domain.model.HierarchicalPath;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of one auto-mapping attempt.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class MappingResult {

    private final String topic;
    private final HierarchicalPath path;
    private final boolean matched;
    private final String patternName;
    private final String reason;
    private final boolean cached;

    public static MappingResult matched(String topic, HierarchicalPath path, String patternName) {
        return new MappingResult(topic, path, true, patternName, null, false);
    }

    public static MappingResult cached(String topic, HierarchicalPath path) {
        return new MappingResult(topic, path, true, null, null, true);
    }

    public static MappingResult unmatched(String topic, String reason) {
        return new MappingResult(topic, null, false, null, reason, false);
    }
}

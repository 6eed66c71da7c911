package com.koni.uns.domain.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * A named, typed namespace anchored at a hierarchy path.
 *
 * Nesting is expressed through {@code parentNamespaceId}, resolved by id lookup.
 * {@code allowTopics} overrides the AllowTopics flag of the hierarchy level at {@code path}
 * when set; null means the level flag applies.
 */
@Getter
@Builder(toBuilder = true)
@EqualsAndHashCode
@ToString
public class NamespaceConfiguration {

    private final String id;
    private final String name;
    private final NamespaceType type;
    private final String description;
    private final HierarchicalPath path;
    private final String parentNamespaceId;
    private final Boolean allowTopics;
    private final boolean active;
    private final Instant createdAt;
    private final Instant modifiedAt;

    public boolean hasParent() {
        return parentNamespaceId != null && !parentNamespaceId.isBlank();
    }
}

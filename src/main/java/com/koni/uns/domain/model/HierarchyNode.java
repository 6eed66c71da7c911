package com.koni.uns.domain.model;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One level definition of a hierarchy (Enterprise, Site, Area, ...).
 * The parent is referenced by id; {@code allowTopics} gates auto-assignment of topics at this level.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class HierarchyNode {

    private final String id;
    private final String name;
    private final int order;
    private final String parentNodeId;
    private final boolean allowTopics;
    private final String description;

    public boolean isRoot() {
        return parentNodeId == null || parentNodeId.isBlank();
    }
}

package com.koni.uns.application.query;

import com.koni.uns.domain.model.NamespaceConfiguration;
import com.koni.uns.domain.model.NamespaceType;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Getter
@NoArgsConstructor
@AllArgsConstructor
public class NamespaceResponse {

    private String id;
    private String name;
    private NamespaceType type;
    private String description;
    private String path;
    private String parentNamespaceId;
    private Boolean allowTopics;
    private boolean active;
    private Instant createdAt;
    private Instant modifiedAt;

    public static NamespaceResponse from(NamespaceConfiguration namespace) {
        return new NamespaceResponse(
                namespace.getId(),
                namespace.getName(),
                namespace.getType(),
                namespace.getDescription(),
                namespace.getPath() == null ? null : namespace.getPath().getFullPath(),
                namespace.getParentNamespaceId(),
                namespace.getAllowTopics(),
                namespace.isActive(),
                namespace.getCreatedAt(),
                namespace.getModifiedAt());
    }
}

package com.koni.uns.infrastructure.web.dto;

import com.koni.uns.domain.model.NamespaceType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Request body for creating or replacing a namespace.
 *
 * {@code path} is a serialized hierarchy path such as "Acme/Dallas/Press". {@code allowTopics}
 * overrides the level flag when set.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class NamespaceRequest {

    @NotBlank(message = "id is required")
    private String id;

    @NotBlank(message = "name is required")
    private String name;

    @NotNull(message = "type is required")
    private NamespaceType type;

    private String description;

    @NotBlank(message = "path is required")
    private String path;

    private String parentNamespaceId;

    private Boolean allowTopics;

    private boolean active = true;
}
